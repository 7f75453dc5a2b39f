/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.floedb.deta.client.base.query;

import ai.floedb.deta.client.common.JsonValues;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * AND of predicates keyed by {@code field[?op]}. Setting an existing key replaces its value in
 * place; distinct keys keep insertion order.
 */
public final class QueryGroup {
  private final LinkedHashMap<String, JsonNode> predicates = new LinkedHashMap<>();

  public QueryGroup() {}

  public static QueryGroup of(Filter... filters) {
    QueryGroup g = new QueryGroup();
    for (Filter f : filters) {
      g.set(f);
    }
    return g;
  }

  public QueryGroup set(Filter filter) {
    Objects.requireNonNull(filter, "filter");
    predicates.put(filter.key(), filter.value());
    return this;
  }

  public QueryGroup set(Comparator comparator, String field, Object value) {
    return set(Filter.of(field, comparator, value));
  }

  public Map<String, JsonNode> predicates() {
    return Collections.unmodifiableMap(predicates);
  }

  public boolean isEmpty() {
    return predicates.isEmpty();
  }

  public int size() {
    return predicates.size();
  }

  public QueryGroup copy() {
    QueryGroup g = new QueryGroup();
    predicates.forEach((k, v) -> g.predicates.put(k, v.deepCopy()));
    return g;
  }

  public ObjectNode toJson() {
    ObjectNode out = JsonValues.object();
    predicates.forEach((k, v) -> out.set(k, v.deepCopy()));
    return out;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof QueryGroup other && predicates.equals(other.predicates);
  }

  @Override
  public int hashCode() {
    return predicates.hashCode();
  }

  @Override
  public String toString() {
    return toJson().toString();
  }
}
