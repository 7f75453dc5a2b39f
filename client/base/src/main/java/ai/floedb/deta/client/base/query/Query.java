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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Query over a Base: an OR of AND-groups plus page controls.
 *
 * <p>Predicates go into the current group. {@link #union(Query)} and {@link #append(QueryGroup)}
 * add further OR branches ahead of it. On the wire the current group is always the last element
 * of {@code query}, even when empty:
 *
 * <pre>{"limit": 1000, "last": "...", "sort": "desc", "query": [{...}, ..., {current}]}</pre>
 *
 * <p>{@code limit} is sent as {@value #DEFAULT_LIMIT} while unset; a full walk requires it to stay
 * unset. Instances are mutable and not thread-safe; the client never mutates a query it has sent,
 * it sends a {@link #copy()}.
 */
public final class Query {
  public static final int DEFAULT_LIMIT = 1000;

  private final List<QueryGroup> unioned;
  private QueryGroup current;
  private Integer limit;
  private String last;
  private boolean descending;

  public Query() {
    this.unioned = new ArrayList<>();
    this.current = new QueryGroup();
  }

  private Query(Query other) {
    this.unioned = new ArrayList<>(other.unioned.size());
    other.unioned.forEach(g -> this.unioned.add(g.copy()));
    this.current = other.current.copy();
    this.limit = other.limit;
    this.last = other.last;
    this.descending = other.descending;
  }

  public Query copy() {
    return new Query(this);
  }

  public Query set(Comparator comparator, String field, Object value) {
    current.set(comparator, field, value);
    return this;
  }

  public Query where(Filter filter) {
    current.set(filter);
    return this;
  }

  public Query equalTo(String field, Object value) {
    return set(Comparator.EQUALS, field, value);
  }

  public Query notEqualTo(String field, Object value) {
    return set(Comparator.NOT_EQUALS, field, value);
  }

  public Query greaterThan(String field, Object value) {
    return set(Comparator.GREATER_THAN, field, value);
  }

  public Query greaterThanOrEqualTo(String field, Object value) {
    return set(Comparator.GREATER_THAN_OR_EQUALS, field, value);
  }

  public Query lessThan(String field, Object value) {
    return set(Comparator.LESS_THAN, field, value);
  }

  public Query lessThanOrEqualTo(String field, Object value) {
    return set(Comparator.LESS_THAN_OR_EQUALS, field, value);
  }

  /** Inclusive on both ends. */
  public Query range(String field, Object from, Object to) {
    ArrayNode bounds = JsonValues.array();
    bounds.add(JsonValues.toNode(from));
    bounds.add(JsonValues.toNode(to));
    return set(Comparator.RANGE, field, bounds);
  }

  public Query contains(String field, Object value) {
    return set(Comparator.CONTAINS, field, value);
  }

  public Query notContains(String field, Object value) {
    return set(Comparator.NOT_CONTAINS, field, value);
  }

  public Query prefix(String field, String prefix) {
    return set(Comparator.PREFIX, field, prefix);
  }

  /** Adds other's groups, then other's current group, as OR branches. Other is copied. */
  public Query union(Query other) {
    Objects.requireNonNull(other, "other");
    Query o = other.copy();
    unioned.addAll(o.unioned);
    unioned.add(o.current);
    return this;
  }

  /** Adds a hand-built group as an OR branch. */
  public Query append(QueryGroup group) {
    Objects.requireNonNull(group, "group");
    unioned.add(group.copy());
    return this;
  }

  public Query limit(int limit) {
    this.limit = limit;
    return this;
  }

  public Query unlimited() {
    this.limit = null;
    return this;
  }

  /** Cursor to resume from; null or empty clears it. */
  public Query last(String cursor) {
    this.last = (cursor == null || cursor.isEmpty()) ? null : cursor;
    return this;
  }

  public Query sort(boolean descending) {
    this.descending = descending;
    return this;
  }

  public OptionalInt limit() {
    return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
  }

  public Optional<String> last() {
    return Optional.ofNullable(last);
  }

  public boolean descending() {
    return descending;
  }

  /** Every OR branch in wire order, the current group last. */
  public List<QueryGroup> groups() {
    List<QueryGroup> out = new ArrayList<>(unioned.size() + 1);
    unioned.forEach(g -> out.add(g.copy()));
    out.add(current.copy());
    return Collections.unmodifiableList(out);
  }

  public ObjectNode toJson() {
    ObjectNode out = JsonValues.object();
    out.put("limit", limit == null ? DEFAULT_LIMIT : limit);
    if (last != null) {
      out.put("last", last);
    }
    if (descending) {
      out.put("sort", "desc");
    }
    ArrayNode query = out.putArray("query");
    unioned.forEach(g -> query.add(g.toJson()));
    query.add(current.toJson());
    return out;
  }

  @Override
  public String toString() {
    return toJson().toString();
  }
}
