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
package ai.floedb.deta.client.base;

import ai.floedb.deta.client.common.JsonValues;
import ai.floedb.deta.client.common.UrlSupport;
import ai.floedb.deta.client.errors.DetaPayloadException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Partial update of one item. Repeating an operation on a field keeps the last value. A field
 * cannot be deleted and otherwise updated by the same updater.
 */
public final class Updater {
  private final String key;
  private final Base base;

  private final Map<String, JsonNode> set = new LinkedHashMap<>();
  private final Set<String> delete = new LinkedHashSet<>();
  private final Map<String, JsonNode> append = new LinkedHashMap<>();
  private final Map<String, JsonNode> prepend = new LinkedHashMap<>();
  private final Map<String, JsonNode> increment = new LinkedHashMap<>();

  public Updater(String key) {
    this(key, null);
  }

  Updater(String key, Base base) {
    this.key = UrlSupport.requireKey("key", key);
    this.base = base;
  }

  public String key() {
    return key;
  }

  public Updater set(String field, Object value) {
    set.put(field(field), JsonValues.toNode(value));
    return this;
  }

  public Updater delete(String... fields) {
    for (String f : fields) {
      delete.add(field(f));
    }
    return this;
  }

  /** Appends to an array field; a list value appends each element. */
  public Updater append(String field, Object value) {
    append.put(field(field), JsonValues.toNode(value));
    return this;
  }

  public Updater prepend(String field, Object value) {
    prepend.put(field(field), JsonValues.toNode(value));
    return this;
  }

  /** Use a negative delta to decrement. */
  public Updater increment(String field, Number delta) {
    increment.put(field(field), JsonValues.toNode(Objects.requireNonNull(delta, "delta")));
    return this;
  }

  public boolean isEmpty() {
    return set.isEmpty()
        && delete.isEmpty()
        && append.isEmpty()
        && prepend.isEmpty()
        && increment.isEmpty();
  }

  /** Sends the update through the base that created this updater. */
  public JsonNode commit() {
    if (base == null) {
      throw new IllegalStateException("Updater for " + key + " is not bound to a base");
    }
    return base.update(this);
  }

  public ObjectNode toJson() {
    if (isEmpty()) {
      throw new DetaPayloadException("update of " + key + " has no operations");
    }
    for (String f : delete) {
      if (set.containsKey(f)
          || append.containsKey(f)
          || prepend.containsKey(f)
          || increment.containsKey(f)) {
        throw new DetaPayloadException("field " + f + " is both deleted and updated");
      }
    }

    ObjectNode out = JsonValues.object();
    putIfNotEmpty(out, "set", set);
    if (!delete.isEmpty()) {
      ArrayNode arr = out.putArray("delete");
      delete.forEach(arr::add);
    }
    putIfNotEmpty(out, "append", append);
    putIfNotEmpty(out, "prepend", prepend);
    putIfNotEmpty(out, "increment", increment);
    return out;
  }

  private static void putIfNotEmpty(ObjectNode out, String op, Map<String, JsonNode> fields) {
    if (fields.isEmpty()) {
      return;
    }
    ObjectNode o = out.putObject(op);
    fields.forEach((k, v) -> o.set(k, v.deepCopy()));
  }

  private static String field(String f) {
    if (f == null || f.isBlank()) {
      throw new IllegalArgumentException("field must not be blank");
    }
    return f;
  }
}
