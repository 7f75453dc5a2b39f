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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One record to write. The value must serialize to a JSON object; anything else is stored under
 * {@code value}. Without a key the service generates one. Expiry is written as {@code __expires} in
 * epoch seconds.
 */
public final class Item {
  static final String KEY = "key";
  static final String EXPIRES = "__expires";

  private final String key;
  private final ObjectNode value;
  private final Duration expireIn;
  private final Instant expireAt;

  private Item(Builder b) {
    this.key = b.key;
    this.value = b.value.deepCopy();
    this.expireIn = b.expireIn;
    this.expireAt = b.expireAt;
  }

  public static Item of(String key, Object value) {
    return builder().key(key).value(value).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<String> key() {
    return Optional.ofNullable(key);
  }

  public Optional<Duration> expireIn() {
    return Optional.ofNullable(expireIn);
  }

  public Optional<Instant> expireAt() {
    return Optional.ofNullable(expireAt);
  }

  public ObjectNode toJson(Clock clock) {
    ObjectNode out = value.deepCopy();
    if (key != null) {
      out.put(KEY, key);
    }
    if (expireIn != null) {
      out.put(EXPIRES, clock.instant().plus(expireIn).getEpochSecond());
    } else if (expireAt != null) {
      out.put(EXPIRES, expireAt.getEpochSecond());
    }
    return out;
  }

  public static final class Builder {
    private String key;
    private ObjectNode value = JsonValues.object();
    private Duration expireIn;
    private Instant expireAt;

    private Builder() {}

    public Builder key(String key) {
      this.key = key;
      return this;
    }

    public Builder value(Object v) {
      JsonNode node = JsonValues.toNode(v);
      if (node.isObject()) {
        this.value = (ObjectNode) node;
      } else {
        this.value = JsonValues.object();
        this.value.set("value", node);
      }
      return this;
    }

    public Builder field(String name, Object v) {
      value.set(Objects.requireNonNull(name, "name"), JsonValues.toNode(v));
      return this;
    }

    /** Relative expiry, resolved when the item is sent. Replaces any {@link #expireAt}. */
    public Builder expireIn(Duration ttl) {
      this.expireIn = Objects.requireNonNull(ttl, "ttl");
      this.expireAt = null;
      return this;
    }

    public Builder expireAt(Instant at) {
      this.expireAt = Objects.requireNonNull(at, "at");
      this.expireIn = null;
      return this;
    }

    public Item build() {
      if (key != null && key.isBlank()) {
        throw new IllegalArgumentException("key must not be blank");
      }
      return new Item(this);
    }
  }
}
