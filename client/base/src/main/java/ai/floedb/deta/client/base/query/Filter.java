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
import java.util.Objects;

public record Filter(String field, Comparator comparator, JsonNode value) {
  public Filter {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(comparator, "comparator");
    value = JsonValues.toNode(value);
  }

  public static Filter of(String field, Comparator comparator, Object value) {
    return new Filter(field, comparator, JsonValues.toNode(value));
  }

  public String key() {
    return comparator.key(field);
  }
}
