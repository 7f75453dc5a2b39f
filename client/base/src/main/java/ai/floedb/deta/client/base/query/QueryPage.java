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
import ai.floedb.deta.client.common.Paging;
import ai.floedb.deta.client.errors.DetaSerializationException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

public record QueryPage(Paging paging, List<JsonNode> items) {
  public QueryPage {
    Objects.requireNonNull(paging, "paging");
    items = List.copyOf(items);
  }

  public static QueryPage fromJson(JsonNode resp) {
    JsonNode items = resp.path("items");
    if (!items.isArray()) {
      throw new DetaSerializationException("Query response has no items array: " + resp);
    }
    return new QueryPage(
        Paging.fromJson(resp.path("paging"), items.size()), JsonValues.elements(items));
  }
}
