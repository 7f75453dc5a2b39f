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
package ai.floedb.deta.client.drive;

import ai.floedb.deta.client.common.JsonValues;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Names the service removed, and the reason for each name it did not. */
public record DeleteResult(List<String> deleted, Map<String, String> failed) {
  public DeleteResult {
    deleted = List.copyOf(deleted);
    failed = Map.copyOf(failed);
  }

  static DeleteResult empty() {
    return new DeleteResult(List.of(), Map.of());
  }

  static DeleteResult fromJson(JsonNode resp) {
    List<String> deleted = new ArrayList<>();
    JsonValues.elements(resp.path("deleted")).forEach(n -> deleted.add(n.asText()));
    Map<String, String> failed = new LinkedHashMap<>();
    resp.path("failed")
        .fields()
        .forEachRemaining(e -> failed.put(e.getKey(), e.getValue().asText()));
    return new DeleteResult(deleted, failed);
  }

  public boolean allDeleted() {
    return failed.isEmpty();
  }
}
