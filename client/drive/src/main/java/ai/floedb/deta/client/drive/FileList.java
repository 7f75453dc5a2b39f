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
import ai.floedb.deta.client.common.Paging;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** One page of file names from a drive listing. */
public record FileList(List<String> names, Paging paging) {
  public FileList {
    names = List.copyOf(names);
    Objects.requireNonNull(paging, "paging");
  }

  static FileList fromJson(JsonNode resp) {
    List<String> names = new ArrayList<>();
    JsonValues.elements(resp.path("names")).forEach(n -> names.add(n.asText()));
    return new FileList(names, Paging.fromJson(resp.path("paging"), names.size()));
  }
}
