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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Outcome of {@link Drive#put}. An aborted chunked upload has {@code committed == false} and its
 * failed parts in {@link #session()}; {@code response} is the body of the last call made.
 */
public record UploadResult(
    String name,
    boolean committed,
    boolean chunked,
    UploadSession uploadSession,
    JsonNode response) {

  static UploadResult single(String name, JsonNode response) {
    return new UploadResult(name, true, false, null, response);
  }

  public Optional<UploadSession> session() {
    return Optional.ofNullable(uploadSession);
  }
}
