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

import java.util.List;

/**
 * State of a chunked upload after its parts were sent. Part numbers are 1-based.
 *
 * @param uploadId id returned by the initiate call
 * @param targetName stored name of the file as reported by the initiate call
 */
public record UploadSession(
    String uploadId, String targetName, List<Integer> partsUploaded, List<Integer> failedParts) {
  public UploadSession {
    partsUploaded = List.copyOf(partsUploaded);
    failedParts = List.copyOf(failedParts);
  }

  public boolean allSucceeded() {
    return failedParts.isEmpty();
  }
}
