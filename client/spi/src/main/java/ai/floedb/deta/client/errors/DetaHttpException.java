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
package ai.floedb.deta.client.errors;

/** A non-2xx response from the service. */
public class DetaHttpException extends DetaException {
  private final int status;
  private final String detail;

  public DetaHttpException(int status, String detail) {
    super("HTTP " + status + (detail == null || detail.isBlank() ? "" : " " + detail));
    this.status = status;
    this.detail = detail == null ? "" : detail;
  }

  public int status() {
    return status;
  }

  public String detail() {
    return detail;
  }

  public static DetaHttpException forStatus(int status, String detail) {
    return switch (status) {
      case 400 -> new DetaBadRequestException(detail);
      case 401 -> new DetaUnauthorizedException(detail);
      case 404 -> new DetaNotFoundException(detail);
      case 409 -> new DetaConflictException(detail);
      case 413 -> new DetaPayloadTooLargeException(detail);
      default -> new DetaHttpException(status, detail);
    };
  }
}
