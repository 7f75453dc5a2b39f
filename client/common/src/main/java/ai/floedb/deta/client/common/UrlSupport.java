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
package ai.floedb.deta.client.common;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public final class UrlSupport {
  private UrlSupport() {}

  /** Percent-encodes one path segment or query value; spaces become {@code %20}. */
  public static String enc(String s) {
    return URLEncoder.encode(s, StandardCharsets.UTF_8)
        .replace("+", "%20")
        .replace("*", "%2A")
        .replace("%7E", "~");
  }

  public static String requireKey(String what, String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException(what + " must not be blank");
    }
    return key;
  }
}
