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

import ai.floedb.deta.client.spi.AuthProvider;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class ApiKeyAuthProvider implements AuthProvider {
  public static final String HEADER = "X-API-Key";

  private final String apiKey;

  public ApiKeyAuthProvider(String apiKey) {
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
  }

  @Override
  public String scheme() {
    return "api-key";
  }

  @Override
  public Map<String, String> applyHeaders(Map<String, String> baseHeaders) {
    Map<String, String> out = new LinkedHashMap<>(baseHeaders);
    out.put(HEADER, apiKey);
    return out;
  }
}
