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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ApiKeyAuthProviderTest {

  @Test
  void addsKeyHeaderWithoutDroppingOthers() {
    var auth = new ApiKeyAuthProvider("p_k");

    Map<String, String> headers = auth.applyHeaders(Map.of("X-Trace", "t1"));

    assertEquals("api-key", auth.scheme());
    assertEquals("p_k", headers.get("X-API-Key"));
    assertEquals("t1", headers.get("X-Trace"));
  }
}
