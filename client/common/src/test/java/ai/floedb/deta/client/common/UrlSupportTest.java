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
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class UrlSupportTest {

  @Test
  void encodesSpacesAsPercent20() {
    assertEquals("my%20file.txt", UrlSupport.enc("my file.txt"));
  }

  @Test
  void encodesReservedCharacters() {
    assertEquals("a%2Fb%3Fc%26d%3De%2Bf", UrlSupport.enc("a/b?c&d=e+f"));
    assertEquals("star%2A~tilde", UrlSupport.enc("star*~tilde"));
    assertEquals("%C3%A9t%C3%A9", UrlSupport.enc("été"));
  }

  @Test
  void requireKeyRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> UrlSupport.requireKey("key", " "));
    assertThrows(IllegalArgumentException.class, () -> UrlSupport.requireKey("key", null));
    assertEquals("k", UrlSupport.requireKey("key", "k"));
  }
}
