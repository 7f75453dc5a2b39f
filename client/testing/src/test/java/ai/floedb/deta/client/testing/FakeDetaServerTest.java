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
package ai.floedb.deta.client.testing;

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.deta.client.testing.FakeDetaServer.Reply;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FakeDetaServerTest {
  private FakeDetaServer server;
  private final HttpClient http =
      HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();

  @BeforeEach
  void setUp() {
    server = FakeDetaServer.start();
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void recordsRequestAndServesStub() throws Exception {
    server.stub(
        "POST", "/v1/p/b/query", req -> Reply.json(200, "{\"echo\":" + req.bodyText() + "}"));

    HttpResponse<String> resp =
        http.send(
            HttpRequest.newBuilder(URI.create(server.url() + "/v1/p/b/query?name=a%20b&part=2"))
                .header("X-API-Key", "k")
                .POST(HttpRequest.BodyPublishers.ofString("{\"x\":1}"))
                .build(),
            HttpResponse.BodyHandlers.ofString());

    assertThat(resp.statusCode()).isEqualTo(200);
    assertThat(resp.body()).isEqualTo("{\"echo\":{\"x\":1}}");

    var recorded = server.requests("POST", "/v1/p/b/query");
    assertThat(recorded).hasSize(1);
    assertThat(recorded.get(0).header("x-api-key")).isEqualTo("k");
    assertThat(recorded.get(0).query()).containsEntry("name", "a b").containsEntry("part", "2");
    assertThat(recorded.get(0).rawQueryParam("name")).contains("a%20b");
    assertThat(recorded.get(0).bodyJson().path("x").asInt()).isEqualTo(1);
  }

  @Test
  void unmatchedRequestsGet404() throws Exception {
    HttpResponse<String> resp =
        http.send(
            HttpRequest.newBuilder(URI.create(server.url() + "/nothing")).GET().build(),
            HttpResponse.BodyHandlers.ofString());

    assertThat(resp.statusCode()).isEqualTo(404);
    assertThat(resp.body()).contains("no stub for GET /nothing");
    assertThat(server.requests()).hasSize(1);
  }
}
