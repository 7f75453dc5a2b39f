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
package ai.floedb.deta.client.base;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.floedb.deta.client.base.query.Query;
import ai.floedb.deta.client.base.query.QueryPage;
import ai.floedb.deta.client.common.ApiKeyAuthProvider;
import ai.floedb.deta.client.common.DetaHttp;
import ai.floedb.deta.client.errors.DetaConflictException;
import ai.floedb.deta.client.errors.DetaNotFoundException;
import ai.floedb.deta.client.errors.DetaPayloadException;
import ai.floedb.deta.client.errors.DetaTransportException;
import ai.floedb.deta.client.spi.WalkPolicy;
import ai.floedb.deta.client.testing.FakeDetaServer;
import ai.floedb.deta.client.testing.FakeDetaServer.RecordedRequest;
import ai.floedb.deta.client.testing.FakeDetaServer.Reply;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BaseTest {
  private static final String ROOT = "/v1/proj/users";
  private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_000L), ZoneOffset.UTC);

  private FakeDetaServer server;
  private Base base;

  @BeforeEach
  void setUp() {
    server = FakeDetaServer.start();
    base = baseWith(WalkPolicy.FAIL_FAST);
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  private Base baseWith(WalkPolicy policy) {
    var http =
        new DetaHttp(
            server.url() + ROOT,
            Duration.ofSeconds(2),
            Duration.ofSeconds(5),
            new ApiKeyAuthProvider("proj_secret"));
    return new Base("users", http, policy, CLOCK);
  }

  @Test
  void getEncodesKeyAndSendsApiKey() {
    server.stubJson("GET", ROOT + "/items/a%20b%2Fc", 200, "{\"key\":\"a b/c\",\"n\":1}");

    JsonNode item = base.get("a b/c");

    assertThat(item.path("n").asInt()).isEqualTo(1);
    RecordedRequest req = server.requests().get(0);
    assertThat(req.rawPath()).isEqualTo(ROOT + "/items/a%20b%2Fc");
    assertThat(req.header("X-API-Key")).isEqualTo("proj_secret");
  }

  @Test
  void getMissingItemThrowsNotFound() {
    server.stubJson("GET", ROOT + "/items/nope", 404, "{\"errors\":[\"Key not found\"]}");

    assertThatThrownBy(() -> base.get("nope"))
        .isInstanceOf(DetaNotFoundException.class)
        .hasMessageContaining("Key not found");
  }

  @Test
  void putSendsItemsAndParsesResult() {
    server.stubJson(
        "PUT",
        ROOT + "/items",
        207,
        "{\"processed\":{\"items\":[{\"key\":\"a\"}]},\"failed\":{\"items\":[{\"key\":\"b\"}]}}");

    PutResult result =
        base.put(
            List.of(
                Item.of("a", Map.of("x", 1)),
                Item.builder().key("b").expireIn(Duration.ofSeconds(60)).build()));

    assertThat(result.processed()).hasSize(1);
    assertThat(result.failed()).hasSize(1);
    assertThat(result.allProcessed()).isFalse();
    JsonNode sent = server.requests("PUT", ROOT + "/items").get(0).bodyJson().path("items");
    assertThat(sent).hasSize(2);
    assertThat(sent.get(0).path("x").asInt()).isEqualTo(1);
    assertThat(sent.get(1).path("__expires").asLong()).isEqualTo(1_060L);
  }

  @Test
  void putOverBatchLimitSendsNothing() {
    List<Item> items = new ArrayList<>();
    for (int i = 0; i <= Base.MAX_PUT_ITEMS; i++) {
      items.add(Item.of("k" + i, i));
    }

    assertThatThrownBy(() -> base.put(items)).isInstanceOf(DetaPayloadException.class);
    assertThat(server.requests()).isEmpty();
  }

  @Test
  void putAtBatchLimitIsSent() {
    server.stubJson("PUT", ROOT + "/items", 207, "{\"processed\":{\"items\":[]}}");
    List<Item> items = new ArrayList<>();
    for (int i = 0; i < Base.MAX_PUT_ITEMS; i++) {
      items.add(Item.of("k" + i, i));
    }

    PutResult result = base.put(items);

    assertThat(result.allProcessed()).isTrue();
    assertThat(server.requests()).hasSize(1);
  }

  @Test
  void insertOfExistingKeyIsConflict() {
    server.stubJson("POST", ROOT + "/items", 409, "{\"errors\":[\"Key already exists\"]}");

    assertThatThrownBy(() -> base.insert(Item.of("dup", Map.of("a", 1))))
        .isInstanceOf(DetaConflictException.class);
    JsonNode sent = server.requests().get(0).bodyJson();
    assertThat(sent.path("item").path("key").asText()).isEqualTo("dup");
  }

  @Test
  void deleteIssuesDelete() {
    server.stubJson("DELETE", ROOT + "/items/k1", 200, "{\"key\":\"k1\"}");

    base.delete("k1");

    assertThat(server.requests("DELETE", ROOT + "/items/k1")).hasSize(1);
  }

  @Test
  void boundUpdaterPatchesItem() {
    server.stubJson("PATCH", ROOT + "/items/k1", 200, "{\"key\":\"k1\"}");

    base.updater("k1").set("name", "ada").increment("visits", 2).commit();

    JsonNode sent = server.requests("PATCH", ROOT + "/items/k1").get(0).bodyJson();
    assertThat(sent.path("set").path("name").asText()).isEqualTo("ada");
    assertThat(sent.path("increment").path("visits").asInt()).isEqualTo(2);
  }

  @Test
  void emptyUpdateSendsNothing() {
    assertThatThrownBy(() -> base.update(new Updater("k1")))
        .isInstanceOf(DetaPayloadException.class);
    assertThat(server.requests()).isEmpty();
  }

  @Test
  void singleQueryReturnsOnePage() {
    server.stubJson(
        "POST",
        ROOT + "/query",
        200,
        "{\"paging\":{\"size\":1,\"last\":\"k1\"},\"items\":[{\"key\":\"k1\"}]}");

    QueryPage page = base.query(new Query().equalTo("age", 3).limit(1));

    assertThat(page.items()).hasSize(1);
    assertThat(page.paging().last()).isEqualTo("k1");
    JsonNode sent = server.requests().get(0).bodyJson();
    assertThat(sent.path("limit").asInt()).isEqualTo(1);
    assertThat(sent.path("query").get(0).path("age").asInt()).isEqualTo(3);
  }

  @Test
  void walkFollowsCursorsUntilExhausted() {
    AtomicInteger calls = new AtomicInteger();
    server.stub(
        "POST",
        ROOT + "/query",
        req -> {
          int n = calls.incrementAndGet();
          String last = n < 3 ? "\"c" + n + "\"" : "null";
          return Reply.json(
              200,
              "{\"paging\":{\"size\":2,\"last\":"
                  + last
                  + "},\"items\":[{\"key\":\"a"
                  + n
                  + "\"},{\"key\":\"b"
                  + n
                  + "\"}]}");
        });

    QueryPage out = base.walk(new Query().prefix("key", "a"));

    assertThat(out.items()).hasSize(6);
    assertThat(out.paging().size()).isEqualTo(6);
    List<RecordedRequest> reqs = server.requests("POST", ROOT + "/query");
    assertThat(reqs).hasSize(3);
    assertThat(reqs.get(0).bodyJson().has("last")).isFalse();
    assertThat(reqs.get(1).bodyJson().path("last").asText()).isEqualTo("c1");
    assertThat(reqs.get(2).bodyJson().path("last").asText()).isEqualTo("c2");
    assertThat(reqs.get(2).bodyJson().path("query").get(0).path("key?pfx").asText())
        .isEqualTo("a");
  }

  @Test
  void walkWithExplicitLimitSendsNothing() {
    assertThatThrownBy(() -> base.walk(new Query().limit(5)))
        .isInstanceOf(DetaPayloadException.class);
    assertThat(server.requests()).isEmpty();
  }

  @Test
  void walkUnderPartialPolicyKeepsCollectedItems() {
    AtomicInteger calls = new AtomicInteger();
    server.stub(
        "POST",
        ROOT + "/query",
        req ->
            calls.incrementAndGet() == 1
                ? Reply.json(200, "{\"paging\":{\"size\":1,\"last\":\"c1\"},\"items\":[{}]}")
                : Reply.drop());

    QueryPage out = baseWith(WalkPolicy.PARTIAL_ON_ERROR).walk(new Query());

    assertThat(out.items()).hasSize(1);
    assertThat(out.paging().last()).isEqualTo("c1");
  }

  @Test
  void walkUnderFailFastPropagatesLaterError() {
    AtomicInteger calls = new AtomicInteger();
    server.stub(
        "POST",
        ROOT + "/query",
        req ->
            calls.incrementAndGet() == 1
                ? Reply.json(200, "{\"paging\":{\"size\":1,\"last\":\"c1\"},\"items\":[{}]}")
                : Reply.drop());

    assertThatThrownBy(() -> base.walk(new Query())).isInstanceOf(DetaTransportException.class);
  }
}
