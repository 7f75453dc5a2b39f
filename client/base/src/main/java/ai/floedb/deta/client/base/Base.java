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

import ai.floedb.deta.client.base.query.Query;
import ai.floedb.deta.client.base.query.QueryPage;
import ai.floedb.deta.client.base.query.QueryWalker;
import ai.floedb.deta.client.common.ApiKeyAuthProvider;
import ai.floedb.deta.client.common.DetaHttp;
import ai.floedb.deta.client.common.JsonValues;
import ai.floedb.deta.client.common.UrlSupport;
import ai.floedb.deta.client.errors.DetaPayloadException;
import ai.floedb.deta.client.spi.DetaConfig;
import ai.floedb.deta.client.spi.WalkPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/** A named Deta Base: item CRUD and queries. */
public final class Base {
  private static final Logger LOG = Logger.getLogger(Base.class);

  public static final int MAX_PUT_ITEMS = 25;

  private final String name;
  private final DetaHttp http;
  private final WalkPolicy walkPolicy;
  private final Clock clock;

  public Base(String name, DetaHttp http, WalkPolicy walkPolicy, Clock clock) {
    this.name = UrlSupport.requireKey("base name", name);
    this.http = Objects.requireNonNull(http, "http");
    this.walkPolicy = Objects.requireNonNull(walkPolicy, "walkPolicy");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static Base create(DetaConfig config, String name) {
    Objects.requireNonNull(config, "config");
    String root =
        config.baseUrl()
            + "/"
            + UrlSupport.enc(config.projectId())
            + "/"
            + UrlSupport.enc(UrlSupport.requireKey("base name", name));
    var http =
        new DetaHttp(
            root,
            config.connectTimeout(),
            config.readTimeout(),
            new ApiKeyAuthProvider(config.projectKey()));
    return new Base(name, http, config.walkPolicy(), Clock.systemUTC());
  }

  public String name() {
    return name;
  }

  public JsonNode get(String key) {
    return http.json("GET", itemPath(key), null);
  }

  public PutResult put(Item item) {
    return put(List.of(Objects.requireNonNull(item, "item")));
  }

  /** Upserts up to {@value #MAX_PUT_ITEMS} items in one request. */
  public PutResult put(List<Item> items) {
    Objects.requireNonNull(items, "items");
    if (items.size() > MAX_PUT_ITEMS) {
      throw new DetaPayloadException(
          "put accepts at most " + MAX_PUT_ITEMS + " items, got " + items.size());
    }
    ObjectNode body = JsonValues.object();
    ArrayNode arr = body.putArray("items");
    items.forEach(i -> arr.add(i.toJson(clock)));

    LOG.debugf("Putting %d items into base %s", items.size(), name);
    return PutResult.fromJson(http.json("PUT", "/items", body));
  }

  /** Creates the item; fails with a conflict if the key already exists. */
  public JsonNode insert(Item item) {
    Objects.requireNonNull(item, "item");
    ObjectNode body = JsonValues.object();
    body.set("item", item.toJson(clock));
    return http.json("POST", "/items", body);
  }

  public void delete(String key) {
    http.json("DELETE", itemPath(key), null);
  }

  public Updater updater(String key) {
    return new Updater(key, this);
  }

  public JsonNode update(Updater updater) {
    Objects.requireNonNull(updater, "updater");
    ObjectNode body = updater.toJson();
    return http.json("PATCH", itemPath(updater.key()), body);
  }

  /** Runs a single page of the query. */
  public QueryPage query(Query query) {
    Objects.requireNonNull(query, "query");
    return QueryPage.fromJson(http.json("POST", "/query", query.toJson()));
  }

  /** Runs the query to exhaustion using the configured walk policy. */
  public QueryPage walk(Query query) {
    return walk(query, walkPolicy);
  }

  public QueryPage walk(Query query, WalkPolicy policy) {
    return new QueryWalker(this::query, policy).walk(query);
  }

  private static String itemPath(String key) {
    return "/items/" + UrlSupport.enc(UrlSupport.requireKey("key", key));
  }
}
