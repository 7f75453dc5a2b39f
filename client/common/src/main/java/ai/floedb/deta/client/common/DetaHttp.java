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

import ai.floedb.deta.client.errors.DetaHttpException;
import ai.floedb.deta.client.errors.DetaSerializationException;
import ai.floedb.deta.client.errors.DetaTransportException;
import ai.floedb.deta.client.spi.AuthProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Blocking HTTP transport rooted at one resource URL, e.g. {@code
 * https://database.deta.sh/v1/<project>/<base>}. Every request carries the provider's auth
 * headers; non-2xx responses become {@link DetaHttpException}s.
 */
public final class DetaHttp {
  private static final Logger LOG = Logger.getLogger(DetaHttp.class);
  private static final ObjectMapper M = new ObjectMapper();

  static final String JSON = "application/json";
  static final String OCTET_STREAM = "application/octet-stream";
  private static final int MAX_DETAIL = 512;

  private final String root;
  private final AuthProvider auth;
  private final Duration readTimeout;
  private final HttpClient client;

  public DetaHttp(String root, Duration connectTimeout, Duration readTimeout, AuthProvider auth) {
    this(
        root,
        readTimeout,
        auth,
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(connectTimeout)
            .build());
  }

  public DetaHttp(String root, Duration readTimeout, AuthProvider auth, HttpClient client) {
    Objects.requireNonNull(root, "root");
    this.root = root.endsWith("/") ? root.substring(0, root.length() - 1) : root;
    this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
    this.auth = Objects.requireNonNull(auth, "auth");
    this.client = Objects.requireNonNull(client, "client");
  }

  public String root() {
    return root;
  }

  /** Sends an optional JSON body and parses the JSON response. */
  public JsonNode json(String method, String pathAndQuery, JsonNode body) {
    BodyPublisher publisher =
        body == null ? BodyPublishers.noBody() : BodyPublishers.ofByteArray(write(body));
    HttpResponse<byte[]> resp = send(method, pathAndQuery, JSON, publisher);
    return read(method, pathAndQuery, resp.body());
  }

  /** Sends raw bytes as {@code application/octet-stream} and parses the JSON response. */
  public JsonNode bytes(String method, String pathAndQuery, byte[] body) {
    BodyPublisher publisher =
        body == null ? BodyPublishers.noBody() : BodyPublishers.ofByteArray(body);
    HttpResponse<byte[]> resp = send(method, pathAndQuery, OCTET_STREAM, publisher);
    return read(method, pathAndQuery, resp.body());
  }

  /** GETs a resource and returns the body untouched. */
  public byte[] download(String pathAndQuery) {
    return send("GET", pathAndQuery, JSON, BodyPublishers.noBody()).body();
  }

  private HttpResponse<byte[]> send(
      String method, String pathAndQuery, String contentType, BodyPublisher publisher) {
    var req =
        HttpRequest.newBuilder()
            .uri(URI.create(root + pathAndQuery))
            .timeout(readTimeout)
            .header("Content-Type", contentType)
            .header("Accept", JSON)
            .method(method, publisher);
    auth.applyHeaders(Map.of()).forEach(req::header);

    LOG.debugf("%s %s", method, pathAndQuery);
    HttpResponse<byte[]> resp;
    try {
      resp = client.send(req.build(), BodyHandlers.ofByteArray());
    } catch (IOException e) {
      throw new DetaTransportException(method + " " + pathAndQuery + " failed: " + e, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DetaTransportException(method + " " + pathAndQuery + " interrupted", e);
    }

    if (resp.statusCode() / 100 != 2) {
      String detail = detail(resp.body());
      LOG.debugf("%s %s -> HTTP %d %s", method, pathAndQuery, resp.statusCode(), detail);
      throw DetaHttpException.forStatus(resp.statusCode(), detail);
    }
    return resp;
  }

  private static byte[] write(JsonNode body) {
    try {
      return M.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new DetaSerializationException("Cannot serialize request body", e);
    }
  }

  private static JsonNode read(String method, String pathAndQuery, byte[] body) {
    if (body == null || body.length == 0) {
      return MissingNode.getInstance();
    }
    try {
      return M.readTree(body);
    } catch (IOException e) {
      throw new DetaSerializationException(
          "Malformed JSON in response to " + method + " " + pathAndQuery, e);
    }
  }

  // The service reports failures as {"errors": ["..."]}; anything else is passed through.
  static String detail(byte[] body) {
    if (body == null || body.length == 0) {
      return "";
    }
    String raw = new String(body, StandardCharsets.UTF_8);
    try {
      JsonNode errors = M.readTree(raw).path("errors");
      if (errors.isArray() && errors.size() > 0) {
        List<String> msgs = new ArrayList<>(errors.size());
        errors.forEach(e -> msgs.add(e.asText()));
        return String.join("; ", msgs);
      }
    } catch (IOException ignore) {
      // not JSON
    }
    return raw.length() > MAX_DETAIL ? raw.substring(0, MAX_DETAIL) : raw;
  }
}
