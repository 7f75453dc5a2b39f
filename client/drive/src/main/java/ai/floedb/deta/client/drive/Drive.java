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

import ai.floedb.deta.client.common.ApiKeyAuthProvider;
import ai.floedb.deta.client.common.DetaHttp;
import ai.floedb.deta.client.common.JsonValues;
import ai.floedb.deta.client.common.Pages;
import ai.floedb.deta.client.common.Paging;
import ai.floedb.deta.client.common.UrlSupport;
import ai.floedb.deta.client.errors.DetaPayloadException;
import ai.floedb.deta.client.spi.DetaConfig;
import ai.floedb.deta.client.spi.WalkPolicy;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/** A named Deta Drive: list, download, upload and delete blobs. */
public final class Drive {
  private static final Logger LOG = Logger.getLogger(Drive.class);

  public static final int DEFAULT_LIST_LIMIT = 1000;
  public static final int MAX_DELETE_NAMES = 1000;

  private final String name;
  private final DetaHttp http;
  private final WalkPolicy walkPolicy;
  private final ChunkUploader uploader;

  public Drive(String name, DetaHttp http, WalkPolicy walkPolicy) {
    this(name, http, walkPolicy, new ChunkUploader(http));
  }

  Drive(String name, DetaHttp http, WalkPolicy walkPolicy, ChunkUploader uploader) {
    this.name = UrlSupport.requireKey("drive name", name);
    this.http = Objects.requireNonNull(http, "http");
    this.walkPolicy = Objects.requireNonNull(walkPolicy, "walkPolicy");
    this.uploader = Objects.requireNonNull(uploader, "uploader");
  }

  public static Drive create(DetaConfig config, String name) {
    Objects.requireNonNull(config, "config");
    String root =
        config.driveUrl()
            + "/"
            + UrlSupport.enc(config.projectId())
            + "/"
            + UrlSupport.enc(UrlSupport.requireKey("drive name", name));
    var http =
        new DetaHttp(
            root,
            config.connectTimeout(),
            config.readTimeout(),
            new ApiKeyAuthProvider(config.projectKey()));
    return new Drive(name, http, config.walkPolicy());
  }

  public String name() {
    return name;
  }

  /**
   * One page of names. Null {@code limit} means {@value #DEFAULT_LIST_LIMIT}; null or empty {@code
   * prefix} and {@code last} are left off the request.
   */
  public FileList list(String prefix, Integer limit, String last) {
    int n = limit == null ? DEFAULT_LIST_LIMIT : limit;
    if (n <= 0) {
      throw new IllegalArgumentException("limit must be positive: " + n);
    }
    StringBuilder path = new StringBuilder("/files?limit=").append(n);
    if (prefix != null && !prefix.isEmpty()) {
      path.append("&prefix=").append(UrlSupport.enc(prefix));
    }
    if (last != null && !last.isEmpty()) {
      path.append("&last=").append(UrlSupport.enc(last));
    }
    return FileList.fromJson(http.json("GET", path.toString(), null));
  }

  /**
   * Every name under {@code prefix}. {@code paging.size} is the number of names returned and
   * {@code paging.last} is empty unless {@link WalkPolicy#PARTIAL_ON_ERROR} cut the listing short,
   * in which case it is the cursor to resume from.
   */
  public FileList listAll(String prefix) {
    Pages.Collected<String> all =
        Pages.collect(
            "",
            cursor -> list(prefix, null, cursor),
            FileList::names,
            fl -> fl.paging().last(),
            walkPolicy);
    if (!all.complete()) {
      LOG.warnf("Listing of drive %s stopped early at cursor %s", name, all.resumeToken());
    }
    return new FileList(all.items(), new Paging(all.items().size(), all.resumeToken()));
  }

  public byte[] get(String fileName) {
    String encoded = UrlSupport.enc(UrlSupport.requireKey("name", fileName));
    return http.download("/files/download?name=" + encoded);
  }

  public UploadResult put(String saveAs, byte[] content) {
    return uploader.upload(saveAs, content);
  }

  public DeleteResult delete(List<String> names) {
    Objects.requireNonNull(names, "names");
    if (names.isEmpty()) {
      return DeleteResult.empty();
    }
    if (names.size() > MAX_DELETE_NAMES) {
      throw new DetaPayloadException(
          "delete accepts at most " + MAX_DELETE_NAMES + " names, got " + names.size());
    }
    ObjectNode body = JsonValues.object();
    ArrayNode arr = body.putArray("names");
    names.forEach(n -> arr.add(UrlSupport.requireKey("name", n)));
    return DeleteResult.fromJson(http.json("DELETE", "/files", body));
  }
}
