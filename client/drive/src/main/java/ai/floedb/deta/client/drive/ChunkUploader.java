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

import ai.floedb.deta.client.common.DetaHttp;
import ai.floedb.deta.client.common.UrlSupport;
import ai.floedb.deta.client.errors.DetaException;
import ai.floedb.deta.client.errors.DetaSerializationException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Writes a blob either in one request or as a multipart upload: initiate, send every part in
 * order, then commit if all parts landed or abort otherwise.
 */
public final class ChunkUploader {
  private static final Logger LOG = Logger.getLogger(ChunkUploader.class);

  public static final int MAX_CHUNK_SIZE = 10 * 1024 * 1024;

  private final DetaHttp http;
  private final int chunkSize;

  public ChunkUploader(DetaHttp http) {
    this(http, MAX_CHUNK_SIZE);
  }

  ChunkUploader(DetaHttp http, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    this.http = Objects.requireNonNull(http, "http");
    this.chunkSize = chunkSize;
  }

  public UploadResult upload(String saveAs, byte[] content) {
    UrlSupport.requireKey("name", saveAs);
    Objects.requireNonNull(content, "content");
    String name = UrlSupport.enc(saveAs);

    if (content.length <= chunkSize) {
      LOG.debugf("Uploading %s in one request (%d bytes)", saveAs, content.length);
      return UploadResult.single(saveAs, http.bytes("POST", "/files?name=" + name, content));
    }

    JsonNode init = initiate(name);
    String uploadId = init.path("upload_id").asText();
    String target = init.path("name").asText("");
    if (target.isBlank()) {
      target = saveAs;
    }
    int parts = partCount(content.length, chunkSize);
    LOG.debugf("Upload %s of %s: %d parts of up to %d bytes", uploadId, saveAs, parts, chunkSize);

    String finalizePath = "/uploads/" + UrlSupport.enc(uploadId) + "?name=" + name;
    List<Integer> uploaded = new ArrayList<>();
    List<Integer> failed = new ArrayList<>();
    try {
      for (int part = 1; part <= parts; part++) {
        int from = chunkStart(part, chunkSize);
        byte[] chunk =
            Arrays.copyOfRange(content, from, chunkEnd(from, chunkSize, content.length));
        try {
          http.bytes("POST", partPath(uploadId, name, part), chunk);
          uploaded.add(part);
        } catch (DetaException e) {
          LOG.warnf(e, "Part %d/%d of upload %s failed", part, parts, uploadId);
          failed.add(part);
        }
      }
    } catch (RuntimeException e) {
      LOG.warnf(
          e,
          "Upload %s of %s broke off after %d parts; aborting",
          uploadId,
          saveAs,
          uploaded.size() + failed.size());
      abort(finalizePath, e);
      throw e;
    }

    UploadSession session = new UploadSession(uploadId, target, uploaded, failed);
    if (session.allSucceeded()) {
      JsonNode resp = http.json("PATCH", finalizePath, null);
      LOG.infof("Committed upload %s of %s (%d parts)", uploadId, saveAs, parts);
      return new UploadResult(saveAs, true, true, session, resp);
    }
    LOG.warnf("Aborting upload %s of %s; failed parts %s", uploadId, saveAs, failed);
    JsonNode resp = http.json("DELETE", finalizePath, null);
    return new UploadResult(saveAs, false, true, session, resp);
  }

  static int partCount(int length, int chunkSize) {
    return (int) ((length + (long) chunkSize - 1) / chunkSize);
  }

  static int chunkStart(int part, int chunkSize) {
    return (int) ((part - 1L) * chunkSize);
  }

  static int chunkEnd(int from, int chunkSize, int length) {
    return (int) Math.min((long) from + chunkSize, length);
  }

  private void abort(String finalizePath, RuntimeException cause) {
    try {
      http.json("DELETE", finalizePath, null);
    } catch (DetaException e) {
      cause.addSuppressed(e);
    }
  }

  private JsonNode initiate(String name) {
    JsonNode resp = http.json("POST", "/uploads?name=" + name, null);
    if (resp.path("upload_id").asText("").isBlank()) {
      throw new DetaSerializationException("Initiate response has no upload_id: " + resp);
    }
    return resp;
  }

  private static String partPath(String uploadId, String name, int part) {
    return "/uploads/" + UrlSupport.enc(uploadId) + "/parts?name=" + name + "&part=" + part;
  }
}
