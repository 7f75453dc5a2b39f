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
package ai.floedb.deta.client.spi;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public record DetaConfig(
    String projectKey,
    String projectId,
    String baseUrl,
    String driveUrl,
    Duration connectTimeout,
    Duration readTimeout,
    WalkPolicy walkPolicy) {

  public static final String DEFAULT_BASE_URL = "https://database.deta.sh/v1";
  public static final String DEFAULT_DRIVE_URL = "https://drive.deta.sh/v1";
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);

  public static final String OPT_PROJECT_KEY = "deta.project-key";
  public static final String OPT_BASE_URL = "deta.base.url";
  public static final String OPT_DRIVE_URL = "deta.drive.url";
  public static final String OPT_CONNECT_MS = "http.connect.ms";
  public static final String OPT_READ_MS = "http.read.ms";
  public static final String OPT_WALK_POLICY = "query.walk.policy";

  public DetaConfig {
    Objects.requireNonNull(projectKey, "projectKey");
    String derived = projectIdOf(projectKey);
    if (projectId == null || projectId.isBlank()) {
      projectId = derived;
    } else if (!projectId.equals(derived)) {
      throw new IllegalArgumentException(
          "projectId " + projectId + " does not match the project key prefix");
    }
    baseUrl = trimSlash(Objects.requireNonNullElse(baseUrl, DEFAULT_BASE_URL));
    driveUrl = trimSlash(Objects.requireNonNullElse(driveUrl, DEFAULT_DRIVE_URL));
    connectTimeout = Objects.requireNonNullElse(connectTimeout, DEFAULT_CONNECT_TIMEOUT);
    readTimeout = Objects.requireNonNullElse(readTimeout, DEFAULT_READ_TIMEOUT);
    walkPolicy = Objects.requireNonNullElse(walkPolicy, WalkPolicy.FAIL_FAST);
  }

  public static DetaConfig of(String projectKey) {
    return new DetaConfig(projectKey, null, null, null, null, null, null);
  }

  public static DetaConfig fromOptions(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String key = options.get(OPT_PROJECT_KEY);
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Missing option " + OPT_PROJECT_KEY);
    }
    return new DetaConfig(
        key,
        null,
        options.get(OPT_BASE_URL),
        options.get(OPT_DRIVE_URL),
        millis(options, OPT_CONNECT_MS, DEFAULT_CONNECT_TIMEOUT),
        millis(options, OPT_READ_MS, DEFAULT_READ_TIMEOUT),
        WalkPolicy.parse(options.get(OPT_WALK_POLICY)));
  }

  public DetaConfig withBaseUrl(String url) {
    return new DetaConfig(
        projectKey, projectId, url, driveUrl, connectTimeout, readTimeout, walkPolicy);
  }

  public DetaConfig withDriveUrl(String url) {
    return new DetaConfig(
        projectKey, projectId, baseUrl, url, connectTimeout, readTimeout, walkPolicy);
  }

  public DetaConfig withTimeouts(Duration connect, Duration read) {
    return new DetaConfig(projectKey, projectId, baseUrl, driveUrl, connect, read, walkPolicy);
  }

  public DetaConfig withWalkPolicy(WalkPolicy policy) {
    return new DetaConfig(
        projectKey, projectId, baseUrl, driveUrl, connectTimeout, readTimeout, policy);
  }

  @Override
  public String toString() {
    return "DetaConfig[projectId="
        + projectId
        + ", baseUrl="
        + baseUrl
        + ", driveUrl="
        + driveUrl
        + ", connectTimeout="
        + connectTimeout
        + ", readTimeout="
        + readTimeout
        + ", walkPolicy="
        + walkPolicy
        + "]";
  }

  // Keys look like "<projectId>_<secret>".
  static String projectIdOf(String projectKey) {
    String[] parts = projectKey.split("_", -1);
    if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
      throw new IllegalArgumentException("Invalid project key");
    }
    return parts[0];
  }

  private static Duration millis(Map<String, String> options, String key, Duration dflt) {
    String v = options.get(key);
    if (v == null || v.isBlank()) {
      return dflt;
    }
    try {
      return Duration.ofMillis(Long.parseLong(v.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Option " + key + " is not a number: " + v, e);
    }
  }

  private static String trimSlash(String url) {
    String u = url.trim();
    while (u.endsWith("/")) {
      u = u.substring(0, u.length() - 1);
    }
    return u;
  }
}
