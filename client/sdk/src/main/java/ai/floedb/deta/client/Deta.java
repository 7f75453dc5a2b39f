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
package ai.floedb.deta.client;

import ai.floedb.deta.client.base.Base;
import ai.floedb.deta.client.drive.Drive;
import ai.floedb.deta.client.spi.DetaConfig;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Entry point: holds the project configuration and hands out {@link Base} and {@link Drive}
 * handles. Handles are independent and cheap; each owns its own HTTP client.
 *
 * <pre>{@code
 * Deta deta = Deta.create(DetaConfig.of(projectKey));
 * Base users = deta.base("users");
 * QueryPage adults = users.walk(new Query().greaterThanOrEqualTo("age", 18));
 * }</pre>
 */
public final class Deta {
  private static final Logger LOG = Logger.getLogger(Deta.class);

  private final DetaConfig config;

  private Deta(DetaConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public static Deta create(DetaConfig config) {
    return new Deta(config);
  }

  public static Deta fromOptions(Map<String, String> options) {
    return new Deta(DetaConfig.fromOptions(options));
  }

  public DetaConfig config() {
    return config;
  }

  public Base base(String name) {
    LOG.debugf("Opening base %s in project %s", name, config.projectId());
    return Base.create(config, name);
  }

  public Drive drive(String name) {
    LOG.debugf("Opening drive %s in project %s", name, config.projectId());
    return Drive.create(config, name);
  }
}
