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

import ai.floedb.deta.client.errors.DetaException;
import ai.floedb.deta.client.spi.WalkPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.jboss.logging.Logger;

/** Cursor pagination loop shared by query walks and drive listings. */
public final class Pages {
  private static final Logger LOG = Logger.getLogger(Pages.class);

  private Pages() {}

  /**
   * Fetches pages starting at {@code startToken} until {@code next} yields an empty cursor.
   *
   * <p>The first fetch always propagates its error. Later failures propagate under {@link
   * WalkPolicy#FAIL_FAST}; under {@link WalkPolicy#PARTIAL_ON_ERROR} they end the walk and the
   * returned {@link Collected#resumeToken()} is the cursor of the page that failed.
   */
  public static <R, T> Collected<T> collect(
      String startToken,
      Function<String, R> fetch,
      Function<R, List<T>> items,
      Function<R, String> next,
      WalkPolicy policy) {
    Objects.requireNonNull(policy, "policy");

    List<T> all = new ArrayList<>();
    String token = Optional.ofNullable(startToken).orElse("");
    int pages = 0;
    do {
      R resp;
      try {
        resp = fetch.apply(token);
      } catch (DetaException e) {
        if (pages == 0 || policy == WalkPolicy.FAIL_FAST) {
          throw e;
        }
        LOG.warnf(
            e, "Page %d failed at cursor %s; returning %d items", pages + 1, token, all.size());
        return new Collected<>(all, pages, token);
      }
      all.addAll(items.apply(resp));
      pages++;
      token = Optional.ofNullable(next.apply(resp)).orElse("");
    } while (!token.isEmpty());

    LOG.debugf("Collected %d items over %d pages", all.size(), pages);
    return new Collected<>(all, pages, "");
  }

  public record Collected<T>(List<T> items, int pages, String resumeToken) {
    public boolean complete() {
      return resumeToken.isEmpty();
    }
  }
}
