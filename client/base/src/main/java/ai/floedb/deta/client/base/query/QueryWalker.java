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
package ai.floedb.deta.client.base.query;

import ai.floedb.deta.client.common.Pages;
import ai.floedb.deta.client.common.Paging;
import ai.floedb.deta.client.errors.DetaPayloadException;
import ai.floedb.deta.client.spi.WalkPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runs a query page after page, feeding each response's {@code paging.last} back as the cursor,
 * until the cursor comes back empty.
 */
public final class QueryWalker {
  private final Function<Query, QueryPage> runner;
  private final WalkPolicy policy;

  public QueryWalker(Function<Query, QueryPage> runner, WalkPolicy policy) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  /**
   * Returns every item in page order. The result's {@code paging.size} is the total item count
   * and {@code paging.last} is empty, unless {@link WalkPolicy#PARTIAL_ON_ERROR} cut the walk
   * short, in which case it is the cursor of the page that failed.
   *
   * @throws DetaPayloadException if the query has an explicit limit
   */
  public QueryPage walk(Query query) {
    Objects.requireNonNull(query, "query");
    if (query.limit().isPresent()) {
      throw new DetaPayloadException("limit must be unset for full-walk mode");
    }
    Query template = query.copy();

    Pages.Collected<JsonNode> collected =
        Pages.collect(
            template.last().orElse(""),
            cursor -> runner.apply(template.copy().last(cursor)),
            QueryPage::items,
            page -> page.paging().last(),
            policy);

    return new QueryPage(
        new Paging(collected.items().size(), collected.resumeToken()), collected.items());
  }
}
