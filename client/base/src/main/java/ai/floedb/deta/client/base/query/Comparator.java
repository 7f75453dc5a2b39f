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

/** Predicate operators; every operator but {@link #EQUALS} is sent as {@code field?op}. */
public enum Comparator {
  EQUALS(""),
  NOT_EQUALS("ne"),
  GREATER_THAN("gt"),
  GREATER_THAN_OR_EQUALS("gte"),
  LESS_THAN("lt"),
  LESS_THAN_OR_EQUALS("lte"),
  RANGE("range"),
  CONTAINS("contains"),
  NOT_CONTAINS("not_contains"),
  PREFIX("pfx");

  private final String op;

  Comparator(String op) {
    this.op = op;
  }

  public String op() {
    return op;
  }

  public String key(String field) {
    return op.isEmpty() ? field : field + "?" + op;
  }
}
