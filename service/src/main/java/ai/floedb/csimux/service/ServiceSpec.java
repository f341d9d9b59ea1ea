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

package ai.floedb.csimux.service;

/** A {@code TYPE[:NAME]} service definition. The name defaults to the type. */
public record ServiceSpec(String type, String name) {
  public static ServiceSpec parse(String text) {
    String trimmed = text == null ? "" : text.trim();
    int colon = trimmed.indexOf(':');
    String type = colon < 0 ? trimmed : trimmed.substring(0, colon).trim();
    String name = colon < 0 ? "" : trimmed.substring(colon + 1).trim();
    if (type.isEmpty()) {
      throw new IllegalArgumentException("invalid service definition: '" + text + "'");
    }
    return new ServiceSpec(type, name.isEmpty() ? type : name);
  }

  @Override
  public String toString() {
    return type.equals(name) ? type : type + ":" + name;
  }
}
