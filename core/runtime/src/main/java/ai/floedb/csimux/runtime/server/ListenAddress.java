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

package ai.floedb.csimux.runtime.server;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A listen endpoint of the form {@code scheme://address}, e.g. {@code unix:///tmp/csi.sock}. */
public record ListenAddress(String scheme, String address) {
  private static final Pattern FORMAT =
      Pattern.compile("(?i)^((?:(?:tcp|udp|ip)[46]?)|(?:unix(?:gram|packet)?))://(.+)$");

  /**
   * @throws IllegalArgumentException if {@code text} is not {@code scheme://address}
   */
  public static ListenAddress parse(String text) {
    Matcher m = FORMAT.matcher(text == null ? "" : text.trim());
    if (!m.matches()) {
      throw new IllegalArgumentException("invalid listen address: " + text);
    }
    return new ListenAddress(m.group(1).toLowerCase(Locale.ROOT), m.group(2));
  }

  public boolean isUnix() {
    return scheme.startsWith("unix");
  }

  public boolean isTcp() {
    return scheme.startsWith("tcp");
  }

  @Override
  public String toString() {
    return scheme + "://" + address;
  }
}
