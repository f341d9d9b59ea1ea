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

package ai.floedb.csimux.spi.csi;

import ai.floedb.csimux.csi.rpc.Version;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Text form of protocol versions: {@code major.minor.patch}. */
public final class CsiVersions {
  private static final Pattern TEXT = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");

  private CsiVersions() {}

  public static Version of(int major, int minor, int patch) {
    return Version.newBuilder().setMajor(major).setMinor(minor).setPatch(patch).build();
  }

  public static String format(Version version) {
    if (version == null) {
      return "nil";
    }
    return Integer.toUnsignedString(version.getMajor())
        + "."
        + Integer.toUnsignedString(version.getMinor())
        + "."
        + Integer.toUnsignedString(version.getPatch());
  }

  /**
   * Parses {@code M.m.p}.
   *
   * @throws IllegalArgumentException if {@code text} is not three dot-separated numbers
   */
  public static Version parse(String text) {
    Matcher m = TEXT.matcher(text == null ? "" : text.trim());
    if (!m.matches()) {
      throw new IllegalArgumentException("invalid version: " + text);
    }
    try {
      return of(
          Integer.parseUnsignedInt(m.group(1)),
          Integer.parseUnsignedInt(m.group(2)),
          Integer.parseUnsignedInt(m.group(3)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid version: " + text, e);
    }
  }
}
