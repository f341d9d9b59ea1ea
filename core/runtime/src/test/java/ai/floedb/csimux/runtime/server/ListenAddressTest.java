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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ListenAddressTest {
  @Test
  void parsesSchemeAndAddress() {
    ListenAddress unix = ListenAddress.parse("unix:///var/run/csi.sock");
    ListenAddress tcp = ListenAddress.parse("TCP://127.0.0.1:8080");

    assertThat(unix.scheme()).isEqualTo("unix");
    assertThat(unix.address()).isEqualTo("/var/run/csi.sock");
    assertThat(unix.isUnix()).isTrue();
    assertThat(tcp.scheme()).isEqualTo("tcp");
    assertThat(tcp.isTcp()).isTrue();
    assertThat(tcp).hasToString("tcp://127.0.0.1:8080");
  }

  @Test
  void acceptsEveryNetworkFamily() {
    for (String scheme :
        new String[] {"tcp4", "tcp6", "udp", "udp6", "ip4", "unixgram", "unixpacket"}) {
      assertThat(ListenAddress.parse(scheme + "://x").scheme()).isEqualTo(scheme);
    }
  }

  @Test
  void rejectsMalformedAddresses() {
    for (String text : new String[] {"", "127.0.0.1:8080", "http://x", "tcp://", null}) {
      assertThatThrownBy(() -> ListenAddress.parse(text))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageStartingWith("invalid listen address");
    }
  }
}
