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

package ai.floedb.csimux.client.cli;

import ai.floedb.csimux.runtime.server.ListenAddress;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import io.grpc.netty.shaded.io.netty.channel.EventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.epoll.Epoll;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollDomainSocketChannel;
import io.grpc.netty.shaded.io.netty.channel.epoll.EpollEventLoopGroup;
import io.grpc.netty.shaded.io.netty.channel.unix.DomainSocketAddress;
import java.util.concurrent.TimeUnit;

/** Opens plaintext channels to {@code tcp://host:port} and {@code unix:///path} endpoints. */
final class CscChannels {
  private CscChannels() {}

  /** A channel plus whatever must be released with it. */
  record Connection(ManagedChannel channel, Runnable release) implements AutoCloseable {
    static Connection of(ManagedChannel channel) {
      return new Connection(channel, () -> {});
    }

    @Override
    public void close() {
      channel.shutdownNow();
      try {
        channel.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        release.run();
      }
    }
  }

  /**
   * @throws IllegalArgumentException if the endpoint is malformed or its scheme is unsupported
   */
  static Connection open(String endpoint) {
    ListenAddress address = ListenAddress.parse(endpoint);
    if (address.isTcp()) {
      String target = address.address();
      if (target.startsWith(":")) {
        target = "127.0.0.1" + target;
      }
      return Connection.of(ManagedChannelBuilder.forTarget(target).usePlaintext().build());
    }
    if (address.scheme().equals("unix")) {
      if (!Epoll.isAvailable()) {
        throw new IllegalArgumentException("unix sockets are not supported on this platform");
      }
      EventLoopGroup group = new EpollEventLoopGroup(1);
      ManagedChannel channel =
          NettyChannelBuilder.forAddress(new DomainSocketAddress(address.address()))
              .channelType(EpollDomainSocketChannel.class)
              .eventLoopGroup(group)
              .usePlaintext()
              .build();
      return new Connection(channel, group::shutdownGracefully);
    }
    throw new IllegalArgumentException("unsupported endpoint scheme: " + address.scheme());
  }
}
