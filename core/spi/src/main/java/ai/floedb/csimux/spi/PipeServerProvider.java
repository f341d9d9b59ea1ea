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

package ai.floedb.csimux.spi;

import ai.floedb.csimux.csi.rpc.ControllerGrpc;
import ai.floedb.csimux.csi.rpc.IdentityGrpc;
import ai.floedb.csimux.csi.rpc.NodeGrpc;
import ai.floedb.csimux.transport.PipeListener;
import ai.floedb.csimux.transport.PipeServer;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Base class for providers that implement the protocol methods directly. Serving binds the
 * Identity, Controller and Node services of {@code this} to a {@link PipeServer}.
 */
public abstract class PipeServerProvider implements StorageProvider {
  private static final Logger LOG = Logger.getLogger(PipeServerProvider.class);

  private final String providerName;
  private final PipeServer server;

  protected PipeServerProvider(String providerName) {
    this.providerName = Objects.requireNonNull(providerName, "providerName");
    this.server =
        new PipeServer(
            providerName,
            List.of(
                IdentityGrpc.bindService(this),
                ControllerGrpc.bindService(this),
                NodeGrpc.bindService(this)));
  }

  public String providerName() {
    return providerName;
  }

  @Override
  public void serve(PipeListener listener) throws IOException {
    LOG.infof("%s: serving on %s", providerName, listener.name());
    server.serve(listener);
    LOG.infof("%s: stopped serving", providerName);
  }

  @Override
  public void stop() {
    LOG.debugf("%s: stop", providerName);
    server.shutdownNow();
  }

  @Override
  public void gracefulStop() {
    LOG.debugf("%s: graceful stop", providerName);
    server.shutdown();
    try {
      server.awaitTermination();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warnf("%s: interrupted during graceful stop, aborting remaining calls", providerName);
      server.shutdownNow();
    }
  }
}
