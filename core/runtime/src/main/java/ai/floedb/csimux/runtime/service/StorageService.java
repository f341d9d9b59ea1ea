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

package ai.floedb.csimux.runtime.service;

import ai.floedb.csimux.csi.rpc.ControllerGrpc;
import ai.floedb.csimux.csi.rpc.IdentityGrpc;
import ai.floedb.csimux.csi.rpc.NodeGrpc;
import java.io.IOException;

/**
 * A named instance of a provider as exposed to clients. It answers the three protocol services
 * itself and owns the provider behind it.
 */
public interface StorageService
    extends IdentityGrpc.AsyncService, ControllerGrpc.AsyncService, NodeGrpc.AsyncService {

  /** Instance name, used for routing. */
  String name();

  /** Registry name of the provider type. */
  String type();

  /** Runs the provider until the service is stopped. Blocks. */
  void serve() throws IOException;

  void stop();

  void gracefulStop();
}
