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

/**
 * A storage provider: serves the Controller, Identity and Node protocol services. Methods a
 * provider does not override answer {@code UNIMPLEMENTED}.
 */
public interface StorageProvider
    extends ServiceProvider,
        IdentityGrpc.AsyncService,
        ControllerGrpc.AsyncService,
        NodeGrpc.AsyncService {}
