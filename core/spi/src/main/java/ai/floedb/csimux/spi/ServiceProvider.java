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

import ai.floedb.csimux.transport.PipeListener;
import java.io.IOException;

/** Lifecycle of a provider that answers protocol calls arriving on a {@link PipeListener}. */
public interface ServiceProvider {
  /**
   * Serves calls accepted from {@code listener} until the provider is stopped. Returns normally
   * after {@link #stop()} or {@link #gracefulStop()}.
   *
   * @throws IllegalStateException if the provider is already serving or has been stopped
   */
  void serve(PipeListener listener) throws IOException;

  /** Stops immediately, aborting calls in progress. Idempotent. */
  void stop();

  /** Stops accepting calls and waits for the ones in progress. Idempotent. */
  void gracefulStop();
}
