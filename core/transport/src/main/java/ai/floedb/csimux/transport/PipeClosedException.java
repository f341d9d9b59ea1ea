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

package ai.floedb.csimux.transport;

import java.io.IOException;

/** Raised by a {@link PipeListener} that has been closed, for pending and new requests alike. */
public final class PipeClosedException extends IOException {
  private static final long serialVersionUID = 1L;

  public PipeClosedException(String pipeName) {
    super("pipe " + pipeName + " is closed");
  }
}
