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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One end of an in-process duplex byte stream produced by a {@link PipeListener} rendezvous.
 *
 * <p>Closing an end (directly or through either of its streams) makes the peer's reads return EOF
 * once buffered bytes are drained, fails the peer's writes, and unblocks any reader waiting on
 * this end.
 */
public final class PipeConnection implements Closeable {
  static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

  private final String name;
  private final String side;
  private final PipeBuffer inbound;
  private final PipeBuffer outbound;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final InputStream input = new PipeInputStream();
  private final OutputStream output = new PipeOutputStream();

  private PipeConnection(String name, String side, PipeBuffer inbound, PipeBuffer outbound) {
    this.name = name;
    this.side = side;
    this.inbound = inbound;
    this.outbound = outbound;
  }

  /** Wires two ends together: the first is handed to the acceptor, the second to the dialer. */
  static Pair pair(String name, int bufferSize) {
    PipeBuffer toAcceptor = new PipeBuffer(bufferSize);
    PipeBuffer toDialer = new PipeBuffer(bufferSize);
    return new Pair(
        new PipeConnection(name, "accept", toAcceptor, toDialer),
        new PipeConnection(name, "dial", toDialer, toAcceptor));
  }

  public String name() {
    return name;
  }

  public InputStream getInputStream() {
    return input;
  }

  public OutputStream getOutputStream() {
    return output;
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      outbound.closeWrite();
      inbound.closeRead();
    }
  }

  @Override
  public String toString() {
    return "PipeConnection{" + name + "/" + side + (closed.get() ? ", closed}" : "}");
  }

  record Pair(PipeConnection acceptor, PipeConnection dialer) {
    void close() {
      acceptor.close();
      dialer.close();
    }
  }

  private final class PipeInputStream extends InputStream {
    @Override
    public int read() throws IOException {
      byte[] one = new byte[1];
      int n = read(one, 0, 1);
      return n < 0 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      return inbound.read(b, off, len);
    }

    @Override
    public int available() {
      return inbound.available();
    }

    @Override
    public void close() {
      PipeConnection.this.close();
    }
  }

  private final class PipeOutputStream extends OutputStream {
    @Override
    public void write(int b) throws IOException {
      write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      outbound.write(b, off, len);
    }

    @Override
    public void close() {
      PipeConnection.this.close();
    }
  }
}
