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

import io.grpc.Context;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.Status;
import java.util.concurrent.CompletableFuture;

/** Server half of one unary exchange. The response is captured until the call is closed. */
final class PipeServerCall<ReqT, RespT> extends ServerCall<ReqT, RespT> {
  private final String authority;
  private final MethodDescriptor<ReqT, RespT> method;
  private final Context.CancellableContext context;
  private final CompletableFuture<PipeFrames.Response> result = new CompletableFuture<>();
  private byte[] message;

  PipeServerCall(
      String authority, MethodDescriptor<ReqT, RespT> method, Context.CancellableContext context) {
    this.authority = authority;
    this.method = method;
    this.context = context;
  }

  @Override
  public void request(int numMessages) {}

  @Override
  public void sendHeaders(Metadata headers) {}

  @Override
  public synchronized void sendMessage(RespT response) {
    if (result.isDone()) {
      return;
    }
    if (message != null) {
      throw new IllegalStateException("unary call already has a response");
    }
    message = PipeFrames.drain(method.streamResponse(response));
  }

  @Override
  public synchronized void close(Status status, Metadata trailers) {
    result.complete(
        new PipeFrames.Response(
            status, trailers == null ? new Metadata() : trailers, status.isOk() ? message : null));
  }

  @Override
  public boolean isCancelled() {
    return context.isCancelled();
  }

  @Override
  public MethodDescriptor<ReqT, RespT> getMethodDescriptor() {
    return method;
  }

  @Override
  public String getAuthority() {
    return authority;
  }

  boolean isClosed() {
    return result.isDone();
  }

  CompletableFuture<PipeFrames.Response> result() {
    return result;
  }

  void cancel(Status status) {
    result.complete(PipeFrames.Response.of(status));
    context.cancel(status.asRuntimeException());
  }
}
