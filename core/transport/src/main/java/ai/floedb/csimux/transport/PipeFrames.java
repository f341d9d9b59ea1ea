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

import io.grpc.Metadata;
import io.grpc.Status;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wire format of one unary exchange over a {@link PipeConnection}.
 *
 * <pre>
 * request  := string(method) metadata(headers) bytes(message)
 * response := int32(status code) string(description) metadata(trailers) bytes(message | absent)
 * metadata := int32(count) (string(key) bytes(value))*
 * string   := bytes(UTF-8)
 * bytes    := int32(length, -1 when absent) byte*
 * </pre>
 */
final class PipeFrames {
  static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

  private PipeFrames() {}

  record Request(String method, Metadata headers, byte[] message) {}

  record Response(Status status, Metadata trailers, byte[] message) {
    static Response of(Status status) {
      return new Response(status, new Metadata(), null);
    }
  }

  static void writeRequest(OutputStream out, Request request) throws IOException {
    DataOutputStream data = new DataOutputStream(new BufferedOutputStream(out));
    writeString(data, request.method());
    writeMetadata(data, request.headers());
    writeBytes(data, request.message());
    data.flush();
  }

  static Request readRequest(InputStream in) throws IOException {
    DataInputStream data = new DataInputStream(in);
    String method = readString(data);
    Metadata headers = readMetadata(data);
    byte[] message = readBytes(data);
    if (message == null) {
      throw new IOException("request for " + method + " carries no message");
    }
    return new Request(method, headers, message);
  }

  static void writeResponse(OutputStream out, Response response) throws IOException {
    DataOutputStream data = new DataOutputStream(new BufferedOutputStream(out));
    Status status = response.status();
    data.writeInt(status.getCode().value());
    writeString(data, status.getDescription() == null ? "" : status.getDescription());
    writeMetadata(data, response.trailers());
    writeBytes(data, response.message());
    data.flush();
  }

  static Response readResponse(InputStream in) throws IOException {
    DataInputStream data = new DataInputStream(in);
    Status status = Status.fromCodeValue(data.readInt());
    String description = readString(data);
    if (!description.isEmpty()) {
      status = status.withDescription(description);
    }
    Metadata trailers = readMetadata(data);
    byte[] message = readBytes(data);
    return new Response(status, trailers, message);
  }

  /** Reads a marshaller stream fully. */
  static byte[] drain(InputStream stream) {
    try (stream) {
      return stream.readAllBytes();
    } catch (IOException e) {
      throw Status.INTERNAL
          .withDescription("failed to serialize message")
          .withCause(e)
          .asRuntimeException();
    }
  }

  private static void writeMetadata(DataOutputStream data, Metadata metadata) throws IOException {
    List<Map.Entry<String, byte[]>> entries = new ArrayList<>();
    if (metadata != null) {
      for (String key : metadata.keys()) {
        if (key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
          Iterable<byte[]> values =
              metadata.getAll(Metadata.Key.of(key, Metadata.BINARY_BYTE_MARSHALLER));
          if (values != null) {
            values.forEach(v -> entries.add(Map.entry(key, v)));
          }
        } else {
          Iterable<String> values =
              metadata.getAll(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER));
          if (values != null) {
            values.forEach(
                v -> entries.add(Map.entry(key, v.getBytes(StandardCharsets.US_ASCII))));
          }
        }
      }
    }
    data.writeInt(entries.size());
    for (Map.Entry<String, byte[]> entry : entries) {
      writeString(data, entry.getKey());
      writeBytes(data, entry.getValue());
    }
  }

  private static Metadata readMetadata(DataInputStream data) throws IOException {
    int count = data.readInt();
    if (count < 0) {
      throw new IOException("negative metadata count: " + count);
    }
    Metadata metadata = new Metadata();
    for (int i = 0; i < count; i++) {
      String key = readString(data);
      byte[] value = readBytes(data);
      if (value == null) {
        throw new IOException("metadata entry " + key + " has no value");
      }
      if (key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
        metadata.put(Metadata.Key.of(key, Metadata.BINARY_BYTE_MARSHALLER), value);
      } else {
        metadata.put(
            Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER),
            new String(value, StandardCharsets.US_ASCII));
      }
    }
    return metadata;
  }

  private static void writeString(DataOutputStream data, String value) throws IOException {
    writeBytes(data, value.getBytes(StandardCharsets.UTF_8));
  }

  private static String readString(DataInputStream data) throws IOException {
    byte[] bytes = readBytes(data);
    if (bytes == null) {
      throw new IOException("missing string field");
    }
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private static void writeBytes(DataOutputStream data, byte[] bytes) throws IOException {
    if (bytes == null) {
      data.writeInt(-1);
      return;
    }
    data.writeInt(bytes.length);
    data.write(bytes);
  }

  private static byte[] readBytes(DataInputStream data) throws IOException {
    int length = data.readInt();
    if (length == -1) {
      return null;
    }
    if (length < 0 || length > MAX_FRAME_BYTES) {
      throw new IOException("invalid frame length: " + length);
    }
    byte[] bytes = new byte[length];
    try {
      data.readFully(bytes);
    } catch (EOFException e) {
      throw new EOFException("pipe closed mid-frame (" + length + " bytes expected)");
    }
    return bytes;
  }
}
