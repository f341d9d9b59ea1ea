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

import ai.floedb.csimux.runtime.service.StorageService;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Picks the service a call is meant for from the {@value #SERVICE_HEADER} header and exposes it
 * to {@link ServiceRouter} through {@link #TARGET}. Untagged calls, and calls naming an unknown
 * service, go to the first service.
 */
public final class ServiceRoutingInterceptor implements ServerInterceptor {
  private static final Logger LOG = Logger.getLogger(ServiceRoutingInterceptor.class);

  public static final String SERVICE_HEADER = "csi.service";
  public static final Metadata.Key<String> SERVICE_KEY =
      Metadata.Key.of(SERVICE_HEADER, Metadata.ASCII_STRING_MARSHALLER);

  static final Context.Key<StorageService> TARGET = Context.key("csimux-target-service");

  private final StorageService fallback;
  private final Map<String, StorageService> byName;

  public ServiceRoutingInterceptor(List<? extends StorageService> services) {
    if (services.isEmpty()) {
      throw new IllegalArgumentException("no services to route to");
    }
    this.fallback = services.get(0);
    Map<String, StorageService> names = new LinkedHashMap<>();
    for (StorageService service : services) {
      names.putIfAbsent(service.name().toLowerCase(Locale.ROOT), service);
    }
    this.byName = Map.copyOf(names);
  }

  @Override
  public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
      ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
    StorageService target = resolve(headers.get(SERVICE_KEY));
    LOG.debugf(
        "routed to service: type=%s name=%s method=%s",
        target.type(),
        target.name(),
        call.getMethodDescriptor().getFullMethodName());
    Context context = Context.current().withValue(TARGET, target);
    return Contexts.interceptCall(context, call, headers, next);
  }

  StorageService resolve(String requested) {
    if (requested == null || requested.isBlank()) {
      return fallback;
    }
    StorageService match = byName.get(requested.trim().toLowerCase(Locale.ROOT));
    return match != null ? match : fallback;
  }
}
