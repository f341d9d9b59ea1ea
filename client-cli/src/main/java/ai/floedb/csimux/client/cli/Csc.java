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

import ai.floedb.csimux.csi.rpc.ControllerGrpc;
import ai.floedb.csimux.csi.rpc.Error;
import ai.floedb.csimux.csi.rpc.GetPluginInfoRequest;
import ai.floedb.csimux.csi.rpc.GetPluginInfoResponse;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsRequest;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsResponse;
import ai.floedb.csimux.csi.rpc.IdentityGrpc;
import ai.floedb.csimux.csi.rpc.ListVolumesRequest;
import ai.floedb.csimux.csi.rpc.ListVolumesResponse;
import ai.floedb.csimux.csi.rpc.Version;
import ai.floedb.csimux.csi.rpc.VolumeInfo;
import ai.floedb.csimux.spi.csi.CsiErrors;
import ai.floedb.csimux.spi.csi.CsiVersions;
import io.grpc.Channel;
import io.grpc.ClientInterceptors;
import io.grpc.StatusRuntimeException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.stream.Collectors;
import picocli.CommandLine;

@CommandLine.Command(
    name = "csc",
    version = "csc 0.1",
    description = "Calls the Identity and Controller services of a CSI endpoint",
    subcommands = {CommandLine.HelpCommand.class})
public final class Csc implements Callable<Integer> {
  static {
    if (System.getProperty("java.util.logging.manager") == null && hasJbossLogManager()) {
      System.setProperty("java.util.logging.manager", "org.jboss.logmanager.LogManager");
    }
  }

  @CommandLine.Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Show this help message and exit")
  boolean help;

  @CommandLine.Option(
      names = {"--endpoint"},
      defaultValue = "${env:CSI_ENDPOINT:-tcp://127.0.0.1:8080}",
      description = "CSI endpoint, scheme://address (default: CSI_ENDPOINT or ${DEFAULT-VALUE})")
  String endpoint;

  @CommandLine.Option(
      names = {"--service"},
      description = "Name of the service the call is routed to")
  String service;

  @CommandLine.Option(
      names = {"--version"},
      defaultValue = "0.1.0",
      description = "CSI version sent with each request (default: ${DEFAULT-VALUE})")
  String version;

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  private final Function<String, CscChannels.Connection> connector;
  private PrintWriter out;
  private PrintWriter err;

  public Csc() {
    this(CscChannels::open);
  }

  Csc(Function<String, CscChannels.Connection> connector) {
    this.connector = connector;
  }

  public static void main(String[] args) {
    System.exit(new Csc().run(args, System.out, System.err));
  }

  private static boolean hasJbossLogManager() {
    try {
      Class.forName("org.jboss.logmanager.LogManager", false, Csc.class.getClassLoader());
      return true;
    } catch (ClassNotFoundException ignored) {
      return false;
    }
  }

  int run(String[] args, PrintStream stdout, PrintStream stderr) {
    out = new PrintWriter(stdout, true, StandardCharsets.UTF_8);
    err = new PrintWriter(stderr, true, StandardCharsets.UTF_8);
    CommandLine cmd = new CommandLine(this);
    cmd.setOut(out);
    cmd.setErr(err);
    cmd.setExecutionExceptionHandler(
        (e, commandLine, parseResult) -> {
          printError(e);
          return 1;
        });
    return cmd.execute(args);
  }

  @Override
  public Integer call() {
    spec.commandLine().usage(out);
    return 2;
  }

  @CommandLine.Command(
      name = "supported-versions",
      description = "List the CSI versions the endpoint supports")
  int supportedVersions() {
    try (CscChannels.Connection connection = connector.apply(endpoint)) {
      GetSupportedVersionsResponse response =
          IdentityGrpc.newBlockingStub(intercepted(connection))
              .getSupportedVersions(GetSupportedVersionsRequest.getDefaultInstance());
      if (response.getReplyCase() == GetSupportedVersionsResponse.ReplyCase.ERROR) {
        return fail(response.getError());
      }
      for (Version supported : response.getResult().getSupportedVersionsList()) {
        out.println(CsiVersions.format(supported));
      }
      return 0;
    }
  }

  @CommandLine.Command(name = "plugin-info", description = "Show the plug-in name and version")
  int pluginInfo() {
    Version requested = CsiVersions.parse(version);
    try (CscChannels.Connection connection = connector.apply(endpoint)) {
      GetPluginInfoResponse response =
          IdentityGrpc.newBlockingStub(intercepted(connection))
              .getPluginInfo(GetPluginInfoRequest.newBuilder().setVersion(requested).build());
      if (response.getReplyCase() == GetPluginInfoResponse.ReplyCase.ERROR) {
        return fail(response.getError());
      }
      GetPluginInfoResponse.Result result = response.getResult();
      out.println(result.getName() + " " + result.getVendorVersion());
      new TreeMap<>(result.getManifestMap())
          .forEach((key, value) -> out.println("  " + key + "=" + value));
      return 0;
    }
  }

  @CommandLine.Command(name = "list-volumes", description = "List volumes, one per line")
  int listVolumes(
      @CommandLine.Option(
              names = {"--max-entries"},
              defaultValue = "0",
              description = "Entries per page, 0 for no limit")
          int maxEntries,
      @CommandLine.Option(
              names = {"--starting-token"},
              defaultValue = "",
              description = "Token of the first entry to return")
          String startingToken,
      @CommandLine.Option(
              names = {"--all"},
              description = "Keep following next tokens until the listing is complete")
          boolean all) {
    Version requested = CsiVersions.parse(version);
    try (CscChannels.Connection connection = connector.apply(endpoint)) {
      ControllerGrpc.ControllerBlockingStub controller =
          ControllerGrpc.newBlockingStub(intercepted(connection));
      String token = startingToken;
      while (true) {
        ListVolumesResponse response =
            controller.listVolumes(
                ListVolumesRequest.newBuilder()
                    .setVersion(requested)
                    .setMaxEntries(maxEntries)
                    .setStartingToken(token)
                    .build());
        if (response.getReplyCase() == ListVolumesResponse.ReplyCase.ERROR) {
          return fail(response.getError());
        }
        ListVolumesResponse.Result result = response.getResult();
        for (ListVolumesResponse.Result.Entry entry : result.getEntriesList()) {
          out.println(render(entry.getVolumeInfo()));
        }
        token = result.getNextToken();
        if (token.isEmpty()) {
          return 0;
        }
        if (!all) {
          out.println("next_token=" + token);
          return 0;
        }
      }
    }
  }

  private Channel intercepted(CscChannels.Connection connection) {
    return ClientInterceptors.intercept(
        connection.channel(), new ServiceHeaderInterceptor(service));
  }

  private int fail(Error error) {
    err.println("! " + CsiErrors.describe(error));
    return 1;
  }

  static String render(VolumeInfo volume) {
    StringBuilder line = new StringBuilder();
    line.append(join(volume.getId().getValuesMap()));
    line.append(" capacity=").append(Long.toUnsignedString(volume.getCapacityBytes()));
    if (volume.hasMetadata() && volume.getMetadata().getValuesCount() > 0) {
      line.append(" metadata={").append(join(volume.getMetadata().getValuesMap())).append('}');
    }
    return line.toString();
  }

  private static String join(Map<String, String> values) {
    return new TreeMap<>(values)
        .entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(","));
  }

  private void printError(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    err.println("! " + renderThrowable(t));
    if (root != t) {
      err.println("! caused by: " + renderThrowable(root));
    }
  }

  private static String renderThrowable(Throwable t) {
    if (t instanceof StatusRuntimeException sre) {
      var status = sre.getStatus();
      String desc = status.getDescription();
      if (desc == null || desc.isBlank()) {
        return "grpc=" + status.getCode();
      }
      return "grpc=" + status.getCode() + " desc=" + desc;
    }
    String msg = t.getMessage();
    if (msg == null || msg.isBlank()) {
      return t.getClass().getSimpleName();
    }
    return msg;
  }
}
