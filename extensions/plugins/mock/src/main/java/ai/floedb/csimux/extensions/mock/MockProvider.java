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

package ai.floedb.csimux.extensions.mock;

import ai.floedb.csimux.csi.rpc.ControllerGetCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.ControllerGetCapabilitiesResponse;
import ai.floedb.csimux.csi.rpc.ControllerPublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.ControllerPublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.ControllerServiceCapability;
import ai.floedb.csimux.csi.rpc.ControllerUnpublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.ControllerUnpublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.CreateVolumeRequest;
import ai.floedb.csimux.csi.rpc.CreateVolumeResponse;
import ai.floedb.csimux.csi.rpc.DeleteVolumeRequest;
import ai.floedb.csimux.csi.rpc.DeleteVolumeResponse;
import ai.floedb.csimux.csi.rpc.Error;
import ai.floedb.csimux.csi.rpc.Error.ControllerPublishVolumeError.ControllerPublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.ControllerUnpublishVolumeError.ControllerUnpublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.CreateVolumeError.CreateVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.DeleteVolumeError.DeleteVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.GeneralError.GeneralErrorCode;
import ai.floedb.csimux.csi.rpc.Error.NodePublishVolumeError.NodePublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.NodeUnpublishVolumeError.NodeUnpublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.GetCapacityRequest;
import ai.floedb.csimux.csi.rpc.GetCapacityResponse;
import ai.floedb.csimux.csi.rpc.GetNodeIDRequest;
import ai.floedb.csimux.csi.rpc.GetNodeIDResponse;
import ai.floedb.csimux.csi.rpc.GetPluginInfoRequest;
import ai.floedb.csimux.csi.rpc.GetPluginInfoResponse;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsRequest;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsResponse;
import ai.floedb.csimux.csi.rpc.ListVolumesRequest;
import ai.floedb.csimux.csi.rpc.ListVolumesResponse;
import ai.floedb.csimux.csi.rpc.NodeGetCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.NodeGetCapabilitiesResponse;
import ai.floedb.csimux.csi.rpc.NodeID;
import ai.floedb.csimux.csi.rpc.NodePublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.NodePublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.NodeServiceCapability;
import ai.floedb.csimux.csi.rpc.NodeUnpublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.NodeUnpublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.ProbeNodeRequest;
import ai.floedb.csimux.csi.rpc.ProbeNodeResponse;
import ai.floedb.csimux.csi.rpc.PublishVolumeInfo;
import ai.floedb.csimux.csi.rpc.ValidateVolumeCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.ValidateVolumeCapabilitiesResponse;
import ai.floedb.csimux.csi.rpc.Version;
import ai.floedb.csimux.csi.rpc.VolumeCapability;
import ai.floedb.csimux.csi.rpc.VolumeID;
import ai.floedb.csimux.csi.rpc.VolumeInfo;
import ai.floedb.csimux.spi.PipeServerProvider;
import ai.floedb.csimux.spi.csi.CsiErrors;
import ai.floedb.csimux.spi.csi.CsiVersions;
import io.grpc.stub.StreamObserver;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Storage provider backed by an in-memory {@link VolumeCatalog}. Each instance starts with three
 * 100 GiB volumes and forgets everything when it goes away.
 */
public class MockProvider extends PipeServerProvider {
  private static final Logger LOG = Logger.getLogger(MockProvider.class);

  public static final String NAME = "mock";
  static final String VENDOR_VERSION = "0.1.0";
  static final Version SUPPORTED_VERSION = CsiVersions.of(0, 1, 0);
  static final long TOTAL_CAPACITY = 100L * 1024 * VolumeCatalog.GIB;
  static final String NODE_ID = "mock";
  static final String MOUNT_PATH_KEY = NODE_ID + ".mntpath";

  private final VolumeCatalog volumes = new VolumeCatalog();
  private final Clock clock;

  public MockProvider() {
    this(NAME, Clock.systemUTC());
  }

  MockProvider(String name, Clock clock) {
    super(name);
    this.clock = clock;
  }

  // Identity

  @Override
  public void getSupportedVersions(
      GetSupportedVersionsRequest request,
      StreamObserver<GetSupportedVersionsResponse> responses) {
    reply(
        responses,
        GetSupportedVersionsResponse.newBuilder()
            .setResult(
                GetSupportedVersionsResponse.Result.newBuilder()
                    .addSupportedVersions(SUPPORTED_VERSION))
            .build());
  }

  @Override
  public void getPluginInfo(
      GetPluginInfoRequest request, StreamObserver<GetPluginInfoResponse> responses) {
    reply(
        responses,
        GetPluginInfoResponse.newBuilder()
            .setResult(
                GetPluginInfoResponse.Result.newBuilder()
                    .setName(providerName())
                    .setVendorVersion(VENDOR_VERSION))
            .build());
  }

  // Controller

  @Override
  public void createVolume(
      CreateVolumeRequest request, StreamObserver<CreateVolumeResponse> responses) {
    LOG.debugf(
        "%s: CreateVolume name=%s version=%s capacity=%s",
        providerName(),
        request.getName(),
        CsiVersions.format(request.hasVersion() ? request.getVersion() : null),
        request.getCapacityRange().getRequiredBytes());
    if (request.getName().isEmpty()) {
      reply(
          responses,
          CreateVolumeResponse.newBuilder()
              .setError(
                  CsiErrors.createVolume(CreateVolumeErrorCode.INVALID_VOLUME_NAME, "missing name"))
              .build());
      return;
    }
    long required = request.getCapacityRange().getRequiredBytes();
    VolumeInfo volume =
        volumes.getOrCreate(
            request.getName(), required != 0 ? required : VolumeCatalog.DEFAULT_CAPACITY);
    LOG.debugf("%s: volume %s", providerName(), volume.getId().getValuesMap().get("id"));
    reply(
        responses,
        CreateVolumeResponse.newBuilder()
            .setResult(CreateVolumeResponse.Result.newBuilder().setVolumeInfo(volume))
            .build());
  }

  @Override
  public void deleteVolume(
      DeleteVolumeRequest request, StreamObserver<DeleteVolumeResponse> responses) {
    String problem = invalidVolumeId(request.hasVolumeId(), request.getVolumeId());
    if (problem != null) {
      reply(
          responses,
          DeleteVolumeResponse.newBuilder()
              .setError(CsiErrors.deleteVolume(DeleteVolumeErrorCode.INVALID_VOLUME_ID, problem))
              .build());
      return;
    }
    String id = request.getVolumeId().getValuesMap().get("id");
    if (volumes.delete(id)) {
      LOG.debugf("%s: deleted volume %s", providerName(), id);
    }
    reply(
        responses,
        DeleteVolumeResponse.newBuilder()
            .setResult(DeleteVolumeResponse.Result.getDefaultInstance())
            .build());
  }

  @Override
  public void controllerPublishVolume(
      ControllerPublishVolumeRequest request,
      StreamObserver<ControllerPublishVolumeResponse> responses) {
    LOG.debugf(
        "%s: ControllerPublishVolume volume=%s node=%s readonly=%s",
        providerName(),
        request.getVolumeId().getValuesMap(),
        request.getNodeId().getValuesMap(),
        request.getReadonly());
    String problem = invalidVolumeId(request.hasVolumeId(), request.getVolumeId());
    if (problem != null) {
      reply(responses, publishError(ControllerPublishVolumeErrorCode.INVALID_VOLUME_ID, problem));
      return;
    }
    problem = invalidNodeId(request.hasNodeId(), request.getNodeId());
    if (problem != null) {
      reply(responses, publishError(ControllerPublishVolumeErrorCode.INVALID_NODE_ID, problem));
      return;
    }

    String id = request.getVolumeId().getValuesMap().get("id");
    String node = request.getNodeId().getValuesMap().get("id");
    Optional<String> devicePath =
        volumes.attach(id, node, () -> Long.toString(clock.instant().getEpochSecond()));
    if (devicePath.isEmpty()) {
      reply(
          responses,
          publishError(ControllerPublishVolumeErrorCode.VOLUME_DOES_NOT_EXIST, "missing volume"));
      return;
    }
    reply(
        responses,
        ControllerPublishVolumeResponse.newBuilder()
            .setResult(
                ControllerPublishVolumeResponse.Result.newBuilder()
                    .setPublishVolumeInfo(
                        PublishVolumeInfo.newBuilder().putValues("devpath", devicePath.get())))
            .build());
  }

  @Override
  public void controllerUnpublishVolume(
      ControllerUnpublishVolumeRequest request,
      StreamObserver<ControllerUnpublishVolumeResponse> responses) {
    String problem = invalidVolumeId(request.hasVolumeId(), request.getVolumeId());
    if (problem != null) {
      reply(
          responses,
          unpublishError(ControllerUnpublishVolumeErrorCode.INVALID_VOLUME_ID, problem));
      return;
    }
    problem = invalidNodeId(request.hasNodeId(), request.getNodeId());
    if (problem != null) {
      ControllerUnpublishVolumeErrorCode code =
          request.getNodeId().getValuesCount() == 0
              ? ControllerUnpublishVolumeErrorCode.INVALID_NODE_ID
              : ControllerUnpublishVolumeErrorCode.NODE_ID_REQUIRED;
      reply(responses, unpublishError(code, problem));
      return;
    }

    String id = request.getVolumeId().getValuesMap().get("id");
    String node = request.getNodeId().getValuesMap().get("id");
    switch (volumes.detach(id, node)) {
      case NO_VOLUME -> reply(
          responses,
          unpublishError(
              ControllerUnpublishVolumeErrorCode.VOLUME_DOES_NOT_EXIST, "missing volume"));
      case NOT_ATTACHED -> reply(
          responses,
          unpublishError(
              ControllerUnpublishVolumeErrorCode.VOLUME_NOT_ATTACHED_TO_SPECIFIED_NODE,
              "not attached"));
      case DETACHED -> reply(
          responses,
          ControllerUnpublishVolumeResponse.newBuilder()
              .setResult(ControllerUnpublishVolumeResponse.Result.getDefaultInstance())
              .build());
    }
  }

  @Override
  public void validateVolumeCapabilities(
      ValidateVolumeCapabilitiesRequest request,
      StreamObserver<ValidateVolumeCapabilitiesResponse> responses) {
    reply(
        responses,
        ValidateVolumeCapabilitiesResponse.newBuilder()
            .setResult(ValidateVolumeCapabilitiesResponse.Result.newBuilder().setSupported(true))
            .build());
  }

  @Override
  public void listVolumes(
      ListVolumesRequest request, StreamObserver<ListVolumesResponse> responses) {
    long start = 0;
    String token = request.getStartingToken();
    if (!token.isEmpty()) {
      try {
        start = Integer.toUnsignedLong(Integer.parseUnsignedInt(token));
      } catch (NumberFormatException e) {
        reply(responses, listError("startingToken=" + token + " !< uint32=" + 0xFFFFFFFFL));
        return;
      }
    }

    VolumeCatalog.Page page;
    try {
      page = volumes.list(start, Integer.toUnsignedLong(request.getMaxEntries()));
    } catch (IllegalArgumentException e) {
      reply(responses, listError(e.getMessage()));
      return;
    }
    ListVolumesResponse.Result.Builder result =
        ListVolumesResponse.Result.newBuilder().setNextToken(page.nextToken());
    for (VolumeInfo volume : page.entries()) {
      result.addEntries(ListVolumesResponse.Result.Entry.newBuilder().setVolumeInfo(volume));
    }
    reply(responses, ListVolumesResponse.newBuilder().setResult(result).build());
  }

  @Override
  public void getCapacity(
      GetCapacityRequest request, StreamObserver<GetCapacityResponse> responses) {
    reply(
        responses,
        GetCapacityResponse.newBuilder()
            .setResult(GetCapacityResponse.Result.newBuilder().setTotalCapacity(TOTAL_CAPACITY))
            .build());
  }

  @Override
  public void controllerGetCapabilities(
      ControllerGetCapabilitiesRequest request,
      StreamObserver<ControllerGetCapabilitiesResponse> responses) {
    ControllerGetCapabilitiesResponse.Result.Builder result =
        ControllerGetCapabilitiesResponse.Result.newBuilder();
    for (ControllerServiceCapability.RPC.Type type :
        List.of(
            ControllerServiceCapability.RPC.Type.CREATE_DELETE_VOLUME,
            ControllerServiceCapability.RPC.Type.PUBLISH_UNPUBLISH_VOLUME,
            ControllerServiceCapability.RPC.Type.LIST_VOLUMES,
            ControllerServiceCapability.RPC.Type.GET_CAPACITY)) {
      result.addCapabilities(
          ControllerServiceCapability.newBuilder()
              .setRpc(ControllerServiceCapability.RPC.newBuilder().setType(type)));
    }
    reply(responses, ControllerGetCapabilitiesResponse.newBuilder().setResult(result).build());
  }

  // Node

  @Override
  public void nodePublishVolume(
      NodePublishVolumeRequest request, StreamObserver<NodePublishVolumeResponse> responses) {
    String problem = invalidVolumeId(request.hasVolumeId(), request.getVolumeId());
    if (problem != null) {
      reply(
          responses,
          NodePublishVolumeResponse.newBuilder().setError(CsiErrors.missingField(problem)).build());
      return;
    }
    String id = request.getVolumeId().getValuesMap().get("id");
    Error error = null;
    if (volumes.get(id).isEmpty()) {
      error =
          CsiErrors.nodePublishVolume(
              NodePublishVolumeErrorCode.VOLUME_DOES_NOT_EXIST, "missing volume");
    } else if (request.getTargetPath().isEmpty()) {
      error =
          CsiErrors.nodePublishVolume(
              NodePublishVolumeErrorCode.UNSUPPORTED_MOUNT_OPTION, "missing mount path");
    } else if (!volumes.setMetadata(id, MOUNT_PATH_KEY, request.getTargetPath())) {
      error =
          CsiErrors.nodePublishVolume(
              NodePublishVolumeErrorCode.VOLUME_DOES_NOT_EXIST, "missing volume");
    }
    if (error != null) {
      reply(responses, NodePublishVolumeResponse.newBuilder().setError(error).build());
      return;
    }
    LOG.debugf("%s: volume %s mounted at %s", providerName(), id, request.getTargetPath());
    reply(
        responses,
        NodePublishVolumeResponse.newBuilder()
            .setResult(NodePublishVolumeResponse.Result.getDefaultInstance())
            .build());
  }

  @Override
  public void nodeUnpublishVolume(
      NodeUnpublishVolumeRequest request, StreamObserver<NodeUnpublishVolumeResponse> responses) {
    if (!request.hasVolumeId() || request.getVolumeId().getValuesCount() == 0) {
      String problem = request.hasVolumeId() ? "missing id map" : "missing id obj";
      reply(
          responses,
          NodeUnpublishVolumeResponse.newBuilder()
              .setError(CsiErrors.missingField(problem))
              .build());
      return;
    }
    String id = request.getVolumeId().getValuesMap().get("id");
    if (id == null || !volumes.setMetadata(id, MOUNT_PATH_KEY, null)) {
      reply(
          responses,
          NodeUnpublishVolumeResponse.newBuilder()
              .setError(
                  CsiErrors.nodeUnpublishVolume(
                      NodeUnpublishVolumeErrorCode.VOLUME_DOES_NOT_EXIST,
                      id == null ? "missing id val" : "missing volume"))
              .build());
      return;
    }
    reply(
        responses,
        NodeUnpublishVolumeResponse.newBuilder()
            .setResult(NodeUnpublishVolumeResponse.Result.getDefaultInstance())
            .build());
  }

  @Override
  public void getNodeID(GetNodeIDRequest request, StreamObserver<GetNodeIDResponse> responses) {
    reply(
        responses,
        GetNodeIDResponse.newBuilder()
            .setResult(
                GetNodeIDResponse.Result.newBuilder()
                    .setNodeId(NodeID.newBuilder().putValues("id", NODE_ID)))
            .build());
  }

  @Override
  public void probeNode(ProbeNodeRequest request, StreamObserver<ProbeNodeResponse> responses) {
    reply(
        responses,
        ProbeNodeResponse.newBuilder()
            .setResult(ProbeNodeResponse.Result.getDefaultInstance())
            .build());
  }

  @Override
  public void nodeGetCapabilities(
      NodeGetCapabilitiesRequest request, StreamObserver<NodeGetCapabilitiesResponse> responses) {
    VolumeCapability mount =
        VolumeCapability.newBuilder()
            .setMount(
                VolumeCapability.MountVolume.newBuilder()
                    .setFsType("ext4")
                    .addMountFlags("norootsquash")
                    .addMountFlags("uid=500")
                    .addMountFlags("gid=500"))
            .build();
    reply(
        responses,
        NodeGetCapabilitiesResponse.newBuilder()
            .setResult(
                NodeGetCapabilitiesResponse.Result.newBuilder()
                    .addCapabilities(NodeServiceCapability.newBuilder().setVolumeCapability(mount)))
            .build());
  }

  /** Number of volumes currently in the catalog. */
  int volumeCount() {
    return volumes.size();
  }

  private static String invalidVolumeId(boolean present, VolumeID id) {
    if (!present) {
      return "missing id obj";
    }
    if (id.getValuesCount() == 0) {
      return "missing id map";
    }
    if (!id.containsValues("id")) {
      return "missing id val";
    }
    return null;
  }

  private static String invalidNodeId(boolean present, NodeID id) {
    if (!present || id.getValuesCount() == 0) {
      return "missing node id";
    }
    if (!id.containsValues("id")) {
      return "node id required";
    }
    return null;
  }

  private static ControllerPublishVolumeResponse publishError(
      ControllerPublishVolumeErrorCode code, String description) {
    return ControllerPublishVolumeResponse.newBuilder()
        .setError(CsiErrors.controllerPublishVolume(code, description))
        .build();
  }

  private static ControllerUnpublishVolumeResponse unpublishError(
      ControllerUnpublishVolumeErrorCode code, String description) {
    return ControllerUnpublishVolumeResponse.newBuilder()
        .setError(CsiErrors.controllerUnpublishVolume(code, description))
        .build();
  }

  private static ListVolumesResponse listError(String description) {
    return ListVolumesResponse.newBuilder()
        .setError(CsiErrors.general(GeneralErrorCode.UNKNOWN, description))
        .build();
  }

  private static <T> void reply(StreamObserver<T> responses, T response) {
    responses.onNext(response);
    responses.onCompleted();
  }
}
