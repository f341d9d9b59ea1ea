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

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.csimux.csi.rpc.CapacityRange;
import ai.floedb.csimux.csi.rpc.ControllerGetCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.ControllerPublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.ControllerPublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.ControllerServiceCapability;
import ai.floedb.csimux.csi.rpc.ControllerUnpublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.ControllerUnpublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.CreateVolumeRequest;
import ai.floedb.csimux.csi.rpc.CreateVolumeResponse;
import ai.floedb.csimux.csi.rpc.DeleteVolumeRequest;
import ai.floedb.csimux.csi.rpc.DeleteVolumeResponse;
import ai.floedb.csimux.csi.rpc.Error.ControllerPublishVolumeError.ControllerPublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.ControllerUnpublishVolumeError.ControllerUnpublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.CreateVolumeError.CreateVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.DeleteVolumeError.DeleteVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.GeneralError.GeneralErrorCode;
import ai.floedb.csimux.csi.rpc.Error.NodePublishVolumeError.NodePublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.NodeUnpublishVolumeError.NodeUnpublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.GetCapacityRequest;
import ai.floedb.csimux.csi.rpc.GetNodeIDRequest;
import ai.floedb.csimux.csi.rpc.GetPluginInfoRequest;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsRequest;
import ai.floedb.csimux.csi.rpc.ListVolumesRequest;
import ai.floedb.csimux.csi.rpc.ListVolumesResponse;
import ai.floedb.csimux.csi.rpc.NodeGetCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.NodeID;
import ai.floedb.csimux.csi.rpc.NodePublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.NodePublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.NodeUnpublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.NodeUnpublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.ProbeNodeRequest;
import ai.floedb.csimux.csi.rpc.ValidateVolumeCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.VolumeCapability;
import ai.floedb.csimux.csi.rpc.VolumeID;
import ai.floedb.csimux.csi.rpc.VolumeInfo;
import io.grpc.stub.StreamObserver;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import org.junit.jupiter.api.Test;

class MockProviderTest {
  private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

  private final MockProvider provider =
      new MockProvider(MockProvider.NAME, Clock.fixed(NOW, ZoneOffset.UTC));

  /** Invokes a unary method and returns its only response. */
  private static <Q, R> R call(BiConsumer<Q, StreamObserver<R>> method, Q request) {
    List<R> responses = new ArrayList<>();
    boolean[] completed = {false};
    method.accept(
        request,
        new StreamObserver<>() {
          @Override
          public void onNext(R value) {
            responses.add(value);
          }

          @Override
          public void onError(Throwable t) {
            throw new AssertionError("unexpected error", t);
          }

          @Override
          public void onCompleted() {
            completed[0] = true;
          }
        });
    assertThat(completed[0]).isTrue();
    assertThat(responses).hasSize(1);
    return responses.get(0);
  }

  private static VolumeID volumeId(String id) {
    return VolumeID.newBuilder().putValues("id", id).build();
  }

  private static NodeID nodeId(String id) {
    return NodeID.newBuilder().putValues("id", id).build();
  }

  private ListVolumesResponse list(int maxEntries, String token) {
    return call(
        provider::listVolumes,
        ListVolumesRequest.newBuilder().setMaxEntries(maxEntries).setStartingToken(token).build());
  }

  private static List<String> names(ListVolumesResponse response) {
    List<String> names = new ArrayList<>();
    for (ListVolumesResponse.Result.Entry entry : response.getResult().getEntriesList()) {
      names.add(entry.getVolumeInfo().getId().getValuesMap().get("name"));
    }
    return names;
  }

  private VolumeInfo volume(String id) {
    for (ListVolumesResponse.Result.Entry entry : list(0, "").getResult().getEntriesList()) {
      if (entry.getVolumeInfo().getId().getValuesMap().get("id").equals(id)) {
        return entry.getVolumeInfo();
      }
    }
    throw new AssertionError("no volume " + id);
  }

  @Test
  void startsWithThreeSeededVolumes() {
    ListVolumesResponse response = list(0, "");

    assertThat(names(response)).containsExactly("Mock Volume 1", "Mock Volume 2", "Mock Volume 3");
    assertThat(response.getResult().getNextToken()).isEmpty();
    assertThat(response.getResult().getEntries(0).getVolumeInfo().getCapacityBytes())
        .isEqualTo(100L << 30);
  }

  @Test
  void listsVolumesInPages() {
    ListVolumesResponse first = list(2, "");
    ListVolumesResponse second = list(2, first.getResult().getNextToken());

    assertThat(names(first)).containsExactly("Mock Volume 1", "Mock Volume 2");
    assertThat(first.getResult().getNextToken()).isEqualTo("2");
    assertThat(names(second)).containsExactly("Mock Volume 3");
    assertThat(second.getResult().getNextToken()).isEmpty();
    assertThat(list(0, "3").getResult().getEntriesList()).isEmpty();
  }

  @Test
  void rejectsBadStartingTokens() {
    ListVolumesResponse garbage = list(0, "abc");
    ListVolumesResponse pastEnd = list(0, "4");

    assertThat(garbage.getError().getGeneralError().getErrorCode())
        .isEqualTo(GeneralErrorCode.UNKNOWN);
    assertThat(pastEnd.getError().getGeneralError().getErrorDescription())
        .isEqualTo("startingToken=4 > len(vols)=3");
  }

  @Test
  void createVolumeIsIdempotentByName() {
    CreateVolumeRequest request =
        CreateVolumeRequest.newBuilder()
            .setName("scratch")
            .setCapacityRange(CapacityRange.newBuilder().setRequiredBytes(1024))
            .build();

    VolumeInfo created = call(provider::createVolume, request).getResult().getVolumeInfo();
    VolumeInfo again =
        call(provider::createVolume, request.toBuilder().setName("SCRATCH").build())
            .getResult()
            .getVolumeInfo();

    assertThat(created.getId().getValuesMap()).containsEntry("id", "4");
    assertThat(created.getCapacityBytes()).isEqualTo(1024);
    assertThat(again.getId()).isEqualTo(created.getId());
    assertThat(provider.volumeCount()).isEqualTo(4);
  }

  @Test
  void createVolumeDefaultsCapacityAndRequiresName() {
    VolumeInfo created =
        call(provider::createVolume, CreateVolumeRequest.newBuilder().setName("big").build())
            .getResult()
            .getVolumeInfo();
    CreateVolumeResponse unnamed =
        call(provider::createVolume, CreateVolumeRequest.getDefaultInstance());

    assertThat(created.getCapacityBytes()).isEqualTo(VolumeCatalog.DEFAULT_CAPACITY);
    assertThat(unnamed.getError().getCreateVolumeError().getErrorCode())
        .isEqualTo(CreateVolumeErrorCode.INVALID_VOLUME_NAME);
  }

  @Test
  void deleteVolumeRemovesAndToleratesMissing() {
    DeleteVolumeResponse deleted =
        call(
            provider::deleteVolume,
            DeleteVolumeRequest.newBuilder().setVolumeId(volumeId("1")).build());
    DeleteVolumeResponse missing =
        call(
            provider::deleteVolume,
            DeleteVolumeRequest.newBuilder().setVolumeId(volumeId("42")).build());
    DeleteVolumeResponse noId =
        call(
            provider::deleteVolume,
            DeleteVolumeRequest.newBuilder()
                .setVolumeId(VolumeID.newBuilder().putValues("name", "Mock Volume 2"))
                .build());

    assertThat(deleted.hasResult()).isTrue();
    assertThat(missing.hasResult()).isTrue();
    assertThat(noId.getError().getDeleteVolumeError().getErrorCode())
        .isEqualTo(DeleteVolumeErrorCode.INVALID_VOLUME_ID);
    assertThat(noId.getError().getDeleteVolumeError().getErrorDescription())
        .isEqualTo("missing id val");
    assertThat(names(list(0, ""))).containsExactly("Mock Volume 2", "Mock Volume 3");
  }

  @Test
  void controllerPublishAttachesOncePerNode() {
    ControllerPublishVolumeRequest request =
        ControllerPublishVolumeRequest.newBuilder()
            .setVolumeId(volumeId("2"))
            .setNodeId(nodeId("node-1"))
            .build();

    ControllerPublishVolumeResponse first = call(provider::controllerPublishVolume, request);
    ControllerPublishVolumeResponse second = call(provider::controllerPublishVolume, request);

    assertThat(first.getResult().getPublishVolumeInfo().getValuesMap())
        .containsEntry("devpath", "1700000000");
    assertThat(second).isEqualTo(first);
    assertThat(volume("2").getMetadata().getValuesMap())
        .containsEntry("devpath.node-1", "1700000000");
  }

  @Test
  void controllerPublishReportsBadInput() {
    ControllerPublishVolumeResponse unknownVolume =
        call(
            provider::controllerPublishVolume,
            ControllerPublishVolumeRequest.newBuilder()
                .setVolumeId(volumeId("9"))
                .setNodeId(nodeId("node-1"))
                .build());
    ControllerPublishVolumeResponse noNode =
        call(
            provider::controllerPublishVolume,
            ControllerPublishVolumeRequest.newBuilder().setVolumeId(volumeId("1")).build());
    ControllerPublishVolumeResponse nodeWithoutId =
        call(
            provider::controllerPublishVolume,
            ControllerPublishVolumeRequest.newBuilder()
                .setVolumeId(volumeId("1"))
                .setNodeId(NodeID.newBuilder().putValues("host", "h"))
                .build());

    assertThat(unknownVolume.getError().getControllerPublishVolumeError().getErrorCode())
        .isEqualTo(ControllerPublishVolumeErrorCode.VOLUME_DOES_NOT_EXIST);
    assertThat(noNode.getError().getControllerPublishVolumeError().getErrorCode())
        .isEqualTo(ControllerPublishVolumeErrorCode.INVALID_NODE_ID);
    assertThat(nodeWithoutId.getError().getControllerPublishVolumeError().getErrorDescription())
        .isEqualTo("node id required");
  }

  @Test
  void controllerUnpublishDetachesFromNode() {
    call(
        provider::controllerPublishVolume,
        ControllerPublishVolumeRequest.newBuilder()
            .setVolumeId(volumeId("1"))
            .setNodeId(nodeId("node-1"))
            .build());
    ControllerUnpublishVolumeRequest request =
        ControllerUnpublishVolumeRequest.newBuilder()
            .setVolumeId(volumeId("1"))
            .setNodeId(nodeId("node-1"))
            .build();

    ControllerUnpublishVolumeResponse detached = call(provider::controllerUnpublishVolume, request);
    ControllerUnpublishVolumeResponse again = call(provider::controllerUnpublishVolume, request);
    ControllerUnpublishVolumeResponse nodeWithoutId =
        call(
            provider::controllerUnpublishVolume,
            request.toBuilder().setNodeId(NodeID.newBuilder().putValues("host", "h")).build());

    assertThat(detached.hasResult()).isTrue();
    assertThat(volume("1").getMetadata().getValuesMap()).doesNotContainKey("devpath.node-1");
    assertThat(again.getError().getControllerUnpublishVolumeError().getErrorCode())
        .isEqualTo(ControllerUnpublishVolumeErrorCode.VOLUME_NOT_ATTACHED_TO_SPECIFIED_NODE);
    assertThat(nodeWithoutId.getError().getControllerUnpublishVolumeError().getErrorCode())
        .isEqualTo(ControllerUnpublishVolumeErrorCode.NODE_ID_REQUIRED);
  }

  @Test
  void nodePublishRecordsMountPath() {
    NodePublishVolumeResponse published =
        call(
            provider::nodePublishVolume,
            NodePublishVolumeRequest.newBuilder()
                .setVolumeId(volumeId("3"))
                .setTargetPath("/mnt/three")
                .build());
    assertThat(published.hasResult()).isTrue();
    assertThat(volume("3").getMetadata().getValuesMap())
        .containsEntry(MockProvider.MOUNT_PATH_KEY, "/mnt/three");

    NodeUnpublishVolumeResponse unpublished =
        call(
            provider::nodeUnpublishVolume,
            NodeUnpublishVolumeRequest.newBuilder().setVolumeId(volumeId("3")).build());
    assertThat(unpublished.hasResult()).isTrue();
    assertThat(volume("3").getMetadata().getValuesMap())
        .doesNotContainKey(MockProvider.MOUNT_PATH_KEY);
  }

  @Test
  void nodePublishReportsBadInput() {
    NodePublishVolumeResponse noPath =
        call(
            provider::nodePublishVolume,
            NodePublishVolumeRequest.newBuilder().setVolumeId(volumeId("1")).build());
    NodePublishVolumeResponse unknown =
        call(
            provider::nodePublishVolume,
            NodePublishVolumeRequest.newBuilder()
                .setVolumeId(volumeId("7"))
                .setTargetPath("/mnt")
                .build());
    NodeUnpublishVolumeResponse noIdValue =
        call(
            provider::nodeUnpublishVolume,
            NodeUnpublishVolumeRequest.newBuilder()
                .setVolumeId(VolumeID.newBuilder().putValues("name", "x"))
                .build());

    assertThat(noPath.getError().getNodePublishVolumeError().getErrorCode())
        .isEqualTo(NodePublishVolumeErrorCode.UNSUPPORTED_MOUNT_OPTION);
    assertThat(unknown.getError().getNodePublishVolumeError().getErrorCode())
        .isEqualTo(NodePublishVolumeErrorCode.VOLUME_DOES_NOT_EXIST);
    assertThat(noIdValue.getError().getNodeUnpublishVolumeError().getErrorCode())
        .isEqualTo(NodeUnpublishVolumeErrorCode.VOLUME_DOES_NOT_EXIST);
    assertThat(noIdValue.getError().getNodeUnpublishVolumeError().getErrorDescription())
        .isEqualTo("missing id val");
  }

  @Test
  void describesItself() {
    assertThat(
            call(provider::getSupportedVersions, GetSupportedVersionsRequest.getDefaultInstance())
                .getResult()
                .getSupportedVersionsList())
        .containsExactly(MockProvider.SUPPORTED_VERSION);
    assertThat(
            call(provider::getPluginInfo, GetPluginInfoRequest.getDefaultInstance()).getResult())
        .satisfies(
            info -> {
              assertThat(info.getName()).isEqualTo("mock");
              assertThat(info.getVendorVersion()).isEqualTo("0.1.0");
            });
    assertThat(
            call(provider::getNodeID, GetNodeIDRequest.getDefaultInstance())
                .getResult()
                .getNodeId()
                .getValuesMap())
        .containsEntry("id", "mock");
    assertThat(call(provider::probeNode, ProbeNodeRequest.getDefaultInstance()).hasResult())
        .isTrue();
    assertThat(
            call(provider::getCapacity, GetCapacityRequest.getDefaultInstance())
                .getResult()
                .getTotalCapacity())
        .isEqualTo(100L << 40);
    assertThat(
            call(
                    provider::validateVolumeCapabilities,
                    ValidateVolumeCapabilitiesRequest.getDefaultInstance())
                .getResult()
                .getSupported())
        .isTrue();
  }

  @Test
  void advertisesCapabilities() {
    List<ControllerServiceCapability> controller =
        call(
                provider::controllerGetCapabilities,
                ControllerGetCapabilitiesRequest.getDefaultInstance())
            .getResult()
            .getCapabilitiesList();
    VolumeCapability.MountVolume mount =
        call(provider::nodeGetCapabilities, NodeGetCapabilitiesRequest.getDefaultInstance())
            .getResult()
            .getCapabilities(0)
            .getVolumeCapability()
            .getMount();

    assertThat(controller)
        .extracting(c -> c.getRpc().getType())
        .containsExactly(
            ControllerServiceCapability.RPC.Type.CREATE_DELETE_VOLUME,
            ControllerServiceCapability.RPC.Type.PUBLISH_UNPUBLISH_VOLUME,
            ControllerServiceCapability.RPC.Type.LIST_VOLUMES,
            ControllerServiceCapability.RPC.Type.GET_CAPACITY);
    assertThat(mount.getFsType()).isEqualTo("ext4");
    assertThat(mount.getMountFlagsList()).containsExactly("norootsquash", "uid=500", "gid=500");
  }

  @Test
  void instancesDoNotShareVolumes() {
    MockProvider other = new MockProvider();
    call(provider::createVolume, CreateVolumeRequest.newBuilder().setName("only-here").build());

    assertThat(provider.volumeCount()).isEqualTo(4);
    assertThat(other.volumeCount()).isEqualTo(3);
  }
}
