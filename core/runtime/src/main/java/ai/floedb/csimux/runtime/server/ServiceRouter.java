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

import ai.floedb.csimux.csi.rpc.ControllerGetCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.ControllerGetCapabilitiesResponse;
import ai.floedb.csimux.csi.rpc.ControllerGrpc;
import ai.floedb.csimux.csi.rpc.ControllerPublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.ControllerPublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.ControllerUnpublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.ControllerUnpublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.CreateVolumeRequest;
import ai.floedb.csimux.csi.rpc.CreateVolumeResponse;
import ai.floedb.csimux.csi.rpc.DeleteVolumeRequest;
import ai.floedb.csimux.csi.rpc.DeleteVolumeResponse;
import ai.floedb.csimux.csi.rpc.GetCapacityRequest;
import ai.floedb.csimux.csi.rpc.GetCapacityResponse;
import ai.floedb.csimux.csi.rpc.GetNodeIDRequest;
import ai.floedb.csimux.csi.rpc.GetNodeIDResponse;
import ai.floedb.csimux.csi.rpc.GetPluginInfoRequest;
import ai.floedb.csimux.csi.rpc.GetPluginInfoResponse;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsRequest;
import ai.floedb.csimux.csi.rpc.GetSupportedVersionsResponse;
import ai.floedb.csimux.csi.rpc.IdentityGrpc;
import ai.floedb.csimux.csi.rpc.ListVolumesRequest;
import ai.floedb.csimux.csi.rpc.ListVolumesResponse;
import ai.floedb.csimux.csi.rpc.NodeGetCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.NodeGetCapabilitiesResponse;
import ai.floedb.csimux.csi.rpc.NodeGrpc;
import ai.floedb.csimux.csi.rpc.NodePublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.NodePublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.NodeUnpublishVolumeRequest;
import ai.floedb.csimux.csi.rpc.NodeUnpublishVolumeResponse;
import ai.floedb.csimux.csi.rpc.ProbeNodeRequest;
import ai.floedb.csimux.csi.rpc.ProbeNodeResponse;
import ai.floedb.csimux.csi.rpc.ValidateVolumeCapabilitiesRequest;
import ai.floedb.csimux.csi.rpc.ValidateVolumeCapabilitiesResponse;
import ai.floedb.csimux.runtime.service.StorageService;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;

/** Forwards each call to the service chosen by {@link ServiceRoutingInterceptor}. */
final class ServiceRouter
    implements IdentityGrpc.AsyncService, ControllerGrpc.AsyncService, NodeGrpc.AsyncService {

  private static StorageService target() {
    StorageService target = ServiceRoutingInterceptor.TARGET.get();
    if (target == null) {
      throw Status.INTERNAL.withDescription("call was not routed").asRuntimeException();
    }
    return target;
  }

  @Override
  public void getSupportedVersions(
      GetSupportedVersionsRequest request,
      StreamObserver<GetSupportedVersionsResponse> responses) {
    target().getSupportedVersions(request, responses);
  }

  @Override
  public void getPluginInfo(
      GetPluginInfoRequest request, StreamObserver<GetPluginInfoResponse> responses) {
    target().getPluginInfo(request, responses);
  }

  @Override
  public void createVolume(
      CreateVolumeRequest request, StreamObserver<CreateVolumeResponse> responses) {
    target().createVolume(request, responses);
  }

  @Override
  public void deleteVolume(
      DeleteVolumeRequest request, StreamObserver<DeleteVolumeResponse> responses) {
    target().deleteVolume(request, responses);
  }

  @Override
  public void controllerPublishVolume(
      ControllerPublishVolumeRequest request,
      StreamObserver<ControllerPublishVolumeResponse> responses) {
    target().controllerPublishVolume(request, responses);
  }

  @Override
  public void controllerUnpublishVolume(
      ControllerUnpublishVolumeRequest request,
      StreamObserver<ControllerUnpublishVolumeResponse> responses) {
    target().controllerUnpublishVolume(request, responses);
  }

  @Override
  public void validateVolumeCapabilities(
      ValidateVolumeCapabilitiesRequest request,
      StreamObserver<ValidateVolumeCapabilitiesResponse> responses) {
    target().validateVolumeCapabilities(request, responses);
  }

  @Override
  public void listVolumes(
      ListVolumesRequest request, StreamObserver<ListVolumesResponse> responses) {
    target().listVolumes(request, responses);
  }

  @Override
  public void getCapacity(
      GetCapacityRequest request, StreamObserver<GetCapacityResponse> responses) {
    target().getCapacity(request, responses);
  }

  @Override
  public void controllerGetCapabilities(
      ControllerGetCapabilitiesRequest request,
      StreamObserver<ControllerGetCapabilitiesResponse> responses) {
    target().controllerGetCapabilities(request, responses);
  }

  @Override
  public void nodePublishVolume(
      NodePublishVolumeRequest request, StreamObserver<NodePublishVolumeResponse> responses) {
    target().nodePublishVolume(request, responses);
  }

  @Override
  public void nodeUnpublishVolume(
      NodeUnpublishVolumeRequest request, StreamObserver<NodeUnpublishVolumeResponse> responses) {
    target().nodeUnpublishVolume(request, responses);
  }

  @Override
  public void getNodeID(GetNodeIDRequest request, StreamObserver<GetNodeIDResponse> responses) {
    target().getNodeID(request, responses);
  }

  @Override
  public void probeNode(ProbeNodeRequest request, StreamObserver<ProbeNodeResponse> responses) {
    target().probeNode(request, responses);
  }

  @Override
  public void nodeGetCapabilities(
      NodeGetCapabilitiesRequest request, StreamObserver<NodeGetCapabilitiesResponse> responses) {
    target().nodeGetCapabilities(request, responses);
  }
}
