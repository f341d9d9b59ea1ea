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

package ai.floedb.csimux.spi.csi;

import ai.floedb.csimux.csi.rpc.Error;
import ai.floedb.csimux.csi.rpc.Error.ControllerPublishVolumeError.ControllerPublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.ControllerUnpublishVolumeError.ControllerUnpublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.CreateVolumeError.CreateVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.DeleteVolumeError.DeleteVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.GeneralError.GeneralErrorCode;
import ai.floedb.csimux.csi.rpc.Error.NodePublishVolumeError.NodePublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Error.NodeUnpublishVolumeError.NodeUnpublishVolumeErrorCode;
import ai.floedb.csimux.csi.rpc.Version;

/**
 * Builders for the structured error payloads carried inside successful protocol responses.
 * Transport faults use {@link io.grpc.Status} instead.
 */
public final class CsiErrors {
  private CsiErrors() {}

  public static Error general(GeneralErrorCode code, String description) {
    return Error.newBuilder()
        .setGeneralError(
            Error.GeneralError.newBuilder().setErrorCode(code).setErrorDescription(description))
        .build();
  }

  public static Error unsupportedVersion(Version requested) {
    return general(
        GeneralErrorCode.UNSUPPORTED_REQUEST_VERSION,
        requested == null
            ? "request version is nil"
            : "unsupported request version: " + CsiVersions.format(requested));
  }

  public static Error missingField(String description) {
    return general(GeneralErrorCode.MISSING_REQUIRED_FIELD, description);
  }

  public static Error createVolume(CreateVolumeErrorCode code, String description) {
    return Error.newBuilder()
        .setCreateVolumeError(
            Error.CreateVolumeError.newBuilder()
                .setErrorCode(code)
                .setErrorDescription(description))
        .build();
  }

  public static Error deleteVolume(DeleteVolumeErrorCode code, String description) {
    return Error.newBuilder()
        .setDeleteVolumeError(
            Error.DeleteVolumeError.newBuilder()
                .setErrorCode(code)
                .setErrorDescription(description))
        .build();
  }

  public static Error controllerPublishVolume(
      ControllerPublishVolumeErrorCode code, String description) {
    return Error.newBuilder()
        .setControllerPublishVolumeError(
            Error.ControllerPublishVolumeError.newBuilder()
                .setErrorCode(code)
                .setErrorDescription(description))
        .build();
  }

  public static Error controllerUnpublishVolume(
      ControllerUnpublishVolumeErrorCode code, String description) {
    return Error.newBuilder()
        .setControllerUnpublishVolumeError(
            Error.ControllerUnpublishVolumeError.newBuilder()
                .setErrorCode(code)
                .setErrorDescription(description))
        .build();
  }

  public static Error nodePublishVolume(NodePublishVolumeErrorCode code, String description) {
    return Error.newBuilder()
        .setNodePublishVolumeError(
            Error.NodePublishVolumeError.newBuilder()
                .setErrorCode(code)
                .setErrorDescription(description))
        .build();
  }

  public static Error nodeUnpublishVolume(NodeUnpublishVolumeErrorCode code, String description) {
    return Error.newBuilder()
        .setNodeUnpublishVolumeError(
            Error.NodeUnpublishVolumeError.newBuilder()
                .setErrorCode(code)
                .setErrorDescription(description))
        .build();
  }

  /** One-line rendering for logs and status descriptions. */
  public static String describe(Error error) {
    return switch (error.getValueCase()) {
      case GENERAL_ERROR -> render(
          error.getGeneralError().getErrorCode(),
          error.getGeneralError().getErrorDescription());
      case CREATE_VOLUME_ERROR -> render(
          error.getCreateVolumeError().getErrorCode(),
          error.getCreateVolumeError().getErrorDescription());
      case DELETE_VOLUME_ERROR -> render(
          error.getDeleteVolumeError().getErrorCode(),
          error.getDeleteVolumeError().getErrorDescription());
      case CONTROLLER_PUBLISH_VOLUME_ERROR -> render(
          error.getControllerPublishVolumeError().getErrorCode(),
          error.getControllerPublishVolumeError().getErrorDescription());
      case CONTROLLER_UNPUBLISH_VOLUME_ERROR -> render(
          error.getControllerUnpublishVolumeError().getErrorCode(),
          error.getControllerUnpublishVolumeError().getErrorDescription());
      case VALIDATE_VOLUME_CAPABILITIES_ERROR -> render(
          error.getValidateVolumeCapabilitiesError().getErrorCode(),
          error.getValidateVolumeCapabilitiesError().getErrorDescription());
      case NODE_PUBLISH_VOLUME_ERROR -> render(
          error.getNodePublishVolumeError().getErrorCode(),
          error.getNodePublishVolumeError().getErrorDescription());
      case NODE_UNPUBLISH_VOLUME_ERROR -> render(
          error.getNodeUnpublishVolumeError().getErrorCode(),
          error.getNodeUnpublishVolumeError().getErrorDescription());
      case PROBE_NODE_ERROR -> render(
          error.getProbeNodeError().getErrorCode(),
          error.getProbeNodeError().getErrorDescription());
      case GET_NODE_ID_ERROR -> render(
          error.getGetNodeIdError().getErrorCode(),
          error.getGetNodeIdError().getErrorDescription());
      case VALUE_NOT_SET -> "empty error";
    };
  }

  private static String render(Enum<?> code, String description) {
    return description.isEmpty() ? code.name() : code.name() + ": " + description;
  }
}
