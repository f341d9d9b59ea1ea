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

import ai.floedb.csimux.csi.rpc.VolumeID;
import ai.floedb.csimux.csi.rpc.VolumeInfo;
import ai.floedb.csimux.csi.rpc.VolumeMetadata;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Volumes of one mock provider, kept in creation order. Volumes are matched by their {@code id}
 * or {@code name} identifier value, ignoring case.
 */
final class VolumeCatalog {
  static final long GIB = 1L << 30;
  static final long DEFAULT_CAPACITY = 100 * GIB;
  static final int SEEDED = 3;

  enum Detach {
    DETACHED,
    NO_VOLUME,
    NOT_ATTACHED
  }

  record Page(List<VolumeInfo> entries, String nextToken) {}

  private final ReentrantLock lock = new ReentrantLock();
  private final List<Volume> volumes = new ArrayList<>();
  private long lastId;

  VolumeCatalog() {
    for (int i = 1; i <= SEEDED; i++) {
      volumes.add(newVolume("Mock Volume " + i, DEFAULT_CAPACITY));
    }
  }

  /** Returns the volume named {@code name}, creating it with {@code capacity} bytes if absent. */
  VolumeInfo getOrCreate(String name, long capacity) {
    lock.lock();
    try {
      Volume volume = find("name", name);
      if (volume == null) {
        volume = newVolume(name, capacity);
        volumes.add(volume);
      }
      return volume.toInfo();
    } finally {
      lock.unlock();
    }
  }

  Optional<VolumeInfo> get(String id) {
    lock.lock();
    try {
      Volume volume = find("id", id);
      return volume == null ? Optional.empty() : Optional.of(volume.toInfo());
    } finally {
      lock.unlock();
    }
  }

  boolean delete(String id) {
    lock.lock();
    try {
      Volume volume = find("id", id);
      return volume != null && volumes.remove(volume);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Attaches volume {@code id} to {@code nodeId} and returns its device path. A volume already
   * attached to the node keeps its path.
   */
  Optional<String> attach(String id, String nodeId, Supplier<String> newDevicePath) {
    lock.lock();
    try {
      Volume volume = find("id", id);
      if (volume == null) {
        return Optional.empty();
      }
      return Optional.of(
          volume.metadata.computeIfAbsent(devicePathKey(nodeId), k -> newDevicePath.get()));
    } finally {
      lock.unlock();
    }
  }

  Detach detach(String id, String nodeId) {
    lock.lock();
    try {
      Volume volume = find("id", id);
      if (volume == null) {
        return Detach.NO_VOLUME;
      }
      return volume.metadata.remove(devicePathKey(nodeId)) != null
          ? Detach.DETACHED
          : Detach.NOT_ATTACHED;
    } finally {
      lock.unlock();
    }
  }

  /** Sets, or with a {@code null} value removes, a metadata entry. False if no such volume. */
  boolean setMetadata(String id, String key, String value) {
    lock.lock();
    try {
      Volume volume = find("id", id);
      if (volume == null) {
        return false;
      }
      if (value == null) {
        volume.metadata.remove(key);
      } else {
        volume.metadata.put(key, value);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Lists at most {@code maxEntries} volumes (all when zero) from position {@code start}. The next
   * token is empty on the last page.
   *
   * @throws IllegalArgumentException if {@code start} is past the end of the catalog
   */
  Page list(long start, long maxEntries) {
    lock.lock();
    try {
      int size = volumes.size();
      if (start > size) {
        throw new IllegalArgumentException("startingToken=" + start + " > len(vols)=" + size);
      }
      int from = (int) start;
      int to = maxEntries > 0 ? (int) Math.min(size, from + maxEntries) : size;
      List<VolumeInfo> entries = new ArrayList<>(to - from);
      for (Volume volume : volumes.subList(from, to)) {
        entries.add(volume.toInfo());
      }
      return new Page(entries, to < size ? Integer.toString(to) : "");
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return volumes.size();
    } finally {
      lock.unlock();
    }
  }

  static String devicePathKey(String nodeId) {
    return "devpath." + nodeId;
  }

  private Volume newVolume(String name, long capacity) {
    return new Volume(Long.toString(++lastId), name, capacity);
  }

  private Volume find(String field, String value) {
    for (Volume volume : volumes) {
      String candidate = field.equals("id") ? volume.id : volume.name;
      if (candidate.equalsIgnoreCase(value)) {
        return volume;
      }
    }
    return null;
  }

  private static final class Volume {
    final String id;
    final String name;
    final long capacity;
    final Map<String, String> metadata = new LinkedHashMap<>();

    Volume(String id, String name, long capacity) {
      this.id = id;
      this.name = name;
      this.capacity = capacity;
    }

    VolumeInfo toInfo() {
      return VolumeInfo.newBuilder()
          .setCapacityBytes(capacity)
          .setId(VolumeID.newBuilder().putValues("id", id).putValues("name", name))
          .setMetadata(VolumeMetadata.newBuilder().putAllValues(metadata))
          .build();
    }
  }
}
