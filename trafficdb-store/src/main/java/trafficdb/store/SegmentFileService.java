/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package trafficdb.store;

import com.google.common.collect.ImmutableSortedSet;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trafficdb.interfaces.PartitionKey;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps each partition's segments as files in a directory named after the partition:
 * {@code <base>/partitions/<partition id>/<segment id>.seg}, with the segment id zero-padded
 * so that directory listings sort in segment order.
 */
public class SegmentFileService implements PartitionPersistenceService<FilePersistence> {
  private static final Logger LOG = LoggerFactory.getLogger(SegmentFileService.class);
  private static final int SEGMENT_ID_DIGITS = 10;

  private final Path partitionRootDir;

  public SegmentFileService(Path basePath) throws IOException {
    this.partitionRootDir = basePath.resolve(StoreConstants.PARTITION_ROOT_DIRECTORY_RELATIVE_PATH);

    createDirectoryStructure();
  }

  @Override
  public Set<PartitionKey> getStoredPartitions() throws IOException {
    ImmutableSortedSet.Builder<PartitionKey> partitions = ImmutableSortedSet.naturalOrder();

    for (File file : allFilesInDirectory(partitionRootDir)) {
      if (!file.isDirectory()) {
        continue;
      }

      final PartitionKey key;
      try {
        key = PartitionKey.fromId(file.getName());
      } catch (IllegalArgumentException e) {
        LOG.warn("Ignoring directory {}, which does not name a partition", file);
        continue;
      }

      if (!getSegmentIds(key).isEmpty()) {
        partitions.add(key);
      }
    }

    return partitions.build();
  }

  @Override
  public NavigableSet<Long> getSegmentIds(PartitionKey key) throws IOException {
    NavigableSet<Long> segmentIds = new TreeSet<>();

    for (File file : allFilesInDirectory(partitionDir(key))) {
      if (isSegmentFileName(file.getName())) {
        segmentIds.add(segmentIdOfFile(file));
      }
    }

    return segmentIds;
  }

  @NotNull
  @Override
  public FilePersistence create(PartitionKey key, long segmentId) throws IOException {
    createPartitionDirectoryIfNeeded(key);
    return FilePersistence.createNew(pathForSegmentId(key, segmentId));
  }

  @NotNull
  @Override
  public FilePersistence open(PartitionKey key, long segmentId) throws IOException {
    final Path path = pathForSegmentId(key, segmentId);
    if (!Files.isRegularFile(path)) {
      throw new NoSuchFileException(path.toString());
    }
    return FilePersistence.openReadOnly(path);
  }

  Path pathForSegmentId(PartitionKey key, long segmentId) {
    return partitionDir(key).resolve(segmentFileName(segmentId));
  }

  static String segmentFileName(long segmentId) {
    return String.format("%0" + SEGMENT_ID_DIGITS + "d%s", segmentId, StoreConstants.SEGMENT_FILE_SUFFIX);
  }

  private static boolean isSegmentFileName(String fileName) {
    if (!fileName.endsWith(StoreConstants.SEGMENT_FILE_SUFFIX)) {
      return false;
    }
    final String idPart = idPartOf(fileName);
    return !idPart.isEmpty() && idPart.chars().allMatch(Character::isDigit);
  }

  private static long segmentIdOfFile(File file) {
    return Long.parseLong(idPartOf(file.getName()));
  }

  private static String idPartOf(String fileName) {
    return fileName.substring(0, fileName.length() - StoreConstants.SEGMENT_FILE_SUFFIX.length());
  }

  private Path partitionDir(PartitionKey key) {
    return partitionRootDir.resolve(key.id());
  }

  private void createDirectoryStructure() throws IOException {
    Files.createDirectories(partitionRootDir);
  }

  private void createPartitionDirectoryIfNeeded(PartitionKey key) throws IOException {
    Files.createDirectories(partitionDir(key));
  }

  private static File[] allFilesInDirectory(Path dirPath) {
    File[] files = dirPath.toFile().listFiles();
    if (files == null) {
      return new File[]{};
    } else {
      return files;
    }
  }
}
