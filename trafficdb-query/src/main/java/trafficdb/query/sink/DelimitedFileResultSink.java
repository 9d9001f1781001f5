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

package trafficdb.query.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trafficdb.interfaces.store.StoreUnavailableException;
import trafficdb.query.AggregationResult;
import trafficdb.query.QueryConstants;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

import static trafficdb.query.AggregationResult.ResultRow;

/**
 * Writes each result row as one line, the group key and value joined by a delimiter, value
 * last, each line ended by {@code \n} whatever the platform. The rows go to a temporary file
 * beside the destination, which is then moved over it.
 */
public class DelimitedFileResultSink implements ResultSink {
  private static final Logger LOG = LoggerFactory.getLogger(DelimitedFileResultSink.class);

  private final String delimiter;

  public DelimitedFileResultSink() {
    this(QueryConstants.DEFAULT_RESULT_DELIMITER);
  }

  public DelimitedFileResultSink(String delimiter) {
    if (delimiter == null || delimiter.isEmpty()) {
      throw new IllegalArgumentException("Delimiter must not be empty");
    }
    this.delimiter = delimiter;
  }

  @Override
  public void write(AggregationResult result, String destination) throws IOException {
    final Path destinationPath = Paths.get(destination).toAbsolutePath();
    final Path directory = destinationPath.getParent();
    Path tempFile = null;

    try {
      Files.createDirectories(directory);
      tempFile = Files.createTempFile(directory, destinationPath.getFileName().toString(), ".tmp");

      try (BufferedWriter writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
        for (ResultRow row : result.getRows()) {
          writer.write(formatRow(row));
          writer.write('\n');
        }
      }

      moveIntoPlace(tempFile, destinationPath);
      tempFile = null;
    } catch (IOException e) {
      throw new StoreUnavailableException("Unable to write result to " + destination, e);
    } finally {
      if (tempFile != null) {
        deleteQuietly(tempFile);
      }
    }

    LOG.info("Wrote {} rows to {}", result.getRows().size(), destinationPath);
  }

  String formatRow(ResultRow row) {
    return row.getGroupKey() + delimiter + row.getValue();
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      LOG.warn("Atomic move not supported for {}; replacing it non-atomically", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOG.warn("Unable to remove temporary result file {}", file, e);
    }
  }
}
