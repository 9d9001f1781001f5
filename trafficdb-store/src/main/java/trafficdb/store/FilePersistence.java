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

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.ReadableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE_NEW;
import static java.nio.file.StandardOpenOption.READ;
import static trafficdb.store.PartitionPersistenceService.BytePersistence;

/**
 * A segment stored in a single file. Instances made by {@link #createNew} hold an append
 * channel open until closed; instances made by {@link #openReadOnly} hold no open channel.
 */
public class FilePersistence implements BytePersistence {
  @Nullable
  private final FileChannel appendChannel;
  final Path path;
  private long filePosition;

  private FilePersistence(Path path, @Nullable FileChannel appendChannel, long filePosition) {
    this.path = path;
    this.appendChannel = appendChannel;
    this.filePosition = filePosition;
  }

  public static FilePersistence createNew(Path path) throws IOException {
    return new FilePersistence(path, FileChannel.open(path, CREATE_NEW, APPEND), 0);
  }

  public static FilePersistence openReadOnly(Path path) throws IOException {
    return new FilePersistence(path, null, Files.size(path));
  }

  @Override
  public boolean isEmpty() throws IOException {
    return filePosition == 0;
  }

  @Override
  public long size() throws IOException {
    return filePosition;
  }

  @Override
  public void append(ByteBuffer[] buffers) throws IOException {
    final FileChannel channel = ensureWritable();
    final long bytesToWrite = EntryEncodingUtil.sumRemaining(buffers);

    long written = 0;
    while (written < bytesToWrite) {
      written += channel.write(buffers);
    }
    filePosition += written;
  }

  @Override
  public ReadableByteChannel getReader() throws IOException {
    return FileChannel.open(path, READ);
  }

  @Override
  public void sync() throws IOException {
    ensureWritable().force(true);
  }

  @Override
  public void close() throws IOException {
    if (appendChannel != null) {
      appendChannel.close();
    }
  }

  @Override
  public String toString() {
    return path.toString();
  }

  private FileChannel ensureWritable() throws IOException {
    if (appendChannel == null) {
      throw new IOException("Segment " + path + " is open for reading only");
    }
    return appendChannel;
  }
}
