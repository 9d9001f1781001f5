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

import com.google.common.base.Splitter;
import io.protostuff.ProtostuffIOUtil;
import trafficdb.interfaces.LogEntry;
import trafficdb.util.CrcInputStream;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.util.Formatter;
import java.util.Locale;
import java.util.zip.Adler32;

import static trafficdb.store.PartitionPersistenceService.BytePersistence;

public class CatPartitionSegment {
  private static final int HEX_ADDRESS_DIGITS = 8;
  private static final int INT_DIGITS = 3;

  /**
   * Output to System.out the contents of a segment file, with one record on each line.
   *
   * @param args Accepts only one argument, the name of the segment file.
   * @throws IOException
   */
  public static void main(String args[]) throws IOException {
    if (args.length != 1) {
      System.err.println("Usage: CatPartitionSegment filename");
      System.exit(-1);
    }

    File inputSegmentFile = new File(args[0]);

    if (!inputSegmentFile.exists() || inputSegmentFile.isDirectory()) {
      System.err.println("File does not exist, or is a directory");
      System.exit(-1);
    }

    describeSegmentFileToOutput(inputSegmentFile, System.out);
  }

  static void describeSegmentFileToOutput(File inputSegmentFile, PrintStream out) throws IOException {
    final int records = openFileAndParseRecords(inputSegmentFile,
        (address, record) -> {
          out.print(toHex(address) + ": ");
          out.println(formatRecord(record));
        });
    out.println(records + " records");
  }

  private static int openFileAndParseRecords(File inputSegmentFile, RecordWithAddress doForEach) throws IOException {
    int records = 0;
    try (BytePersistence persistence = FilePersistence.openReadOnly(inputSegmentFile.toPath());
         ReadableByteChannel reader = persistence.getReader();
         InputStream inputStream = Channels.newInputStream(reader)) {

      long address = 0;
      //noinspection InfiniteLoopStatement
      do {
        RecordDescription record = describeNextRecord(inputStream);
        doForEach.accept(address, record);
        address += record.totalLength();
        records++;
      } while (true);
    } catch (EOFException endOfSegment) {
      return records;
    }
  }

  /**
   * Read one framed record without stopping on a bad CRC, so that the records after a
   * damaged one can still be shown.
   */
  private static RecordDescription describeNextRecord(InputStream inputStream) throws IOException {
    final CrcInputStream crcStream = new CrcInputStream(inputStream, new Adler32());
    final DataInputStream dataStream = new DataInputStream(crcStream);

    final int length = dataStream.readInt();
    if (length < 0 || length > StoreConstants.MAX_ENTRY_SIZE_BYTES) {
      throw new IOException("Record length " + length + " is out of bounds; cannot continue");
    }
    final byte[] messageBytes = new byte[length];
    dataStream.readFully(messageBytes);

    final long computedCrc = crcStream.getValue();
    final long diskCrc = ((long) new DataInputStream(inputStream).readInt()) - Integer.MIN_VALUE;

    LogEntry entry = null;
    try {
      final StoredLogEntry stored = StoredLogEntry.SCHEMA.newMessage();
      ProtostuffIOUtil.mergeFrom(messageBytes, stored, StoredLogEntry.SCHEMA);
      entry = stored.toLogEntry();
    } catch (RuntimeException e) {
      System.err.println("Unable to decode record contents: " + e);
    }

    return new RecordDescription(length, entry, computedCrc == diskCrc);
  }

  private interface RecordWithAddress {
    void accept(long address, RecordDescription record);
  }

  private static class RecordDescription {
    final int contentLength;
    final LogEntry entry;
    final boolean crcValid;

    RecordDescription(int contentLength, LogEntry entry, boolean crcValid) {
      this.contentLength = contentLength;
      this.entry = entry;
      this.crcValid = crcValid;
    }

    long totalLength() {
      return EntryEncodingUtil.LENGTH_BYTES + contentLength + EntryEncodingUtil.CRC_BYTES;
    }
  }

  private static String toHex(long address) {
    return String.join(" ",
        Splitter
            .fixedLength(4)
            .split(String.format("%0" + HEX_ADDRESS_DIGITS + "x", address)));
  }

  private static String formatRecord(RecordDescription record) {
    StringBuilder sb = new StringBuilder();
    Formatter formatter = new Formatter(sb, Locale.US);

    formatter.format("[length: %5d]", record.contentLength);

    if (record.entry == null) {
      formatter.format(" <undecodable contents>");
    } else {
      LogEntry entry = record.entry;
      formatter.format(" [status: %" + INT_DIGITS + "d]", entry.getStatusCode());
      formatter.format(" [client: %s]", entry.getClientAddress());
      formatter.format(" [time: %s]", entry.getTimestamp());
      formatter.format(" [url: %s]", entry.getUrl());
      formatter.format(" [agent: %s]", entry.getUserAgent());
    }

    if (!record.crcValid) {
      formatter.format(" <invalid CRC>");
    }

    return formatter.toString();
  }
}
