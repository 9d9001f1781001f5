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

import com.google.common.primitives.Ints;
import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import trafficdb.util.CrcInputStream;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.zip.Adler32;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Framing of stored records: a 4-byte length, then that many bytes of protostuff-encoded
 * message, then a 4-byte Adler-32 CRC computed over the length and the message.
 */
public class EntryEncodingUtil {
  public static final int LENGTH_BYTES = 4;
  public static final int CRC_BYTES = 4;

  /**
   * A stored record whose checksum disagrees with its bytes, or whose length prefix is impossible.
   */
  public static class CrcError extends RuntimeException {
    public CrcError(String s) {
      super(s);
    }
  }

  /**
   * Frame one record for appending. The bound is the same one {@link #decodeAndCheckCrc} applies,
   * so a record that could not be read back is never produced.
   *
   * @return length, body and checksum buffers, in write order, each flipped for reading
   * @throws IllegalArgumentException if the encoded message is longer than {@code maxLength}
   */
  public static <T> ByteBuffer[] encodeWithLengthAndCrc(Schema<T> schema, T message, int maxLength) {
    final byte[] messageBytes = ProtostuffIOUtil.toByteArray(message, schema, LinkedBuffer.allocate());
    checkArgument(messageBytes.length <= maxLength,
        "Encoded record of %s bytes exceeds the limit of %s bytes", messageBytes.length, maxLength);
    final ByteBuffer lengthBuf = ByteBuffer.allocate(LENGTH_BYTES).putInt(messageBytes.length);
    lengthBuf.flip();

    final Adler32 checksum = new Adler32();
    checksum.update(lengthBuf.duplicate());
    checksum.update(messageBytes);

    final ByteBuffer crcBuf = ByteBuffer.allocate(CRC_BYTES).putInt(toStoredCrc(checksum.getValue()));
    crcBuf.flip();

    return new ByteBuffer[]{lengthBuf, ByteBuffer.wrap(messageBytes), crcBuf};
  }

  /**
   * Read back one record framed by {@link #encodeWithLengthAndCrc}, starting at its length prefix.
   *
   * @throws java.io.EOFException if the stream ends partway through the record
   * @throws CrcError             if the length exceeds {@code maxLength} or the checksum disagrees
   */
  public static <T> T decodeAndCheckCrc(InputStream inputStream, Schema<T> schema, int maxLength)
      throws IOException, CrcError {
    final CrcInputStream checkedStream = new CrcInputStream(inputStream, new Adler32());
    final DataInputStream dataStream = new DataInputStream(checkedStream);

    final int length = dataStream.readInt();
    if (length < 0 || length > maxLength) {
      throw new CrcError("Record length " + length + " is out of bounds");
    }

    final byte[] messageBytes = new byte[length];
    dataStream.readFully(messageBytes);

    final long expected = checkedStream.getValue();
    final long stored = fromStoredCrc(new DataInputStream(inputStream).readInt());
    if (stored != expected) {
      throw new CrcError("CRC mismatch on record of length " + length);
    }

    final T decoded = schema.newMessage();
    ProtostuffIOUtil.mergeFrom(messageBytes, decoded, schema);
    return decoded;
  }

  public static long sumRemaining(ByteBuffer[] buffers) {
    long total = 0;
    for (ByteBuffer buffer : buffers) {
      total += buffer.remaining();
    }
    return total;
  }

  // Adler-32 values are unsigned 32-bit; offset by Integer.MIN_VALUE to fit a signed int.
  private static int toStoredCrc(long checksum) {
    return Ints.checkedCast(checksum + Integer.MIN_VALUE);
  }

  private static long fromStoredCrc(int stored) {
    return ((long) stored) - Integer.MIN_VALUE;
  }
}
