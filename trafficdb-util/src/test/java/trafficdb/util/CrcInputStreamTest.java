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

package trafficdb.util;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.Adler32;
import java.util.zip.Checksum;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

public class CrcInputStreamTest {
  private static final byte[] DATA =
      "203.0.113.9,2025-02-25 13:00:15,/index,200,Mozilla/5.0 \000\001\002\003".getBytes(StandardCharsets.UTF_8);

  @Test
  public void calculatesACrcCorrectlyWhenReading() throws Exception {
    final CrcInputStream crcInputStream = crcInputStreamReadingFrom(DATA);
    readEntireInputStream(crcInputStream);

    assertThat(crcInputStream.getValue(), is(equalTo(computeCrcDirectly(DATA))));
  }

  @Test
  public void includesSkippedBytesInTheCrc() throws Exception {
    final CrcInputStream crcInputStream = crcInputStreamReadingFrom(DATA);

    long skipped = crcInputStream.skip(DATA.length);

    assertThat(skipped, is(equalTo((long) DATA.length)));
    assertThat(crcInputStream.getValue(), is(equalTo(computeCrcDirectly(DATA))));
  }

  @Test
  public void doesNotUpdateTheCrcWhenReadingPastTheEndOfTheStream() throws Exception {
    final CrcInputStream crcInputStream = crcInputStreamReadingFrom(DATA);
    readEntireInputStream(crcInputStream);

    assertThat(crcInputStream.read(), is(equalTo(-1)));
    assertThat(crcInputStream.getValue(), is(equalTo(computeCrcDirectly(DATA))));
  }

  private static long computeCrcDirectly(byte[] bytes) {
    Checksum crc = new Adler32();
    crc.update(bytes, 0, bytes.length);
    return crc.getValue();
  }

  private static CrcInputStream crcInputStreamReadingFrom(byte[] bytes) {
    return new CrcInputStream(new ByteArrayInputStream(bytes), new Adler32());
  }

  private static void readEntireInputStream(InputStream inputStream) throws Exception {
    // Read 4 individual bytes, then do byte array reads until the end of the input.
    for (int i = 0; i < 4; i++) {
      //noinspection ResultOfMethodCallIgnored
      inputStream.read();
    }

    final byte[] buffer = new byte[3];
    int bytesRead;
    do {
      bytesRead = inputStream.read(buffer);
    } while (bytesRead > 0);
  }
}
