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

package trafficdb.ingest;

public class IngestConstants {
  public static final String DEFAULT_DELIMITER = ",";
  public static final int FIELD_COUNT = 5;
  public static final int DEFAULT_TIMESTAMP_WIDTH = "yyyy-MM-dd HH:mm:ss".length();
  public static final int DEFAULT_BATCH_SIZE = 1000;
  public static final int DEFAULT_MAX_IN_FLIGHT_BATCHES = 16;
  public static final int DEFAULT_MAX_RETAINED_FAILURES = 100;

  // Leaves room for field framing under the store's 1 MiB record limit.
  public static final int MAX_LINE_BYTES = 1024 * 1024 - 1024;

  // What a decoder substitutes for bytes that are not valid in the input charset.
  public static final char UNDECODABLE_CHARACTER = '\uFFFD';
}
