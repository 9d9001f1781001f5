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

import java.nio.file.Path;
import java.nio.file.Paths;

public class StoreConstants {
  public static final Path PARTITION_ROOT_DIRECTORY_RELATIVE_PATH = Paths.get("partitions");
  public static final String SEGMENT_FILE_SUFFIX = ".seg";
  public static final long FIRST_SEGMENT_ID = 1;
  public static final long DEFAULT_SEGMENT_MAX_BYTES = 64L * 1024 * 1024;
  public static final long DEFAULT_SEGMENT_MAX_RECORDS = 1_000_000;
  public static final int MAX_ENTRY_SIZE_BYTES = 1024 * 1024;
  public static final int STORE_THREAD_POOL_SIZE = 4;
  public static final int STORE_CLOSE_TIMEOUT_SECONDS = 15;
  public static final boolean STORE_USE_FILE_CHANNEL_FORCE = false;
}
