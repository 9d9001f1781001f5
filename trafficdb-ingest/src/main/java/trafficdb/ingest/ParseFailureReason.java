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

/**
 * Why a raw line could not be turned into a log entry.
 */
public enum ParseFailureReason {
  /**
   * The line is empty or blank, has more fields than expected (when field counts are strict),
   * has a timestamp of the wrong width, holds characters that could not be decoded, or is too
   * long to be stored as one record.
   */
  MALFORMED_DELIMITERS,

  /**
   * The status field is not a base-10 integer from 100 to 599.
   */
  INVALID_STATUS,

  /**
   * The line has fewer than five fields, or one of the required fields is empty.
   */
  MISSING_FIELD
}
