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

package trafficdb.query;

/**
 * An aggregation job was described in a way that cannot be executed. Thrown before any
 * partition is scanned.
 */
public class InvalidJobSpecException extends IllegalArgumentException {
  public InvalidJobSpecException(String message) {
    super(message);
  }

  public InvalidJobSpecException(String message, Throwable cause) {
    super(message, cause);
  }
}
