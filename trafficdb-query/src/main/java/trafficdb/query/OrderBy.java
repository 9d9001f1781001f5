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
 * Order of the rows of an aggregation result.
 */
public enum OrderBy {
  /**
   * Highest value first; equal values in ascending key order.
   */
  COUNT_DESC,

  /**
   * Ascending key order, comparing keys as strings.
   */
  KEY_ASC,

  /**
   * The order in which groups were first encountered, visiting partitions in key order.
   */
  NONE
}
