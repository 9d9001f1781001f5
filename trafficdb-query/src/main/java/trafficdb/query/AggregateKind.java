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
 * The aggregate computed for each group.
 */
public enum AggregateKind {
  /**
   * Number of matching entries in the group.
   */
  COUNT,

  /**
   * Number of different values of a second field among the group's matching entries.
   */
  COUNT_DISTINCT,

  /**
   * Number of matching entries in the group, keeping only the k groups with the highest counts.
   */
  TOP_K
}
