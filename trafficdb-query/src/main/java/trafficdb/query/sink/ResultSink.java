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

package trafficdb.query.sink;

import trafficdb.query.AggregationResult;

import java.io.IOException;

/**
 * Destination for aggregation results.
 */
public interface ResultSink {
  /**
   * Write every row of the result to the destination, replacing whatever was there. A reader
   * of the destination never sees a partly written result.
   *
   * @throws trafficdb.interfaces.store.StoreUnavailableException if the destination cannot be
   *                                                              written.
   */
  void write(AggregationResult result, String destination) throws IOException;
}
