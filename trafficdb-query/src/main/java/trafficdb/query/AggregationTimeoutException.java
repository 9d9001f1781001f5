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

import java.util.concurrent.TimeUnit;

/**
 * An aggregation did not complete within its time limit. Its partition scans have been
 * cancelled and no result was produced.
 */
public class AggregationTimeoutException extends Exception {
  public AggregationTimeoutException(AggregationJob job, long timeout, TimeUnit unit) {
    super("Aggregation " + job + " did not complete within " + timeout + " " + unit.toString().toLowerCase());
  }
}
