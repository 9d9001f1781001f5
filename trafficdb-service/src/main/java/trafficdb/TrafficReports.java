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

package trafficdb;

import com.google.common.collect.ImmutableSortedSet;
import trafficdb.query.AggregationJob;
import trafficdb.query.EntryFilter;
import trafficdb.query.GroupKeyExtractor;
import trafficdb.query.InvalidJobSpecException;
import trafficdb.query.OrderBy;

import java.util.Set;

/**
 * The standard traffic analytics, as aggregation jobs.
 */
public class TrafficReports {
  public static final String STATUS_CODES = "status-codes";
  public static final String TOP_PAGES = "top-pages";
  public static final String USER_AGENTS = "user-agents";
  public static final String REQUESTS_PER_MINUTE = "requests-per-minute";
  public static final String REPEAT_FAILURES = "repeat-failures";

  public static final int DEFAULT_TOP_PAGES = 10;
  public static final long DEFAULT_REPEAT_FAILURE_THRESHOLD = 3;
  public static final int MINUTE_PREFIX_LENGTH = "yyyy-MM-dd HH:mm".length();

  private TrafficReports() {
  }

  /**
   * Requests per status code, in status code order.
   */
  public static AggregationJob statusCodeDistribution() {
    return AggregationJob.count()
        .groupBy(GroupKeyExtractor.statusCode())
        .orderBy(OrderBy.KEY_ASC)
        .build();
  }

  public static AggregationJob topPages(int k) {
    return AggregationJob.topK(k)
        .groupBy(GroupKeyExtractor.url())
        .build();
  }

  /**
   * Requests per user agent, most frequent first.
   */
  public static AggregationJob userAgentFrequency() {
    return AggregationJob.count()
        .groupBy(GroupKeyExtractor.userAgent())
        .orderBy(OrderBy.COUNT_DESC)
        .build();
  }

  /**
   * Requests per time bucket, where a bucket is the first prefixLength characters of the
   * timestamp, in bucket order.
   */
  public static AggregationJob requestVolume(int prefixLength) {
    return AggregationJob.count()
        .groupBy(GroupKeyExtractor.timeBucket(prefixLength))
        .orderBy(OrderBy.KEY_ASC)
        .build();
  }

  /**
   * Clients with more than the threshold number of 404 and 500 responses between them.
   */
  public static AggregationJob repeatFailureClients(long moreThan) {
    return AggregationJob.count()
        .groupBy(GroupKeyExtractor.clientAddress())
        .where(EntryFilter.statusIn(404, 500))
        .havingMoreThan(moreThan)
        .orderBy(OrderBy.COUNT_DESC)
        .build();
  }

  public static Set<String> names() {
    return ImmutableSortedSet.of(STATUS_CODES, TOP_PAGES, USER_AGENTS, REQUESTS_PER_MINUTE, REPEAT_FAILURES);
  }

  /**
   * Look up a report by name, with its default parameters.
   *
   * @throws InvalidJobSpecException if there is no report with that name.
   */
  public static AggregationJob named(String name) {
    switch (name) {
      case STATUS_CODES:
        return statusCodeDistribution();
      case TOP_PAGES:
        return topPages(DEFAULT_TOP_PAGES);
      case USER_AGENTS:
        return userAgentFrequency();
      case REQUESTS_PER_MINUTE:
        return requestVolume(MINUTE_PREFIX_LENGTH);
      case REPEAT_FAILURES:
        return repeatFailureClients(DEFAULT_REPEAT_FAILURE_THRESHOLD);
      default:
        throw new InvalidJobSpecException("Unknown report " + name + "; expected one of " + names());
    }
  }
}
