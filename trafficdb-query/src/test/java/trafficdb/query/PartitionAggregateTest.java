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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import trafficdb.interfaces.PartitionKey;

import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static trafficdb.interfaces.TrafficTestUtil.anEntryWithUrl;

public class PartitionAggregateTest {
  private static final PartitionKey NOT_FOUND = PartitionKey.forStatusCode(404);

  @Test
  public void countsMatchingEntriesPerGroupInFirstSeenOrder() {
    AggregationJob job = AggregationJob.count()
        .groupBy(GroupKeyExtractor.url())
        .where(EntryFilter.urlPrefix("/api"))
        .build();
    PartitionAggregate aggregate = new PartitionAggregate(NOT_FOUND, job);

    aggregate.accumulate(anEntryWithUrl("/api/users", 404));
    aggregate.accumulate(anEntryWithUrl("/index", 404));
    aggregate.accumulate(anEntryWithUrl("/api/orders", 404));
    aggregate.accumulate(anEntryWithUrl("/api/users", 404));

    assertThat(aggregate.getCounts().keySet(), contains("/api/users", "/api/orders"));
    assertThat(aggregate.getCounts(), is(equalTo(ImmutableMap.of("/api/users", 2L, "/api/orders", 1L))));
    assertThat(aggregate.getRowsScanned(), is(equalTo(4L)));
    assertThat(aggregate.getRowsMatched(), is(equalTo(3L)));
  }

  @Test
  public void collectsDistinctValuesForCountDistinctJobs() {
    AggregationJob job = AggregationJob.countDistinct(GroupKeyExtractor.url())
        .groupBy(GroupKeyExtractor.statusCode())
        .build();
    PartitionAggregate aggregate = new PartitionAggregate(NOT_FOUND, job);

    aggregate.accumulate(anEntryWithUrl("/a", 404));
    aggregate.accumulate(anEntryWithUrl("/b", 404));
    aggregate.accumulate(anEntryWithUrl("/a", 404));

    assertThat(aggregate.getDistinctValues(), is(equalTo(ImmutableMap.<String, Set<String>>of("404", ImmutableSet.of("/a", "/b")))));
    assertThat(aggregate.getCounts().isEmpty(), is(true));
  }

  @Test
  public void describesItselfByPartitionAndTallies() {
    PartitionAggregate aggregate = new PartitionAggregate(NOT_FOUND, AggregationJob.count().build());
    aggregate.accumulate(anEntryWithUrl("/a", 404));

    assertThat(aggregate.toString(),
        is(equalTo("PartitionAggregate{partitionKey=404, groups=1, rowsScanned=1, rowsMatched=1}")));
  }
}
