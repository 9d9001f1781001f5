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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import trafficdb.interfaces.LogEntry;
import trafficdb.interfaces.PartitionKey;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static trafficdb.interfaces.TrafficTestUtil.anEntryFrom;
import static trafficdb.interfaces.TrafficTestUtil.anEntryWithUrl;
import static trafficdb.query.AggregationResult.ResultRow;

public class ResultMergerTest {
  private static final AggregationJob COUNT_BY_URL = AggregationJob.count().groupBy(GroupKeyExtractor.url()).build();

  @Test
  public void breaksCountTiesByAscendingKey() {
    AggregationJob job = AggregationJob.count()
        .groupBy(GroupKeyExtractor.url())
        .orderBy(OrderBy.COUNT_DESC)
        .build();

    AggregationResult result = ResultMerger.merge(job, ImmutableList.of(
        aggregate(job, 200, anEntryWithUrl("/c", 200), anEntryWithUrl("/b", 200), anEntryWithUrl("/a", 200)),
        aggregate(job, 404, anEntryWithUrl("/c", 404), anEntryWithUrl("/a", 404))), 0);

    assertThat(result.getRows(), contains(
        new ResultRow("/a", 2),
        new ResultRow("/c", 2),
        new ResultRow("/b", 1)));
  }

  @Test
  public void appliesTheHavingThresholdToMergedCounts() {
    AggregationJob job = AggregationJob.count()
        .groupBy(GroupKeyExtractor.clientAddress())
        .havingMoreThan(2)
        .build();

    AggregationResult result = ResultMerger.merge(job, ImmutableList.of(
        aggregate(job, 404, anEntryFrom("10.0.0.1", 404), anEntryFrom("10.0.0.1", 404)),
        aggregate(job, 500, anEntryFrom("10.0.0.1", 500), anEntryFrom("10.0.0.2", 500))), 0);

    assertThat(result.getRows(), contains(new ResultRow("10.0.0.1", 3)));
  }

  @Test
  public void keepsFewerThanKRowsWhenThereAreFewerGroups() {
    AggregationJob job = AggregationJob.topK(5).groupBy(GroupKeyExtractor.url()).build();

    AggregationResult result = ResultMerger.merge(job, ImmutableList.of(
        aggregate(job, 200, anEntryWithUrl("/a", 200), anEntryWithUrl("/b", 200), anEntryWithUrl("/b", 200))), 0);

    assertThat(result.getRows(), contains(
        new ResultRow("/b", 2),
        new ResultRow("/a", 1)));
  }

  @Test
  public void producesTheSameRowsWhicheverOrderPartialsArrive() {
    AggregationJob job = AggregationJob.count()
        .groupBy(GroupKeyExtractor.url())
        .orderBy(OrderBy.KEY_ASC)
        .build();
    PartitionAggregate first = aggregate(job, 200, anEntryWithUrl("/a", 200), anEntryWithUrl("/b", 200));
    PartitionAggregate second = aggregate(job, 404, anEntryWithUrl("/b", 404), anEntryWithUrl("/c", 404));

    assertThat(ResultMerger.merge(job, ImmutableList.of(first, second), 0).getRows(),
        is(equalTo(ResultMerger.merge(job, ImmutableList.of(second, first), 0).getRows())));
  }

  @Test
  public void sumsScannedAndMatchedRowsOfAllPartials() {
    AggregationJob job = AggregationJob.count().where(EntryFilter.urlPrefix("/a")).build();

    AggregationResult result = ResultMerger.merge(job, ImmutableList.of(
        aggregate(job, 200, anEntryWithUrl("/a", 200), anEntryWithUrl("/b", 200)),
        aggregate(job, 404, anEntryWithUrl("/a", 404))), 3);

    assertThat(result.getRowsScanned(), is(equalTo(3L)));
    assertThat(result.getRowsMatched(), is(equalTo(2L)));
    assertThat(result.getRowsSkipped(), is(equalTo(3L)));
    assertThat(result.getPartitionsScanned(), is(equalTo(2)));
  }

  @Test
  public void mergesNoPartialsIntoAnEmptyResult() {
    AggregationResult result = ResultMerger.merge(COUNT_BY_URL, ImmutableList.of(), 0);

    assertThat(result.getRows(), is(empty()));
    assertThat(result.getRowsScanned(), is(equalTo(0L)));
  }

  private static PartitionAggregate aggregate(AggregationJob job, int statusCode, LogEntry... entries) {
    final PartitionAggregate aggregate = new PartitionAggregate(PartitionKey.forStatusCode(statusCode), job);
    final List<LogEntry> entryList = ImmutableList.copyOf(entries);
    entryList.forEach(aggregate::accumulate);
    return aggregate;
  }
}
