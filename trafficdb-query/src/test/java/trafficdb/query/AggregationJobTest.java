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

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class AggregationJobTest {
  @Test
  public void defaultsToOneGroupOfAllEntriesInFirstSeenOrder() {
    AggregationJob job = AggregationJob.count().build();

    assertThat(job.getGroupBy(), is(equalTo(GroupKeyExtractor.all())));
    assertThat(job.getOrderBy(), is(equalTo(OrderBy.NONE)));
    assertThat(job.getLimit(), is(nullValue()));
    assertThat(job.getHavingMoreThan(), is(nullValue()));
  }

  @Test
  public void ordersTopKJobsByDescendingCount() {
    assertThat(AggregationJob.topK(3).build().getOrderBy(), is(equalTo(OrderBy.COUNT_DESC)));
  }

  @Test
  public void resolvesGroupKeyExtractorsByName() {
    assertThat(AggregationJob.count().groupBy("url").build().getGroupBy(), is(equalTo(GroupKeyExtractor.url())));
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsTopKWithoutAPositiveK() {
    AggregationJob.topK(0).build();
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsTopKOrderedByKey() {
    AggregationJob.topK(3).orderBy(OrderBy.KEY_ASC).build();
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsCountDistinctWithoutAField() {
    AggregationJob.builder(AggregateKind.COUNT_DISTINCT).build();
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsADistinctFieldOnAPlainCount() {
    AggregationJob.count().distinctOf(GroupKeyExtractor.userAgent()).build();
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsANonPositiveLimit() {
    AggregationJob.count().limit(0).build();
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsANegativeHavingThreshold() {
    AggregationJob.count().havingMoreThan(-1).build();
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsAMissingFilter() {
    AggregationJob.count().where(null).build();
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsAnUnknownGroupKeyExtractor() {
    AggregationJob.count().groupBy("referrer");
  }
}
