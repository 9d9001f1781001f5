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
import trafficdb.interfaces.PartitionKey;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static trafficdb.interfaces.TrafficTestUtil.anEntryAt;
import static trafficdb.interfaces.TrafficTestUtil.anEntryFrom;
import static trafficdb.interfaces.TrafficTestUtil.anEntryWithStatus;
import static trafficdb.interfaces.TrafficTestUtil.anEntryWithUrl;

public class EntryFilterTest {
  @Test
  public void matchesListedStatusCodes() {
    EntryFilter filter = EntryFilter.statusIn(404, 500);

    assertThat(filter.matches(anEntryWithStatus(404)), is(true));
    assertThat(filter.matches(anEntryWithStatus(200)), is(false));
    assertThat(filter.mayMatchPartition(PartitionKey.forStatusCode(500)), is(true));
    assertThat(filter.mayMatchPartition(PartitionKey.forStatusCode(200)), is(false));
    assertThat(filter.mayMatchPartition(PartitionKey.DEFAULT), is(false));
  }

  @Test
  public void matchesAnInclusiveStatusRange() {
    EntryFilter filter = EntryFilter.statusBetween(400, 499);

    assertThat(filter.matches(anEntryWithStatus(400)), is(true));
    assertThat(filter.matches(anEntryWithStatus(499)), is(true));
    assertThat(filter.matches(anEntryWithStatus(500)), is(false));
    assertThat(filter.mayMatchPartition(PartitionKey.forStatusCode(451)), is(true));
    assertThat(filter.mayMatchPartition(PartitionKey.DEFAULT), is(false));
  }

  @Test
  public void mayMatchTheDefaultPartitionWhenCodesOutsideTheValidRangeAreWanted() {
    assertThat(EntryFilter.statusIn(404, 999).mayMatchPartition(PartitionKey.DEFAULT), is(true));
    assertThat(EntryFilter.statusBetween(0, 200).mayMatchPartition(PartitionKey.DEFAULT), is(true));
  }

  @Test
  public void matchesTimestampsInAHalfOpenRange() {
    EntryFilter filter = EntryFilter.timestampBetween("2025-02-25 13:00", "2025-02-25 14:00");

    assertThat(filter.matches(anEntryAt("2025-02-25 13:00:00")), is(true));
    assertThat(filter.matches(anEntryAt("2025-02-25 13:59:59")), is(true));
    assertThat(filter.matches(anEntryAt("2025-02-25 14:00")), is(false));
    assertThat(filter.matches(anEntryAt("2025-02-25 12:59:59")), is(false));
  }

  @Test
  public void combinesFiltersSoThatEveryPartMustMatch() {
    EntryFilter filter = EntryFilter.and(EntryFilter.statusIn(404), EntryFilter.urlPrefix("/admin"));

    assertThat(filter.matches(anEntryWithUrl("/admin/login", 404)), is(true));
    assertThat(filter.matches(anEntryWithUrl("/admin/login", 200)), is(false));
    assertThat(filter.matches(anEntryWithUrl("/index", 404)), is(false));
    assertThat(filter.mayMatchPartition(PartitionKey.forStatusCode(200)), is(false));
  }

  @Test
  public void matchesAClientAddressExactly() {
    EntryFilter filter = EntryFilter.clientAddress("10.0.0.1");

    assertThat(filter.matches(anEntryFrom("10.0.0.1", 200)), is(true));
    assertThat(filter.matches(anEntryFrom("10.0.0.10", 200)), is(false));
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsAnEmptyStatusList() {
    EntryFilter.statusIn();
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsReversedStatusBounds() {
    EntryFilter.statusBetween(500, 400);
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsReversedTimestampBounds() {
    EntryFilter.timestampBetween("2025-02-26", "2025-02-25");
  }

  @Test(expected = InvalidJobSpecException.class)
  public void rejectsAMissingUrlPrefix() {
    EntryFilter.urlPrefix(null);
  }
}
