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

import com.google.common.collect.ImmutableList;
import org.junit.After;
import org.junit.Test;
import trafficdb.CommonTestUtil;
import trafficdb.interfaces.store.StoreUnavailableException;
import trafficdb.query.AggregationResult;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static trafficdb.query.AggregationResult.ResultRow;

public class DelimitedFileResultSinkTest {
  private final CommonTestUtil testUtil = new CommonTestUtil();

  @After
  public void cleanup() {
    testUtil.cleanupTestDir();
  }

  @Test
  public void writesOneLinePerRowWithTheValueLast() throws Exception {
    Path destination = testUtil.getDataTestDir("results").resolve("top-pages.csv");

    new DelimitedFileResultSink().write(resultOf(
        new ResultRow("/index", 1800),
        new ResultRow("/contact", 950)), destination.toString());

    assertThat(Files.readAllLines(destination, StandardCharsets.UTF_8), contains(
        "/index,1800",
        "/contact,950"));
  }

  @Test
  public void endsEveryLineWithANewlineWhateverThePlatform() throws Exception {
    Path destination = testUtil.getDataTestDir().resolve("status-codes.csv");

    new DelimitedFileResultSink().write(resultOf(
        new ResultRow("200", 9),
        new ResultRow("404", 2)), destination.toString());

    assertThat(new String(Files.readAllBytes(destination), StandardCharsets.UTF_8), is(equalTo("200,9\n404,2\n")));
  }

  @Test
  public void keepsDelimitersInsideTheKeyAndUsesTheConfiguredDelimiter() throws Exception {
    Path destination = testUtil.getDataTestDir().resolve("agents.tsv");

    new DelimitedFileResultSink("\t").write(resultOf(
        new ResultRow("Mozilla/5.0 (X11; Linux)\tbeta", 3)), destination.toString());

    assertThat(Files.readAllLines(destination, StandardCharsets.UTF_8), contains(
        "Mozilla/5.0 (X11; Linux)\tbeta\t3"));
  }

  @Test
  public void replacesAnEarlierResultAndLeavesNoTemporaryFiles() throws Exception {
    Path directory = testUtil.getDataTestDir("replace");
    Path destination = directory.resolve("result.csv");
    DelimitedFileResultSink sink = new DelimitedFileResultSink();

    sink.write(resultOf(new ResultRow("a", 1), new ResultRow("b", 2)), destination.toString());
    sink.write(resultOf(new ResultRow("c", 3)), destination.toString());

    assertThat(Files.readAllLines(destination, StandardCharsets.UTF_8), contains("c,3"));
    try (Stream<Path> files = Files.list(directory)) {
      assertThat(files.map(p -> p.getFileName().toString()).toArray(), is(new Object[]{"result.csv"}));
    }
  }

  @Test
  public void writesAnEmptyFileForAResultWithNoRows() throws Exception {
    Path destination = testUtil.getDataTestDir().resolve("empty.csv");

    new DelimitedFileResultSink().write(resultOf(), destination.toString());

    assertThat(Files.readAllLines(destination, StandardCharsets.UTF_8), is(empty()));
  }

  @Test(expected = StoreUnavailableException.class)
  public void reportsAnUnwritableDestination() throws Exception {
    Path blocker = testUtil.getDataTestDir().resolve("not-a-directory");
    Files.createDirectories(blocker.getParent());
    Files.write(blocker, new byte[]{1});

    new DelimitedFileResultSink().write(resultOf(new ResultRow("a", 1)), blocker.resolve("result.csv").toString());
  }

  private static AggregationResult resultOf(ResultRow... rows) {
    final List<ResultRow> rowList = ImmutableList.copyOf(rows);
    return new AggregationResult(rowList, true, 0, 0, 0, 0, 0);
  }
}
