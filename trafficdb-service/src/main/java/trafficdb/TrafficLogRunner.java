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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import trafficdb.ingest.IngestReport;
import trafficdb.query.AggregationJob;
import trafficdb.query.AggregationResult;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Command line entry point: ingest one log file into a data directory, run one of the
 * {@link TrafficReports} over everything stored there, and write the result.
 * <p>
 * Settings come from trafficdb.properties on the classpath, overridden by system properties.
 */
public class TrafficLogRunner {
  private static final Logger LOG = LoggerFactory.getLogger(TrafficLogRunner.class);

  static final String PROPERTIES_RESOURCE = "/trafficdb.properties";

  public static void main(String[] args) throws Exception {
    if (args.length != 4) {
      System.err.println("Usage: TrafficLogRunner <dataDir> <inputFile> <report> <destination>");
      System.err.println("Reports: " + TrafficReports.names());
      System.exit(1);
    }

    final Properties properties = loadProperties();
    properties.setProperty(TrafficServiceConfiguration.DATA_DIRECTORY_KEY, args[0]);

    run(TrafficServiceConfiguration.fromProperties(properties), args[1], args[2], args[3]);
  }

  static AggregationResult run(TrafficServiceConfiguration configuration,
                               String inputFile,
                               String reportName,
                               String destination) throws IOException {
    final AggregationJob job = TrafficReports.named(reportName);
    final TrafficLogService service = new TrafficLogService(configuration);
    service.startAsync().awaitRunning();

    try {
      final IngestReport report = service.ingest(Paths.get(inputFile));
      LOG.info("Ingested {}: {}", inputFile, report);

      final AggregationResult result = service.query(job);
      service.writeResult(result, destination);
      LOG.info("Report {} written to {}: {}", reportName, destination, result);
      return result;
    } finally {
      service.stopAsync().awaitTerminated();
    }
  }

  static Properties loadProperties() throws IOException {
    final Properties properties = new Properties();
    try (InputStream in = TrafficLogRunner.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
      if (in != null) {
        properties.load(in);
      }
    }
    for (String key : System.getProperties().stringPropertyNames()) {
      if (key.startsWith("trafficdb.")) {
        properties.setProperty(key, System.getProperty(key));
      }
    }
    return properties;
  }
}
