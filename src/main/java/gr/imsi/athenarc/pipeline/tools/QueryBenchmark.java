package gr.imsi.athenarc.pipeline.tools;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.pipeline.config.PipelineConfig;
import gr.imsi.athenarc.pipeline.exception.PipelineException;
import gr.imsi.athenarc.pipeline.manager.QueryPipeline;
import gr.imsi.athenarc.pipeline.manager.QueryResponse;
import gr.imsi.athenarc.pipeline.policy.InMemoryPolicyStore;
import gr.imsi.athenarc.pipeline.query.QueryDescriptor;
import gr.imsi.athenarc.pipeline.query.QueryDescriptorReader;
import gr.imsi.athenarc.pipeline.security.RoleBasedPermissionStore;
import gr.imsi.athenarc.pipeline.security.SecurityContext;

/**
 * Runs a JSON query descriptor repeatedly against the configured datasources and
 * records latency and cache behaviour of every run to {@code results.csv}.
 *
 * <pre>
 * QueryBenchmark -descriptor query.json -config pipeline.properties -runs 10 -out results/
 * </pre>
 */
public class QueryBenchmark {

    private static final Logger LOG = LoggerFactory.getLogger(QueryBenchmark.class);

    @Parameter(names = "-descriptor", description = "Path of the JSON query descriptor to run")
    private String descriptorPath;

    @Parameter(names = "-config", description = "Path of the pipeline properties file; the classpath application.properties when absent", required = false)
    private String configPath;

    @Parameter(names = "-runs", description = "Times to run the query", required = false)
    private int runs = 5;

    @Parameter(names = "-out", description = "The output folder")
    private String outFolder;

    @Parameter(names = "-principal", description = "Principal the query runs as", required = false)
    private String principal = "benchmark";

    @Parameter(names = "-roles", variableArity = true, description = "Roles of the principal; each is granted full read access", required = false)
    private List<String> roles = new ArrayList<>(List.of("benchmark"));

    @Parameter(names = "-timeout", description = "Timeout of every run in seconds", required = false)
    private int timeoutSeconds = 60;

    @Parameter(names = "-invalidate", description = "Invalidate the datasource's cache entries before the first run", required = false)
    private boolean invalidate = false;

    @Parameter(names = "--help", help = true, description = "Displays help")
    private boolean help;

    public static void main(String... args) throws IOException {
        QueryBenchmark benchmark = new QueryBenchmark();
        JCommander jCommander = new JCommander(benchmark);
        jCommander.parse(args);
        if (benchmark.help) {
            jCommander.usage();
        } else {
            benchmark.run();
        }
    }

    private void run() throws IOException {
        Preconditions.checkNotNull(descriptorPath, "No query descriptor specified.");
        Preconditions.checkNotNull(outFolder, "No out folder specified.");
        Preconditions.checkArgument(runs > 0, "Runs must be positive.");
        Preconditions.checkArgument(!roles.isEmpty(), "At least one role is required.");

        QueryDescriptor descriptor;
        try (InputStream input = Files.newInputStream(Paths.get(descriptorPath))) {
            descriptor = new QueryDescriptorReader().read(input);
        }
        PipelineConfig config = loadConfig();

        RoleBasedPermissionStore.Builder permissions = RoleBasedPermissionStore.builder();
        roles.forEach(permissions::grantAll);
        SecurityContext context = SecurityContext.of(principal, roles.toArray(new String[0]));

        Path resultsPath = Paths.get(outFolder);
        Files.createDirectories(resultsPath);
        File outFile = resultsPath.resolve("results.csv").toFile();

        try (QueryPipeline pipeline = QueryPipeline.fromConfig(config, permissions.build(), InMemoryPolicyStore.empty());
             FileWriter fileWriter = new FileWriter(outFile, false)) {
            if (invalidate) {
                pipeline.invalidateDatasource(descriptor.getDatasource());
            }
            CsvWriter csvWriter = new CsvWriter(fileWriter, new CsvWriterSettings());
            csvWriter.writeHeaders("run", "datasource", "format", "cache_status", "rows", "bytes", "execution_time", "total_time", "error");
            Stopwatch stopwatch = Stopwatch.createUnstarted();

            for (int run = 0; run < runs; run++) {
                stopwatch.reset().start();
                csvWriter.addValue(run);
                csvWriter.addValue(descriptor.getDatasource().getId());
                csvWriter.addValue(descriptor.getResultFormat());
                try {
                    QueryResponse response = pipeline.runQuery(descriptor, context, Duration.ofSeconds(timeoutSeconds));
                    stopwatch.stop();
                    csvWriter.addValue(response.getCacheStatus());
                    csvWriter.addValue(response.getPayload().getRowCount());
                    csvWriter.addValue(response.getPayload().getSize());
                    csvWriter.addValue(response.getExecutionTime().map(d -> d.toNanos() / Math.pow(10d, 9)).orElse(null));
                    csvWriter.addValue(stopwatch.elapsed(TimeUnit.NANOSECONDS) / Math.pow(10d, 9));
                    csvWriter.addValue("");
                    LOG.info("Run {}: {} rows, cache {}", run, response.getPayload().getRowCount(), response.getCacheStatus());
                } catch (PipelineException e) {
                    stopwatch.stop();
                    csvWriter.addValue("");
                    csvWriter.addValue("");
                    csvWriter.addValue("");
                    csvWriter.addValue("");
                    csvWriter.addValue(stopwatch.elapsed(TimeUnit.NANOSECONDS) / Math.pow(10d, 9));
                    csvWriter.addValue(e.getStage() + ": " + e.getMessage());
                    LOG.error("Run {} failed at {}", run, e.getStage(), e);
                }
                csvWriter.writeValuesToRow();
            }
            csvWriter.flush();
        }
        LOG.info("Wrote {} runs to {}", runs, outFile);
    }

    private PipelineConfig loadConfig() throws IOException {
        if (configPath == null) {
            return PipelineConfig.load();
        }
        Properties properties = new Properties();
        try (InputStream input = Files.newInputStream(Paths.get(configPath))) {
            properties.load(input);
        }
        return PipelineConfig.fromProperties(properties);
    }
}
