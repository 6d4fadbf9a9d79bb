package com.pulsewire.runner;

import com.pulsewire.collectors.CollectorCatalog;
import com.pulsewire.core.availability.Availability;
import com.pulsewire.core.cache.FileResponseCache;
import com.pulsewire.core.cache.ResponseCache;
import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.config.CacheSettings;
import com.pulsewire.core.config.ConfigException;
import com.pulsewire.core.config.ConfigLoader;
import com.pulsewire.core.config.Credentials;
import com.pulsewire.core.config.PulseConfig;
import com.pulsewire.core.coordinator.CollectorSelection;
import com.pulsewire.core.model.ScoredItem;
import com.pulsewire.core.pipeline.DateWindow;
import com.pulsewire.core.report.ReportSink;
import com.pulsewire.core.run.PulseRun;
import com.pulsewire.core.run.RunFailedException;
import com.pulsewire.core.run.RunOutcome;
import com.pulsewire.core.run.RunRequest;
import com.pulsewire.core.trace.DeliveryTrace;
import com.pulsewire.core.trace.TraceDocument;
import com.pulsewire.core.trace.TraceFormatter;
import com.pulsewire.core.trace.TraceWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * PulseWire command-line runner: loads configuration and credentials, runs the collectors
 * and prints the ranked items.
 *
 * Exit codes: 0 success, 1 configuration or run failure, 2 bad arguments, 3 delivery failure.
 */
public class PulseRunnerApp {
    private static final Logger LOG = LoggerFactory.getLogger(PulseRunnerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_DELIVERY = 3;

    private static final int PREVIEW_ITEMS = 20;

    private final CollectorCatalog catalog;
    private final Map<String, String> environment;
    private final Clock clock;
    private final PrintStream out;

    PulseRunnerApp(CollectorCatalog catalog, Map<String, String> environment, Clock clock, PrintStream out) {
        this.catalog = catalog;
        this.environment = environment;
        this.clock = clock;
        this.out = out;
    }

    public static void main(String[] args) {
        PulseRunnerApp app = new PulseRunnerApp(CollectorCatalog.defaults(), System.getenv(), Clock.systemUTC(), System.out);
        System.exit(app.run(args));
    }

    int run(String[] args) {
        RunArguments arguments;
        try {
            arguments = RunArguments.parse(args);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println(RunArguments.USAGE);
            return EXIT_USAGE;
        }
        if (arguments.help()) {
            out.println(RunArguments.USAGE);
            return EXIT_OK;
        }

        try {
            PulseConfig config = loadConfig(arguments.config());
            List<Collector> collectors = catalog.build(config);
            Credentials credentials = Credentials.load(Credentials.defaultEnvFile(), environment,
                CollectorCatalog.credentialKeys(collectors)).withoutSwitchedOff(CollectorCatalog.switchKeys());
            LOG.debug("Credentials: {}", credentials);

            PulseRun pulseRun = new PulseRun(config, collectors, credentials, openCache(config.cache()), clock);
            if (arguments.dryRun()) {
                printAvailability(pulseRun.preflight());
                return EXIT_OK;
            }
            return execute(pulseRun, config, arguments);
        } catch (ConfigException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            out.println("Configuration error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (RunFailedException e) {
            LOG.error("Run failed: {}", e.getMessage());
            out.println("Run failed: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private int execute(PulseRun pulseRun, PulseConfig config, RunArguments arguments) throws RunFailedException {
        RunRequest request = RunRequest.builder(DateWindow.lastDays(arguments.days(), clock, config.run().zone()))
            .depth(arguments.depth())
            .selection(CollectorSelection.parse(arguments.collectors(), arguments.excludeCollectors()))
            .retries(arguments.retries())
            .timeoutOverride(arguments.timeout())
            .limit(arguments.limit())
            .noCache(arguments.noCache())
            .reportType(arguments.reportType())
            .build();

        RunOutcome outcome = pulseRun.execute(request);
        outcome.warnings().forEach(w -> out.println("! " + w));
        printItems(outcome.result().items());

        int exitCode = EXIT_OK;
        if (arguments.output() != null) {
            ReportSink sink = new JsonReportSink(arguments.output());
            DeliveryTrace delivery = pulseRun.deliver(outcome, sink);
            if (!delivery.success()) {
                out.println("Delivery failed: " + delivery.error());
                exitCode = EXIT_DELIVERY;
            }
        }
        if (arguments.trace()) {
            printTrace(outcome.trace().snapshot(), arguments.output());
        }
        return exitCode;
    }

    // ==================== Setup ====================

    /** An explicit path must exist; a missing default file means built-in defaults. */
    static PulseConfig loadConfig(Path explicit) throws ConfigException {
        PulseConfig config;
        if (explicit != null) {
            config = ConfigLoader.load(explicit);
        } else if (Files.isRegularFile(ConfigLoader.defaultPath())) {
            config = ConfigLoader.load(ConfigLoader.defaultPath());
        } else {
            LOG.info("No config at {}, using defaults", ConfigLoader.defaultPath());
            config = ConfigLoader.parse(null);
        }
        if (config.collectors().isEmpty()) {
            config = new PulseConfig(config.domain(), config.profile(), CollectorCatalog.defaultRegistrations(),
                config.depth(), config.scoring(), config.cache(), config.run());
        }
        return config;
    }

    private ResponseCache openCache(CacheSettings settings) throws ConfigException {
        if (!settings.enabled()) {
            return ResponseCache.disabled();
        }
        try {
            return new FileResponseCache(settings.resolveDirectory(FileResponseCache.defaultDirectory()),
                settings.resolveTtl(environment), clock);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
    }

    // ==================== Output ====================

    private void printAvailability(List<Availability> availability) {
        out.println("Collectors:");
        availability.forEach(a -> out.println("  " + a.describe()));
    }

    /**
     * Summary tree, then the JSON trace document: next to the result file when there is one,
     * otherwise on stdout.
     */
    private void printTrace(TraceDocument trace, Path output) {
        out.println();
        out.print(TraceFormatter.format(trace));
        if (output == null) {
            out.println(TraceWriter.toJson(trace));
            return;
        }
        Path traceFile = traceFileFor(output);
        try {
            TraceWriter.write(trace, traceFile);
            out.println("Trace: " + traceFile);
        } catch (IOException e) {
            LOG.error("Failed to write trace {}: {}", traceFile, e.getMessage());
            out.println("Trace not written: " + e.getMessage());
        }
    }

    /** {@code report.json} becomes {@code report.trace.json}. */
    static Path traceFileFor(Path output) {
        String name = output.getFileName().toString();
        String stem = name.endsWith(".json") ? name.substring(0, name.length() - 5) : name;
        return output.resolveSibling(stem + ".trace.json");
    }

    private void printItems(List<ScoredItem> items) {
        out.println(items.size() + " items");
        for (int i = 0; i < Math.min(PREVIEW_ITEMS, items.size()); i++) {
            ScoredItem scored = items.get(i);
            out.println(String.format(Locale.ROOT, "%3d. [%.2f] %s (%s)", i + 1, scored.score(),
                scored.item().title(), scored.item().sourceName()));
        }
        if (items.size() > PREVIEW_ITEMS) {
            out.println("  ... " + (items.size() - PREVIEW_ITEMS) + " more");
        }
    }
}
