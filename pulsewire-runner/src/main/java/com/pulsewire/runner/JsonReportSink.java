package com.pulsewire.runner;

import com.pulsewire.core.json.Mappers;
import com.pulsewire.core.report.DeliveryException;
import com.pulsewire.core.report.ReportSink;
import com.pulsewire.core.report.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the run report as pretty-printed JSON. The file is replaced atomically.
 */
public class JsonReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(JsonReportSink.class);

    private final Path output;

    public JsonReportSink(Path output) {
        this.output = output;
    }

    @Override
    public String channel() {
        return "json";
    }

    @Override
    public void deliver(RunReport report) throws DeliveryException {
        Path target = output.toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try {
                Mappers.json().writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), report);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.info("Wrote {} items to {}", report.items().size(), target);
        } catch (IOException e) {
            throw new DeliveryException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }
}
