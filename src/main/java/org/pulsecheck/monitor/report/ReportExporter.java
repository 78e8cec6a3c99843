package org.pulsecheck.monitor.report;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.pulsecheck.monitor.api.report.SystemHealthReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Serializes reports to JSON documents.
 * <p>
 * Timestamps are written as ISO-8601 strings. When no target path is given, the file is
 * named {@code health_report_<yyyyMMdd_HHmmss>.json} after the current UTC time and placed in
 * the configured export directory. The document is first written to a temporary sibling and
 * then moved into place, so a failed export never leaves a truncated file behind.
 */
public class ReportExporter {

    private static final Logger log = LoggerFactory.getLogger(ReportExporter.class);

    static final String FILE_PREFIX = "health_report_";
    static final String FILE_EXTENSION = ".json";
    private static final DateTimeFormatter FILE_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final Path exportDirectory;
    private final Clock clock;

    public ReportExporter(Path exportDirectory) {
        this(exportDirectory, Clock.systemUTC());
    }

    /**
     * @param exportDirectory Directory for derived file names.
     * @param clock           Time source for derived file names.
     */
    public ReportExporter(Path exportDirectory, Clock clock) {
        this.exportDirectory = Objects.requireNonNull(exportDirectory, "exportDirectory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // convenience predicates such as PlatformInfo.isLinux() are not part of the document
        mapper.setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);
        return mapper;
    }

    /**
     * Writes a report to disk.
     *
     * @param report The report to export.
     * @param target Target file, or {@code null} to derive one from the current time.
     * @return The path that was written.
     * @throws IOException if the document could not be written.
     */
    public Path export(SystemHealthReport report, Path target) throws IOException {
        Objects.requireNonNull(report, "report");
        Path path = target != null ? target : derivePath();
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), report);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Health report exported to {}", path.toAbsolutePath());
        return path;
    }

    /**
     * Reads an exported document back as a JSON tree.
     *
     * @param path The exported file.
     * @return The parsed document.
     * @throws IOException if the file cannot be read or is not valid JSON.
     */
    public JsonNode read(Path path) throws IOException {
        return objectMapper.readTree(path.toFile());
    }

    /**
     * Renders a report as a JSON string.
     */
    public String toJson(SystemHealthReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    Path derivePath() {
        return exportDirectory.resolve(FILE_PREFIX + FILE_TIMESTAMP.format(clock.instant()) + FILE_EXTENSION);
    }
}
