package com.discordsentinel.core.report;

import com.discordsentinel.core.model.DiscordReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Converts {@link DiscordReport} instances to JSON for reporting and plotting
 * collaborators.
 *
 * <p>
 * Timestamps are written as ISO-8601 strings. Instances are thread-safe once
 * constructed.
 * </p>
 *
 * @since 1.0.0
 */
public class DiscordReportSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(DiscordReportSerializer.class);

    private final ObjectMapper mapper;

    public DiscordReportSerializer() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * @param report the report
     * @return the report as a JSON object
     * @throws IllegalStateException if serialization fails
     */
    public String toJson(DiscordReport report) {
        Objects.requireNonNull(report, "Report must not be null");
        return write(report);
    }

    /**
     * @param reports the reports
     * @return the reports as a JSON array
     * @throws IllegalStateException if serialization fails
     */
    public String toJson(List<DiscordReport> reports) {
        Objects.requireNonNull(reports, "Reports must not be null");
        return write(reports);
    }

    /**
     * @param json a JSON object written by {@link #toJson(DiscordReport)}
     * @return the report
     * @throws IllegalArgumentException if the JSON cannot be read as a report
     */
    public DiscordReport fromJson(String json) {
        Objects.requireNonNull(json, "JSON must not be null");
        try {
            return mapper.readValue(json, DiscordReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a discord report: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize discord report: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize discord report", e);
        }
    }
}
