package com.di.plumeflux.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns the timestamp token of an acquisition filename into an {@link Instant}.
 * <p>
 * Formats are tried in the configured order, first that parses the whole token wins, e.g.
 * {@code 20240601_1200} with {@code yyyyMMdd_HHmm} or {@code 2022-08-07T111111} with
 * {@code yyyy-MM-dd'T'HHmmss}. Filenames carry local time, so the station zone is applied.
 */
@Slf4j
public class AcquisitionTimeParser {

    private final List<DateTimeFormatter> formatters;
    private final List<String> patterns;
    private final ZoneId zone;

    public AcquisitionTimeParser(List<String> patterns, ZoneId zone) {
        this.patterns = List.copyOf(patterns);
        this.formatters = patterns.stream().map(DateTimeFormatter::ofPattern).collect(Collectors.toList());
        this.zone = zone;
    }

    public Optional<Instant> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        for (DateTimeFormatter formatter : formatters) {
            try {
                return Optional.of(LocalDateTime.parse(token, formatter).atZone(zone).toInstant());
            } catch (DateTimeParseException ignored) {
                log.trace("Timestamp '{}' does not match {}", token, formatter);
            }
        }
        return Optional.empty();
    }

    public List<String> getPatterns() {
        return patterns;
    }
}
