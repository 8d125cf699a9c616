package com.di.plumeflux.grouping;

import com.di.plumeflux.exception.MalformedDataException;
import lombok.Value;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Identity of a processing unit: kind plus acquisition timestamp, e.g. {@code pair:20240601T121000Z}.
 * Idempotence, coalescing and ledger lookups all key on this.
 */
@Value
public class UnitKey implements Comparable<UnitKey> {

    private static final DateTimeFormatter TOKEN_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    UnitKind kind;
    Instant timestamp;

    public static UnitKey of(UnitKind kind, Instant timestamp) {
        return new UnitKey(kind, timestamp);
    }

    public static UnitKey parse(String value) {
        int colon = value == null ? -1 : value.indexOf(':');
        if (colon <= 0) {
            throw new MalformedDataException("Not a unit key: " + value);
        }
        UnitKind kind = UnitKind.fromPrefix(value.substring(0, colon));
        try {
            return new UnitKey(kind, Instant.from(TOKEN_FORMAT.parse(value.substring(colon + 1))));
        } catch (DateTimeParseException e) {
            throw new MalformedDataException("Bad timestamp in unit key: " + value, e);
        }
    }

    public boolean isCalibration() {
        return kind.isCalibration();
    }

    /** Filesystem-safe form used in artifact names. */
    public String toFileToken() {
        return kind.getPrefix() + "_" + TOKEN_FORMAT.format(timestamp);
    }

    @Override
    public String toString() {
        return kind.getPrefix() + ":" + TOKEN_FORMAT.format(timestamp);
    }

    @Override
    public int compareTo(UnitKey other) {
        int byTime = timestamp.compareTo(other.timestamp);
        return byTime != 0 ? byTime : kind.compareTo(other.kind);
    }
}
