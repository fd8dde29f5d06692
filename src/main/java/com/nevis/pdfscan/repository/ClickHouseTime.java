package com.nevis.pdfscan.repository;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Timestamps cross the JDBC boundary as epoch microseconds so that neither the driver nor the
 * server time zone can shift them.
 */
final class ClickHouseTime {

    private ClickHouseTime() {
    }

    static long toMicros(OffsetDateTime time) {
        Instant instant = time.toInstant();
        return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    }

    static OffsetDateTime fromMicros(long micros) {
        return Instant.EPOCH.plus(micros, ChronoUnit.MICROS).atOffset(ZoneOffset.UTC);
    }

    static long nowMicros() {
        return toMicros(OffsetDateTime.now(ZoneOffset.UTC));
    }
}
