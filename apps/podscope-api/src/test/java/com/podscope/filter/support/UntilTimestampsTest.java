package com.podscope.filter.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UntilTimestampsTest {

    static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void durationsCountBackFromNow() {
        assertEquals(NOW.minus(Duration.ofMinutes(10)), UntilTimestamps.compute(List.of("10m"), CLOCK));
        assertEquals(NOW.minus(Duration.ofMinutes(90)), UntilTimestamps.compute(List.of("1h30m"), CLOCK));
        assertEquals(NOW.minusMillis(1500), UntilTimestamps.compute(List.of("1.5s"), CLOCK));
        assertEquals(NOW.minusMillis(250), UntilTimestamps.compute(List.of("250ms"), CLOCK));
    }

    @Test
    void rfc3339Timestamps() {
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"),
                UntilTimestamps.compute(List.of("2024-01-01T10:00:00Z"), CLOCK));
        assertEquals(Instant.parse("2024-01-01T08:00:00.5Z"),
                UntilTimestamps.compute(List.of("2024-01-01T10:00:00.5+02:00"), CLOCK));
    }

    @Test
    void localFormsUseTheClockZone() {
        Clock paris = Clock.fixed(NOW, ZoneId.of("Europe/Paris"));

        assertEquals(Instant.parse("2024-01-01T09:30:00Z"),
                UntilTimestamps.compute(List.of("2024-01-01T10:30"), paris));
        assertEquals(Instant.parse("2024-01-01T09:30:15Z"),
                UntilTimestamps.compute(List.of("2024-01-01T10:30:15"), paris));
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"),
                UntilTimestamps.compute(List.of("2024-01-01"), CLOCK));
    }

    @Test
    void unixSeconds() {
        assertEquals(Instant.ofEpochSecond(1700000000), UntilTimestamps.compute(List.of("1700000000"), CLOCK));
        assertEquals(Instant.ofEpochSecond(1700000000, 250_000_000),
                UntilTimestamps.compute(List.of("1700000000.25"), CLOCK));
    }

    @Test
    void exactlyOneValueIsRequired() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> UntilTimestamps.compute(List.of(), CLOCK));
        assertEquals("specify exactly one timestamp for until", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> UntilTimestamps.compute(List.of("1h", "2h"), CLOCK));
    }

    @Test
    void garbageIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> UntilTimestamps.compute(List.of("tomorrow"), CLOCK));
        assertThrows(IllegalArgumentException.class, () -> UntilTimestamps.compute(List.of("10 minutes"), CLOCK));
        assertThrows(IllegalArgumentException.class, () -> UntilTimestamps.compute(List.of("99999999999999999"), CLOCK));
        assertThrows(IllegalArgumentException.class, () -> UntilTimestamps.compute(List.of("99999999999999999999"), CLOCK));
    }
}
