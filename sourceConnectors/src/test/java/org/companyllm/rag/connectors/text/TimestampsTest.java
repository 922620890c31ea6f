package org.companyllm.rag.connectors.text;

import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TimestampsTest {

    @ParameterizedTest
    @CsvSource({
        "2024-05-01T10:00:00Z, 2024-05-01T10:00:00Z",
        "2024-05-01T10:00:00.123Z, 2024-05-01T10:00:00.123Z",
        "2024-05-01T12:00:00+02:00, 2024-05-01T10:00:00Z",
        "2024-05-01T10:00:00.000+0000, 2024-05-01T10:00:00Z",
        "2024-05-01T05:00:00.000-0500, 2024-05-01T10:00:00Z"
    })
    void providerFormatsParse(String value, String expected) {
        assertEquals(Optional.of(Instant.parse(expected)), Timestamps.parseLenient(value));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"yesterday", "2024-13-45"})
    void unparseableValuesAreAbsent(String value) {
        assertTrue(Timestamps.parseLenient(value).isEmpty());
    }
}
