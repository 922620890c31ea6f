package org.companyllm.rag.connectors.text;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Parses the timestamp flavours the providers emit. Unparseable values are treated
 * as absent rather than failing the record.
 */
public class Timestamps {
    private static final List<DateTimeFormatter> OFFSET_FORMATS = List.of(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        // Jira: 2024-05-01T10:00:00.000+0000
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSZ"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ")
    );

    private Timestamps() {}

    public static Optional<Instant> parseLenient(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        var instant = tryParse(value, null);
        for (int i = 0; instant.isEmpty() && i < OFFSET_FORMATS.size(); i++) {
            instant = tryParse(value, OFFSET_FORMATS.get(i));
        }
        return instant;
    }

    private static Optional<Instant> tryParse(String value, DateTimeFormatter format) {
        try {
            return Optional.of(format == null ? Instant.parse(value) : OffsetDateTime.parse(value, format).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
