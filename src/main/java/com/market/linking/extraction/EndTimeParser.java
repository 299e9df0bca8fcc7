package com.market.linking.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient ISO-8601 end-date parsing. Unparsable values degrade to "unknown"
 * instead of failing.
 *
 * <p>Accepted shapes, tried in order:</p>
 * <ul>
 *   <li>offset date-time: {@code 2024-11-05T12:00:00Z}, {@code 2024-11-05T12:00:00+02:00}</li>
 *   <li>local date-time, read as UTC: {@code 2024-11-05T12:00:00}</li>
 *   <li>date, read as UTC midnight: {@code 2024-11-05}</li>
 * </ul>
 */
public final class EndTimeParser {
    private static final Logger log = LoggerFactory.getLogger(EndTimeParser.class);

    private static final List<Function<String, Instant>> SHAPES = List.of(
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private EndTimeParser() {
        // Utility class
    }

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Function<String, Instant> shape : SHAPES) {
            try {
                return Optional.of(shape.apply(trimmed));
            } catch (DateTimeParseException e) {
                log.trace("endtime.shape.mismatch value='{}' error={}", trimmed, e.getMessage());
            }
        }
        log.debug("endtime.unparsable value='{}'", trimmed);
        return Optional.empty();
    }
}
