package dk.cloudcreate.toggles.eventstore.postgresql.types;

import java.time.*;
import java.time.format.*;
import java.time.temporal.ChronoField;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Renders and parses the RFC3339 timestamps stored in the event rows.<br>
 * Timestamps are always written in UTC with an explicit <code>+00:00</code> offset, e.g. <code>2019-01-01T00:00:00+00:00</code>,
 * and a fractional second part only when the timestamp has one.<br>
 * Parsing accepts any RFC3339 offset, including <code>Z</code>.
 */
public final class Rfc3339Timestamps {
    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .appendOffset("+HH:MM", "+00:00")
            .toFormatter();

    private Rfc3339Timestamps() {
    }

    public static String format(OffsetDateTime timestamp) {
        requireNonNull(timestamp, "No timestamp provided");
        return FORMATTER.format(timestamp.withOffsetSameInstant(ZoneOffset.UTC));
    }

    /**
     * @param timestamp the RFC3339 timestamp
     * @return the parsed timestamp (keeping the offset it was written with)
     * @throws DateTimeParseException if the timestamp isn't a valid RFC3339 timestamp
     */
    public static OffsetDateTime parse(CharSequence timestamp) {
        requireNonNull(timestamp, "No timestamp provided");
        return OffsetDateTime.parse(timestamp, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
