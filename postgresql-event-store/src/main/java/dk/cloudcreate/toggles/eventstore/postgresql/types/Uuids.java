package dk.cloudcreate.toggles.eventstore.postgresql.types;

import java.util.*;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Strict UUID parsing.<br>
 * Accepts the canonical hyphenated form (<code>936da01f-9abd-4d9d-80c7-02af85c822a8</code>) and the simple
 * 32 hex digit form (<code>936da01f9abd4d9d80c702af85c822a8</code>), in any letter case.
 */
public final class Uuids {
    private static final Pattern HYPHENATED = Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern SIMPLE     = Pattern.compile("^[0-9a-fA-F]{32}$");

    private Uuids() {
    }

    /**
     * Parse a UUID
     *
     * @param value the value to parse
     * @return the parsed UUID
     * @throws IllegalArgumentException if the value isn't a UUID in one of the supported forms
     */
    public static UUID parse(CharSequence value) {
        requireNonNull(value, "No UUID value provided");
        var uuid = value.toString();
        if (HYPHENATED.matcher(uuid).matches()) {
            return UUID.fromString(uuid);
        }
        if (SIMPLE.matcher(uuid).matches()) {
            return UUID.fromString(uuid.substring(0, 8) + "-" +
                                           uuid.substring(8, 12) + "-" +
                                           uuid.substring(12, 16) + "-" +
                                           uuid.substring(16, 20) + "-" +
                                           uuid.substring(20));
        }
        throw new IllegalArgumentException(msg("'{}' is not a valid UUID", uuid));
    }

    /**
     * Parse a UUID and return it in canonical (hyphenated, lower case) form
     *
     * @param value the value to parse
     * @return the canonical UUID string
     * @throws IllegalArgumentException if the value isn't a UUID in one of the supported forms
     */
    public static String canonical(CharSequence value) {
        return parse(value).toString();
    }
}
