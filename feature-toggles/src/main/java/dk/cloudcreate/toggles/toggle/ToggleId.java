package dk.cloudcreate.toggles.toggle;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.essentials.types.CharSequenceType;
import dk.cloudcreate.toggles.eventstore.postgresql.types.Uuids;

import java.util.UUID;

/**
 * UUID based identifier of a {@link Toggle}. Always kept in canonical UUID form
 */
public class ToggleId extends CharSequenceType<ToggleId> {
    protected ToggleId(CharSequence value) {
        super(Uuids.canonical(value));
    }

    public static ToggleId random() {
        return new ToggleId(UUID.randomUUID().toString());
    }

    public static ToggleId of(UUID id) {
        return new ToggleId(id.toString());
    }

    /**
     * @throws IllegalArgumentException if the value isn't a UUID
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ToggleId of(String id) {
        return new ToggleId(id);
    }

    @JsonValue
    public String jsonValue() {
        return value();
    }
}
