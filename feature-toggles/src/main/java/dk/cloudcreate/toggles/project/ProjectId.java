package dk.cloudcreate.toggles.project;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.essentials.types.CharSequenceType;
import dk.cloudcreate.toggles.eventstore.postgresql.types.Uuids;

import java.util.UUID;

/**
 * UUID based identifier of a {@link Project}. Always kept in canonical UUID form
 */
public class ProjectId extends CharSequenceType<ProjectId> {
    protected ProjectId(CharSequence value) {
        super(Uuids.canonical(value));
    }

    public static ProjectId of(UUID id) {
        return new ProjectId(id.toString());
    }

    /**
     * @throws IllegalArgumentException if the value isn't a UUID
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ProjectId of(String id) {
        return new ProjectId(id);
    }

    @JsonValue
    public String jsonValue() {
        return value();
    }
}
