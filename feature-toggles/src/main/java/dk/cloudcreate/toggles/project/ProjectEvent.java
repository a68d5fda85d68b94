package dk.cloudcreate.toggles.project;

import com.fasterxml.jackson.annotation.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Events related to a {@link Project}.<br>
 * Serialized as a JSON object with the event type as its single key, e.g. <code>{"Created":{"id":"...","name":"test"}}</code>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProjectEvent.Created.class, name = ProjectEvent.Created.TYPE)
})
public abstract class ProjectEvent {
    /**
     * The type discriminator stored with the event
     */
    public abstract String eventType();

    @JsonTypeName(Created.TYPE)
    @JsonPropertyOrder({"id", "name"})
    public static final class Created extends ProjectEvent {
        public static final String TYPE = "Created";

        public final ProjectId id;
        public final String    name;

        @JsonCreator
        public Created(@JsonProperty("id") ProjectId id, @JsonProperty("name") String name) {
            this.id = requireNonNull(id, "No id provided");
            this.name = requireNonNull(name, "No name provided");
        }

        @Override
        public String eventType() {
            return TYPE;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Created)) return false;
            Created created = (Created) o;
            return Objects.equals(id, created.id) && Objects.equals(name, created.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, name);
        }

        @Override
        public String toString() {
            return "Created{id=" + id + ", name='" + name + "'}";
        }
    }
}
