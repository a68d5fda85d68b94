package dk.cloudcreate.toggles.toggle;

import com.fasterxml.jackson.annotation.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Events related to a {@link Toggle}
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ToggleEvent.Created.class, name = ToggleEvent.Created.TYPE),
        @JsonSubTypes.Type(value = ToggleEvent.Renamed.class, name = ToggleEvent.Renamed.TYPE),
        @JsonSubTypes.Type(value = ToggleEvent.Retired.class, name = ToggleEvent.Retired.TYPE),
        @JsonSubTypes.Type(value = ToggleEvent.Revived.class, name = ToggleEvent.Revived.TYPE)
})
public abstract class ToggleEvent {
    public abstract String eventType();

    @JsonTypeName(Created.TYPE)
    @JsonPropertyOrder({"id", "name"})
    public static final class Created extends ToggleEvent {
        public static final String TYPE = "Created";

        public final ToggleId id;
        public final String   name;

        @JsonCreator
        public Created(@JsonProperty("id") ToggleId id, @JsonProperty("name") String name) {
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

    @JsonTypeName(Renamed.TYPE)
    public static final class Renamed extends ToggleEvent {
        public static final String TYPE = "Renamed";

        public final String name;

        @JsonCreator
        public Renamed(@JsonProperty("name") String name) {
            this.name = requireNonNull(name, "No name provided");
        }

        @Override
        public String eventType() {
            return TYPE;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Renamed)) return false;
            return Objects.equals(name, ((Renamed) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(TYPE, name);
        }

        @Override
        public String toString() {
            return "Renamed{name='" + name + "'}";
        }
    }

    @JsonTypeName(Retired.TYPE)
    public static final class Retired extends ToggleEvent {
        public static final String TYPE = "Retired";

        @Override
        public String eventType() {
            return TYPE;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Retired;
        }

        @Override
        public int hashCode() {
            return TYPE.hashCode();
        }

        @Override
        public String toString() {
            return TYPE;
        }
    }

    @JsonTypeName(Revived.TYPE)
    public static final class Revived extends ToggleEvent {
        public static final String TYPE = "Revived";

        @Override
        public String eventType() {
            return TYPE;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Revived;
        }

        @Override
        public int hashCode() {
            return TYPE.hashCode();
        }

        @Override
        public String toString() {
            return TYPE;
        }
    }
}
