package dk.cloudcreate.toggles.eventstore.postgresql.serializer.json;

import com.fasterxml.jackson.annotation.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JacksonJSONSerializerTest {
    private final JacksonJSONSerializer serializer = JacksonJSONSerializer.createDefault();

    @Test
    void test_serialize_and_deserialize() {
        // When
        var json = serializer.serialize(new Label("blue", 3));

        // Then
        assertThat(json).isEqualTo("{\"name\":\"blue\",\"weight\":3}");
        var label = serializer.deserialize(json, Label.class);
        assertThat(label.name).isEqualTo("blue");
        assertThat(label.weight).isEqualTo(3);
    }

    @Test
    void test_malformed_json_raises_JSONDeserializationException() {
        assertThatThrownBy(() -> serializer.deserialize("{\"name\":", Label.class))
                .isInstanceOf(JSONDeserializationException.class)
                .hasMessageContaining(Label.class.getName());
    }

    @Test
    void test_unknown_properties_raise_JSONDeserializationException() {
        assertThatThrownBy(() -> serializer.deserialize("{\"name\":\"blue\",\"weight\":3,\"color\":\"red\"}", Label.class))
                .isInstanceOf(JSONDeserializationException.class);
    }

    @Test
    void test_missing_and_null_creator_properties_raise_JSONDeserializationException() {
        assertThatThrownBy(() -> serializer.deserialize("{\"weight\":3}", Label.class))
                .isInstanceOf(JSONDeserializationException.class);
        assertThatThrownBy(() -> serializer.deserialize("{\"name\":null,\"weight\":3}", Label.class))
                .isInstanceOf(JSONDeserializationException.class);
    }

    @JsonPropertyOrder({"name", "weight"})
    static class Label {
        public final String name;
        public final int    weight;

        @JsonCreator
        Label(@JsonProperty("name") String name, @JsonProperty("weight") int weight) {
            this.name = name;
            this.weight = weight;
        }
    }
}
