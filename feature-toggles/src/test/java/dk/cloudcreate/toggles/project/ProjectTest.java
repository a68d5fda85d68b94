package dk.cloudcreate.toggles.project;

import dk.cloudcreate.toggles.InvalidNameException;
import dk.cloudcreate.toggles.eventsourced.aggregates.InvalidStateEventException;
import dk.cloudcreate.toggles.eventstore.postgresql.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class ProjectTest {
    private static final ProjectId PROJECT_ID = ProjectId.of("936da01f-9abd-4d9d-80c7-02af85c822a8");

    @Test
    void test_create_results_in_a_single_Created_event() {
        var events = Project.create(PROJECT_ID, "test");

        assertThat(events).containsExactly(new ProjectEvent.Created(PROJECT_ID, "test"));
        assertThat(events.get(0).eventType()).isEqualTo("Created");
    }

    @Test
    void test_create_rejects_blank_names() {
        assertThatThrownBy(() -> Project.create(PROJECT_ID, " "))
                .isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> Project.create(PROJECT_ID, null))
                .isInstanceOf(InvalidNameException.class);
    }

    @Test
    void test_Created_creates_the_project_at_the_first_generation() {
        var project = Project.applyEvent(Optional.empty(), new ProjectEvent.Created(PROJECT_ID, "test"));

        assertThat((CharSequence) project.aggregateId()).isEqualTo(PROJECT_ID);
        assertThat(project.name).isEqualTo("test");
        assertThat(project.generation()).isEqualTo(Generation.first());
    }

    @Test
    void test_Created_on_an_existing_project_is_rejected() {
        var project = Project.APPLIER.hydrate(Project.create(PROJECT_ID, "test")).get();

        assertThatThrownBy(() -> Project.applyEvent(Optional.of(project), new ProjectEvent.Created(PROJECT_ID, "again")))
                .isInstanceOf(InvalidStateEventException.class);
    }

    @Test
    void test_hydrating_no_events_gives_no_project() {
        assertThat(Project.APPLIER.hydrate(List.of())).isEmpty();
    }

    @Test
    void test_Created_is_serialized_as_an_externally_tagged_json_object() {
        // Given
        var serializer = JacksonJSONSerializer.createDefault();
        var expectedJson = "{\"Created\":{\"id\":\"936da01f-9abd-4d9d-80c7-02af85c822a8\",\"name\":\"test\"}}";

        // When
        var json = serializer.serialize(new ProjectEvent.Created(PROJECT_ID, "test"));

        // Then
        assertThat(json).isEqualTo(expectedJson);
        assertThat(serializer.deserialize(expectedJson, ProjectEvent.class)).isEqualTo(new ProjectEvent.Created(PROJECT_ID, "test"));
    }

    @Test
    void test_ProjectId_accepts_the_simple_uuid_form() {
        assertThat((CharSequence) ProjectId.of("936da01f9abd4d9d80c702af85c822a8")).isEqualTo(PROJECT_ID);
        assertThatThrownBy(() -> ProjectId.of("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
