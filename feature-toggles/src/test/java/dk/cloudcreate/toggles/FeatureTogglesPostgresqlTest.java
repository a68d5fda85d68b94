package dk.cloudcreate.toggles;

import dk.cloudcreate.toggles.common.transaction.JdbiUnitOfWorkFactory;
import dk.cloudcreate.toggles.eventsourced.aggregates.DomainEvent;
import dk.cloudcreate.toggles.eventsourced.aggregates.repository.EventDecodingException;
import dk.cloudcreate.toggles.eventsourced.aggregates.retry.*;
import dk.cloudcreate.toggles.eventstore.postgresql.*;
import dk.cloudcreate.toggles.eventstore.postgresql.eventstream.StoredEvent;
import dk.cloudcreate.toggles.eventstore.postgresql.persistence.*;
import dk.cloudcreate.toggles.eventstore.postgresql.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.toggles.eventstore.postgresql.types.*;
import dk.cloudcreate.toggles.project.*;
import dk.cloudcreate.toggles.toggle.ToggleCommands.*;
import dk.cloudcreate.toggles.toggle.ToggleId;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

@Testcontainers(disabledWithoutDocker = true)
class FeatureTogglesPostgresqlTest {
    private static final UUID    PROJECT_ID = UUID.fromString("936da01f-9abd-4d9d-80c7-02af85c822a8");
    private static final UUID    EVENT_ID   = UUID.fromString("550e8400-e29b-41d4-a716-446655440000");
    private static final Instant NOW        = Instant.parse("2019-01-01T00:00:00Z");

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("feature-toggles")
            .withUsername("test-user")
            .withPassword("secret-password");

    private JdbiUnitOfWorkFactory   unitOfWorkFactory;
    private CompetingWriterEventStore eventStore;
    private FeatureToggles          featureToggles;

    @BeforeEach
    void setup() {
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                                                                  postgreSQLContainer.getUsername(),
                                                                  postgreSQLContainer.getPassword()));
        var ids = new ConcurrentLinkedDeque<>(List.of(PROJECT_ID, EVENT_ID));
        eventStore = new CompetingWriterEventStore(new PostgresqlEventStore(unitOfWorkFactory));
        featureToggles = new FeatureToggles(eventStore,
                                            JacksonJSONSerializer.createDefault(),
                                            () -> Optional.ofNullable(ids.pollFirst()).orElseGet(UUID::randomUUID),
                                            Clock.fixed(NOW, ZoneOffset.UTC),
                                            new OptimisticConcurrencyRetry(ConcurrencyRetryPolicy.fixedDelay(Duration.ofMillis(10), 5), unitOfWorkFactory));
    }

    @Test
    void test_a_created_project_is_stored_as_a_single_event_and_can_be_fetched() {
        // When
        var project = featureToggles.createProjectHandler.handle(new CreateProject("test"));

        // Then
        assertThat(project.id.toString()).isEqualTo(PROJECT_ID.toString());
        assertThat(project.generation).isEqualTo(Generation.first());

        var row = unitOfWorkFactory.getJdbi().withHandle(handle -> handle.createQuery("SELECT id, aggregate_id, generation, created_at, type, data FROM events")
                                                                         .mapToMap()
                                                                         .one());
        assertThat(row).containsEntry("id", EVENT_ID.toString())
                       .containsEntry("aggregate_id", PROJECT_ID.toString())
                       .containsEntry("generation", 0)
                       .containsEntry("created_at", "2019-01-01T00:00:00+00:00")
                       .containsEntry("type", "Created")
                       .containsEntry("data", "{\"Created\":{\"id\":\"936da01f-9abd-4d9d-80c7-02af85c822a8\",\"name\":\"test\"}}");

        var fetched = featureToggles.getProjectHandler.handle(new GetProject(project.id));
        assertThat(fetched).isEqualTo(project);
    }

    @Test
    void test_getting_a_project_without_events_fails_with_not_found() {
        assertThatThrownBy(() -> featureToggles.getProjectHandler.handle(new GetProject(ProjectId.of(PROJECT_ID))))
                .isInstanceOf(AggregateNotFoundException.class);
    }

    @Test
    void test_a_row_with_unparsable_data_is_a_decoding_error() {
        // Given
        featureToggles.eventStore.appendEvents(List.of(new StoredEvent(EVENT_ID.toString(),
                                                                       PROJECT_ID.toString(),
                                                                       Generation.first(),
                                                                       "2019-01-01T00:00:00+00:00",
                                                                       "Created",
                                                                       "{ this is not json")));

        // Then
        assertThatThrownBy(() -> featureToggles.getProjectHandler.handle(new GetProject(ProjectId.of(PROJECT_ID))))
                .isInstanceOf(EventDecodingException.class);
    }

    @Test
    void test_only_one_of_two_concurrent_writers_of_the_same_generation_succeeds() throws Exception {
        // Given
        var projectId = ProjectId.of(PROJECT_ID);
        var start     = new CountDownLatch(1);
        var executor  = Executors.newFixedThreadPool(2);
        try {
            var first  = executor.submit(() -> persistCreated(projectId, "first", start));
            var second = executor.submit(() -> persistCreated(projectId, "second", start));

            // When
            start.countDown();
            await().atMost(Duration.ofSeconds(30)).until(() -> first.isDone() && second.isDone());

            // Then
            var outcomes = Arrays.asList(outcomeOf(first), outcomeOf(second));
            assertThat(outcomes).filteredOn(Objects::isNull).hasSize(1);
            assertThat(outcomes).filteredOn(Objects::nonNull)
                                .hasSize(1)
                                .allMatch(failure -> failure instanceof OptimisticAppendToStreamException);
            assertThat(featureToggles.projectRepository.loadEvents(projectId)).hasSize(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void test_the_toggle_lifecycle_against_postgresql() {
        // Given
        var toggles = FeatureToggles.usingPostgresql(unitOfWorkFactory);
        var toggle  = toggles.toggleCommandHandler.handle(new CreateToggle("dark-mode"));

        // When
        toggles.toggleCommandHandler.handle(new RenameToggle(toggle.id, "night-mode"));
        toggles.toggleCommandHandler.handle(new RetireToggle(toggle.id));

        // Then
        var loaded = toggles.toggleCommandHandler.handle(new GetToggle(toggle.id));
        assertThat(loaded.name).isEqualTo("night-mode");
        assertThat(loaded.version).isEqualTo(1);
        assertThat(loaded.retired).isTrue();
        assertThat(loaded.generation).isEqualTo(Generation.of(2));
    }

    @Test
    void test_a_conflicting_toggle_update_is_retried_in_a_new_transaction() {
        // Given
        var toggle = featureToggles.toggleCommandHandler.handle(new CreateToggle("dark-mode"));
        eventStore.competingWriterAppendsBeforeNextAppend(storedRenamed(toggle.id, Generation.of(1), "light-mode"));

        // When
        var renamed = featureToggles.toggleCommandHandler.handle(new RenameToggle(toggle.id, "night-mode"));

        // Then
        assertThat(renamed.name).isEqualTo("night-mode");
        assertThat(renamed.version).isEqualTo(2);
        assertThat(renamed.generation).isEqualTo(Generation.of(2));
        assertThat(featureToggles.toggleCommandHandler.handle(new GetToggle(toggle.id))).isEqualTo(renamed);
    }

    @Test
    void test_a_conflicting_toggle_update_inside_an_active_unit_of_work_is_rethrown_as_a_conflict() {
        // Given
        var toggle = featureToggles.toggleCommandHandler.handle(new CreateToggle("dark-mode"));
        eventStore.competingWriterAppendsBeforeNextAppend(storedRenamed(toggle.id, Generation.of(1), "light-mode"));

        // When
        var thrown = catchThrowable(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> featureToggles.toggleCommandHandler.handle(new RenameToggle(toggle.id, "night-mode"))));

        // Then
        assertThat(thrown).isInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(unitOfWorkFactory.getCurrentUnitOfWork()).isEmpty();
        var loaded = featureToggles.toggleCommandHandler.handle(new GetToggle(toggle.id));
        assertThat(loaded.name).isEqualTo("light-mode");
        assertThat(loaded.generation).isEqualTo(Generation.of(1));
    }

    private Void persistCreated(ProjectId projectId, String name, CountDownLatch start) throws InterruptedException {
        start.await();
        featureToggles.projectRepository.persist(Generation.first(),
                                                 List.of(DomainEvent.of(EventId.random(),
                                                                        projectId,
                                                                        OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC),
                                                                        new ProjectEvent.Created(projectId, name))));
        return null;
    }

    private static Throwable outcomeOf(Future<Void> future) throws InterruptedException {
        try {
            future.get();
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    private static StoredEvent storedRenamed(ToggleId toggleId, Generation generation, String name) {
        return new StoredEvent(EventId.random().toString(),
                               toggleId.toString(),
                               generation,
                               "2019-01-01T00:00:00+00:00",
                               "Renamed",
                               "{\"Renamed\":{\"name\":\"" + name + "\"}}");
    }

    /**
     * Lets a competing writer append its events, in its own transaction on another thread, right before the next append
     */
    private static class CompetingWriterEventStore implements EventStore {
        private final EventStore        delegate;
        private final List<StoredEvent> competingEvents = new CopyOnWriteArrayList<>();

        CompetingWriterEventStore(EventStore delegate) {
            this.delegate = delegate;
        }

        void competingWriterAppendsBeforeNextAppend(StoredEvent... events) {
            competingEvents.addAll(Arrays.asList(events));
        }

        @Override
        public List<StoredEvent> loadEvents(String aggregateId) {
            return delegate.loadEvents(aggregateId);
        }

        @Override
        public void appendEvents(List<StoredEvent> events) {
            if (!competingEvents.isEmpty()) {
                var competing = new ArrayList<>(competingEvents);
                competingEvents.clear();
                CompletableFuture.runAsync(() -> delegate.appendEvents(competing)).join();
            }
            delegate.appendEvents(events);
        }
    }
}
