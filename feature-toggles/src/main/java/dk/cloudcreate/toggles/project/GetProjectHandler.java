package dk.cloudcreate.toggles.project;

import dk.cloudcreate.toggles.eventsourced.aggregates.repository.Repository;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public class GetProjectHandler {
    private final Repository<ProjectId, ProjectEvent, Project> repository;

    public GetProjectHandler(Repository<ProjectId, ProjectEvent, Project> repository) {
        this.repository = requireNonNull(repository, "No repository provided");
    }

    /**
     * @throws dk.cloudcreate.toggles.eventstore.postgresql.AggregateNotFoundException if the project doesn't exist
     */
    public Project handle(GetProject query) {
        requireNonNull(query, "No query provided");
        return repository.get(query.id);
    }
}
