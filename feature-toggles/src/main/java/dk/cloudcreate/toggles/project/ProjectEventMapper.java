package dk.cloudcreate.toggles.project;

import dk.cloudcreate.toggles.eventsourced.aggregates.repository.JSONAggregateEventMapper;
import dk.cloudcreate.toggles.eventstore.postgresql.serializer.json.JSONSerializer;

public class ProjectEventMapper extends JSONAggregateEventMapper<ProjectId, ProjectEvent> {
    public ProjectEventMapper(JSONSerializer jsonSerializer) {
        super(jsonSerializer,
              ProjectEvent.class,
              ProjectId::toString,
              ProjectId::of,
              ProjectEvent::eventType);
    }
}
