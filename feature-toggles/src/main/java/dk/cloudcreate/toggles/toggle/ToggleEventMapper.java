package dk.cloudcreate.toggles.toggle;

import dk.cloudcreate.toggles.eventsourced.aggregates.repository.JSONAggregateEventMapper;
import dk.cloudcreate.toggles.eventstore.postgresql.serializer.json.JSONSerializer;

public class ToggleEventMapper extends JSONAggregateEventMapper<ToggleId, ToggleEvent> {
    public ToggleEventMapper(JSONSerializer jsonSerializer) {
        super(jsonSerializer,
              ToggleEvent.class,
              ToggleId::toString,
              ToggleId::of,
              ToggleEvent::eventType);
    }
}
