package dk.cloudcreate.toggles.project;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public class GetProject {
    public final ProjectId id;

    public GetProject(ProjectId id) {
        this.id = requireNonNull(id, "No project id provided");
    }

    @Override
    public String toString() {
        return "GetProject{id=" + id + '}';
    }
}
