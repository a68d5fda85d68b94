package dk.cloudcreate.toggles.project;

public class CreateProject {
    public final String name;

    public CreateProject(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return "CreateProject{name='" + name + "'}";
    }
}
