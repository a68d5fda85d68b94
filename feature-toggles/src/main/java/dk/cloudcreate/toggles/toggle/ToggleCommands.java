package dk.cloudcreate.toggles.toggle;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Commands and queries handled by the {@link ToggleCommandHandler}
 */
public final class ToggleCommands {
    private ToggleCommands() {
    }

    public static class CreateToggle {
        public final String name;

        public CreateToggle(String name) {
            this.name = name;
        }
    }

    public static class RenameToggle {
        public final ToggleId id;
        public final String   name;

        public RenameToggle(ToggleId id, String name) {
            this.id = requireNonNull(id, "No toggle id provided");
            this.name = name;
        }
    }

    public static class RetireToggle {
        public final ToggleId id;

        public RetireToggle(ToggleId id) {
            this.id = requireNonNull(id, "No toggle id provided");
        }
    }

    public static class ReviveToggle {
        public final ToggleId id;

        public ReviveToggle(ToggleId id) {
            this.id = requireNonNull(id, "No toggle id provided");
        }
    }

    public static class GetToggle {
        public final ToggleId id;

        public GetToggle(ToggleId id) {
            this.id = requireNonNull(id, "No toggle id provided");
        }
    }
}
