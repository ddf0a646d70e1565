package quest.gekko.trends.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Virality stages in ascending order; {@link #compareTo} reflects the ordering.
 */
public enum ViralityStage {
    NEW("New"),
    EARLY_TRACTION("Early Traction"),
    STEADY("Steady"),
    MASSIVE("Massive");

    private final String displayName;

    ViralityStage(final String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }

    /** Accepts the enum name or the display name, e.g. "early-traction" or "Early Traction". */
    public static Optional<ViralityStage> fromLabel(final String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ViralityStage stage : values()) {
            if (stage.name().equals(normalized)) return Optional.of(stage);
        }
        return Optional.empty();
    }
}
