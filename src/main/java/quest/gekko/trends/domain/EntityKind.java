package quest.gekko.trends.domain;

import java.util.Locale;
import java.util.Optional;

public enum EntityKind {
    SOUND,
    HASHTAG,
    CREATOR;

    /**
     * Resolve a platform-specific kind label ("music", "challenge", "user", ...) to a kind.
     */
    public static Optional<EntityKind> fromLabel(final String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "sound", "sounds", "music" -> Optional.of(SOUND);
            case "hashtag", "hashtags", "challenge", "tag" -> Optional.of(HASHTAG);
            case "creator", "creators", "user", "author" -> Optional.of(CREATOR);
            default -> Optional.empty();
        };
    }
}
