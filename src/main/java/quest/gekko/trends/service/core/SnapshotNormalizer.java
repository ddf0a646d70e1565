package quest.gekko.trends.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.Snapshot;
import quest.gekko.trends.exception.SnapshotValidationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns one scraped batch of discovery records into uniform snapshots. Pure transform, no storage access.
 */
@Component
@Slf4j
public class SnapshotNormalizer {

    // epoch values above this are milliseconds (1e11 seconds is year 5138)
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private static final String[] KIND_KEYS = { "kind", "type" };
    private static final String[] ID_KEYS = { "id", "external_id", "externalId" };
    private static final String[] NAME_KEYS = { "name", "display_name", "displayName", "title", "tag", "username" };
    private static final String[] VIEW_KEYS = { "view_count", "viewCount", "playCount", "usage_count" };
    private static final String[] LIKE_KEYS = { "likes", "like_count", "diggCount", "total_likes" };
    private static final String[] SHARE_KEYS = { "shares", "share_count", "shareCount" };
    private static final String[] VIDEO_KEYS = { "video_count", "videoCount" };
    private static final String[] CAPTURED_AT_KEYS = { "captured_at", "capturedAt", "timestamp" };

    /**
     * Normalize a batch. Invalid records are dropped and reported; when the same entity occurs
     * more than once, the record with the latest capture time wins (later position on ties).
     */
    public NormalizationResult normalize(final List<Map<String, Object>> records, final Instant batchCapturedAt) {
        Map<EntityRef, Snapshot> byEntity = new LinkedHashMap<>();
        List<NormalizationResult.RejectedRecord> rejected = new ArrayList<>();

        for (int i = 0; i < records.size(); i++) {
            try {
                Snapshot snapshot = toSnapshot(records.get(i), batchCapturedAt);
                byEntity.merge(snapshot.getRef(), snapshot,
                        (kept, next) -> next.getCapturedAt().isBefore(kept.getCapturedAt()) ? kept : next);
            } catch (SnapshotValidationException e) {
                log.warn("Dropping discovery record #{}: {}", i, e.getMessage());
                rejected.add(new NormalizationResult.RejectedRecord(i, e.getMessage()));
            }
        }

        return new NormalizationResult(List.copyOf(byEntity.values()), List.copyOf(rejected));
    }

    /**
     * @throws SnapshotValidationException when kind, id, view count or capture time is unusable
     */
    public Snapshot toSnapshot(final Map<String, Object> raw, final Instant fallbackCapturedAt) {
        if (raw == null || raw.isEmpty()) throw new SnapshotValidationException("empty record");

        EntityKind kind = resolveKind(raw);
        String externalId = resolveExternalId(raw, kind);

        Snapshot snapshot = new Snapshot();
        snapshot.setRef(EntityRef.of(kind, externalId));
        snapshot.setDisplayName(text(find(raw, NAME_KEYS)).orElse(externalId));
        snapshot.setCapturedAt(resolveCapturedAt(raw, fallbackCapturedAt));
        snapshot.setViewCount(resolveViewCount(raw));
        snapshot.setLikes(optionalCount(raw, LIKE_KEYS));
        snapshot.setShares(optionalCount(raw, SHARE_KEYS));
        snapshot.setVideoCount(optionalCount(raw, VIDEO_KEYS));
        return snapshot;
    }

    // ---- Helpers ----

    private EntityKind resolveKind(final Map<String, Object> raw) {
        for (String key : KIND_KEYS) {
            Optional<EntityKind> kind = text(raw.get(key)).flatMap(EntityKind::fromLabel);
            if (kind.isPresent()) return kind.get();
        }

        // the fetchers emit kind-specific id fields when no explicit kind is given
        if (raw.containsKey("musicId") || raw.containsKey("music_id")) return EntityKind.SOUND;
        if (raw.containsKey("tag") || raw.containsKey("hashtag")) return EntityKind.HASHTAG;
        if (raw.containsKey("username") || raw.containsKey("uniqueId")) return EntityKind.CREATOR;

        throw new SnapshotValidationException("cannot determine entity kind");
    }

    private String resolveExternalId(final Map<String, Object> raw, final EntityKind kind) {
        Optional<String> id = text(find(raw, ID_KEYS));
        if (id.isEmpty()) {
            id = switch (kind) {
                case SOUND -> text(find(raw, "musicId", "music_id"));
                case HASHTAG -> text(find(raw, "tag", "hashtag"));
                case CREATOR -> text(find(raw, "username", "uniqueId"));
            };
        }
        String value = id.orElseThrow(() -> new SnapshotValidationException("missing " + kind.name().toLowerCase(Locale.ROOT) + " identifier"));

        return switch (kind) {
            case HASHTAG -> stripPrefix(value, '#').toLowerCase(Locale.ROOT);
            case CREATOR -> stripPrefix(value, '@');
            case SOUND -> value;
        };
    }

    private long resolveViewCount(final Map<String, Object> raw) {
        Object value = find(raw, VIEW_KEYS);
        if (value == null) throw new SnapshotValidationException("missing view_count");
        long views = parseCount(value, "view_count");
        if (views < 0) throw new SnapshotValidationException("negative view_count " + views);
        return views;
    }

    private Long optionalCount(final Map<String, Object> raw, final String... keys) {
        Object value = find(raw, keys);
        if (value == null) return null;
        try {
            long count = parseCount(value, keys[0]);
            return count < 0 ? null : count;
        } catch (SnapshotValidationException e) {
            log.debug("Ignoring secondary metric {}: {}", keys[0], e.getMessage());
            return null;
        }
    }

    private Instant resolveCapturedAt(final Map<String, Object> raw, final Instant fallback) {
        Object value = find(raw, CAPTURED_AT_KEYS);
        if (value == null) {
            if (fallback == null) throw new SnapshotValidationException("missing captured_at");
            return fallback;
        }
        if (value instanceof Number n) return fromEpoch(parseCount(n, "captured_at"));

        String s = value.toString().trim();
        if (s.matches("\\d+")) return fromEpoch(parseCount(s, "captured_at"));
        try {
            // offset-less timestamps are read as UTC, the fetchers' clock
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            return parsed instanceof OffsetDateTime odt ? odt.toInstant() : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new SnapshotValidationException("unparseable captured_at '" + s + "'");
        }
    }

    private static Instant fromEpoch(final long value) {
        return value > EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
    }

    private static long parseCount(final Object value, final String field) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        String s = value instanceof Number ? value.toString() : String.valueOf(value).trim();
        try {
            // BigDecimal accepts "1.0E6" and "1500.0" but rejects fractions through longValueExact
            return new BigDecimal(s).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new SnapshotValidationException("non-numeric " + field + " '" + value + "'");
        }
    }

    /**
     * First non-null value among the keys, looking at the record itself and then at its "stats" map.
     */
    @SuppressWarnings("unchecked")
    private static Object find(final Map<String, Object> raw, final String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null) return value;
        }
        if (raw.get("stats") instanceof Map<?, ?> stats) {
            for (String key : keys) {
                Object value = ((Map<String, Object>) stats).get(key);
                if (value != null) return value;
            }
        }
        return null;
    }

    private static Optional<String> text(final Object value) {
        if (value == null || value instanceof Map<?, ?> || value instanceof List<?>) return Optional.empty();
        String s = value.toString().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    private static String stripPrefix(final String value, final char prefix) {
        String stripped = value.charAt(0) == prefix ? value.substring(1).trim() : value;
        if (stripped.isEmpty()) throw new SnapshotValidationException("blank identifier '" + value + "'");
        return stripped;
    }
}
