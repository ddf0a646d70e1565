package quest.gekko.trends.service.core;

import org.junit.jupiter.api.Test;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.EntityRef;
import quest.gekko.trends.domain.Snapshot;
import quest.gekko.trends.exception.SnapshotValidationException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static quest.gekko.trends.support.Records.T0;

class SnapshotNormalizerTest {

    private final SnapshotNormalizer normalizer = new SnapshotNormalizer();

    @Test
    void readsTikTokMusicRecordWithNestedStats() {
        Map<String, Object> raw = Map.of(
                "musicId", "7123",
                "title", "original sound",
                "stats", Map.of("playCount", 120_000, "diggCount", "3400", "shareCount", 55),
                "timestamp", 1_772_323_200L);

        Snapshot snapshot = normalizer.toSnapshot(raw, T0);

        assertThat(snapshot.getRef()).isEqualTo(EntityRef.of(EntityKind.SOUND, "7123"));
        assertThat(snapshot.getDisplayName()).isEqualTo("original sound");
        assertThat(snapshot.getViewCount()).isEqualTo(120_000);
        assertThat(snapshot.getLikes()).isEqualTo(3_400L);
        assertThat(snapshot.getShares()).isEqualTo(55L);
        assertThat(snapshot.getCapturedAt()).isEqualTo(Instant.ofEpochSecond(1_772_323_200L));
    }

    @Test
    void hashtagIdentifiersAreCaseFoldedWithoutHash() {
        Snapshot snapshot = normalizer.toSnapshot(Map.of("tag", "#DanceChallenge", "usage_count", "9000"), T0);

        assertThat(snapshot.getRef()).isEqualTo(EntityRef.of(EntityKind.HASHTAG, "dancechallenge"));
        assertThat(snapshot.getViewCount()).isEqualTo(9_000);
        assertThat(snapshot.getCapturedAt()).isEqualTo(T0);
    }

    @Test
    void creatorIdentifiersLoseLeadingAt() {
        Snapshot snapshot = normalizer.toSnapshot(
                Map.of("type", "user", "username", "@dancer", "display_name", "Dancer", "total_likes", 10, "view_count", 1), T0);

        assertThat(snapshot.getRef()).isEqualTo(EntityRef.of(EntityKind.CREATOR, "dancer"));
        assertThat(snapshot.getDisplayName()).isEqualTo("Dancer");
        assertThat(snapshot.getLikes()).isEqualTo(10L);
    }

    @Test
    void acceptsIsoLocalAndEpochMillisTimestamps() {
        Snapshot local = normalizer.toSnapshot(Map.of("kind", "sound", "id", "a", "view_count", 1,
                "captured_at", "2026-03-01T00:00:00"), null);
        Snapshot millis = normalizer.toSnapshot(Map.of("kind", "sound", "id", "a", "view_count", 1,
                "captured_at", T0.toEpochMilli()), null);

        assertThat(local.getCapturedAt()).isEqualTo(T0);
        assertThat(millis.getCapturedAt()).isEqualTo(T0);
    }

    @Test
    void rejectsUnusableViewCounts() {
        assertThatThrownBy(() -> normalizer.toSnapshot(Map.of("kind", "sound", "id", "a"), T0))
                .isInstanceOf(SnapshotValidationException.class)
                .hasMessageContaining("missing view_count");
        assertThatThrownBy(() -> normalizer.toSnapshot(Map.of("kind", "sound", "id", "a", "view_count", "lots"), T0))
                .isInstanceOf(SnapshotValidationException.class);
        assertThatThrownBy(() -> normalizer.toSnapshot(Map.of("kind", "sound", "id", "a", "view_count", -5), T0))
                .isInstanceOf(SnapshotValidationException.class)
                .hasMessageContaining("negative");
        assertThatThrownBy(() -> normalizer.toSnapshot(Map.of("kind", "sound", "id", "a", "view_count", 10.5), T0))
                .isInstanceOf(SnapshotValidationException.class);
    }

    @Test
    void rejectsRecordsWithoutKindOrIdentifier() {
        assertThatThrownBy(() -> normalizer.toSnapshot(Map.of("id", "a", "view_count", 1), T0))
                .isInstanceOf(SnapshotValidationException.class)
                .hasMessageContaining("kind");
        assertThatThrownBy(() -> normalizer.toSnapshot(Map.of("kind", "sound", "view_count", 1), T0))
                .isInstanceOf(SnapshotValidationException.class)
                .hasMessageContaining("identifier");
    }

    @Test
    void invalidSecondaryMetricIsDroppedNotRejected() {
        Snapshot snapshot = normalizer.toSnapshot(Map.of("kind", "sound", "id", "a", "view_count", 1, "likes", "n/a"), T0);

        assertThat(snapshot.getLikes()).isNull();
    }

    @Test
    void keepsLatestCapturePerEntityAndReportsRejections() {
        Map<String, Object> broken = new HashMap<>();
        broken.put("kind", "sound");
        broken.put("id", "x");

        NormalizationResult result = normalizer.normalize(List.of(
                record("a", 10, T0.plusSeconds(60)),
                record("b", 20, T0),
                broken,
                record("a", 5, T0),
                record("b", 25, T0)), T0);

        assertThat(result.snapshots()).extracting(s -> s.getRef().getExternalId()).containsExactly("a", "b");
        assertThat(result.snapshots()).extracting(Snapshot::getViewCount).containsExactly(10L, 25L);
        assertThat(result.rejected()).extracting(NormalizationResult.RejectedRecord::index).containsExactly(2);
    }

    private static Map<String, Object> record(final String id, final long views, final Instant at) {
        return Map.of("kind", "sound", "id", id, "view_count", views, "captured_at", at.toString());
    }
}
