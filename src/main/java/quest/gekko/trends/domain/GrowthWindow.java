package quest.gekko.trends.domain;

import java.time.Duration;

public enum GrowthWindow {
    H1("1h", Duration.ofHours(1)),
    H6("6h", Duration.ofHours(6)),
    H24("24h", Duration.ofHours(24));

    private final String label;
    private final Duration duration;

    GrowthWindow(final String label, final Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public String label() { return label; }

    public Duration duration() { return duration; }
}
