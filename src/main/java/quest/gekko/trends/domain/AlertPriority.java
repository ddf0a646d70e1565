package quest.gekko.trends.domain;

/**
 * Alert tiers, highest first. Each tier is triggered by the growth rate of one window.
 */
public enum AlertPriority {
    HIGH(GrowthWindow.H1),
    MEDIUM(GrowthWindow.H6),
    LOW(GrowthWindow.H24);

    private final GrowthWindow triggerWindow;

    AlertPriority(final GrowthWindow triggerWindow) {
        this.triggerWindow = triggerWindow;
    }

    public GrowthWindow triggerWindow() { return triggerWindow; }
}
