package quest.gekko.trends.service.core;

/**
 * @param hasHistory the entity had a stored snapshot before the current one
 */
public record ClassificationInput(long viewCount, GrowthRates rates, boolean hasHistory) {
}
