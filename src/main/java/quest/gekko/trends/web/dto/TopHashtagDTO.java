package quest.gekko.trends.web.dto;

/**
 * A hashtag ranked by its 24h growth rate.
 */
public record TopHashtagDTO(String tag, String displayName, double growth24h, long viewCount) {
}
