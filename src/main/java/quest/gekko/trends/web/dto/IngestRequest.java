package quest.gekko.trends.web.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One scraped batch. {@code capturedAt} is used for records without their own timestamp;
 * when absent the server clock is used.
 */
public record IngestRequest(Instant capturedAt, List<Map<String, Object>> records) {
}
