package quest.gekko.trends.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;
import quest.gekko.trends.service.core.CycleReport;
import quest.gekko.trends.service.core.TrendEngine;
import quest.gekko.trends.service.notification.DeliveryOutcome;
import quest.gekko.trends.service.notification.NotificationDispatcher;
import quest.gekko.trends.service.query.TrendQueryService;
import quest.gekko.trends.web.dto.IngestRequest;

@Controller
@RequestMapping("/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Slf4j
public class AdminController {
    private final TrendEngine engine;
    private final TrendQueryService queries;
    private final NotificationDispatcher notifications;

    // Runs one cycle over a scraped batch; the external scheduler calls this
    @PostMapping("/ingest")
    @ResponseBody
    public CycleReport ingest(@RequestBody IngestRequest request) {
        if (request.records() == null) throw new IllegalArgumentException("records is required");
        log.info("Ingest requested: {} records captured at {}", request.records().size(), request.capturedAt());
        return engine.runCycle(request.records(), request.capturedAt());
    }

    // Pushes the current dashboard summary to every enabled channel
    @PostMapping("/summary")
    @ResponseBody
    public DeliveryOutcome pushSummary() {
        log.info("Summary push requested");
        return notifications.dispatchSummary(queries.summary());
    }
}
