package quest.gekko.trends.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.trends.domain.EntityKind;
import quest.gekko.trends.domain.ViralityStage;
import quest.gekko.trends.service.query.TrendQueryService;
import quest.gekko.trends.web.dto.AlertDTO;
import quest.gekko.trends.web.dto.DeliveryDTO;
import quest.gekko.trends.web.dto.EntityHistoryDTO;
import quest.gekko.trends.web.dto.StageMemberDTO;
import quest.gekko.trends.web.dto.TrendSummaryDTO;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TrendController {
    private final TrendQueryService queries;

    @GetMapping("/trends/summary")
    public TrendSummaryDTO summary() {
        return queries.summary();
    }

    @GetMapping("/trends/stage/{stage}")
    public List<StageMemberDTO> byStage(@PathVariable String stage) {
        ViralityStage parsed = ViralityStage.fromLabel(stage)
                .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + stage));
        return queries.byStage(parsed);
    }

    @GetMapping("/trends/{kind}/{externalId}")
    public EntityHistoryDTO history(@PathVariable String kind, @PathVariable String externalId) {
        EntityKind parsed = EntityKind.fromLabel(kind)
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity kind: " + kind));
        return queries.history(parsed, externalId);
    }

    @GetMapping("/alerts/recent")
    public List<AlertDTO> recentAlerts(@RequestParam(defaultValue = "24") int hours) {
        return queries.recentAlerts(hours);
    }

    @GetMapping("/alerts/deliveries")
    public List<DeliveryDTO> recentDeliveries(@RequestParam(defaultValue = "24") int hours) {
        return queries.recentDeliveries(hours);
    }
}
