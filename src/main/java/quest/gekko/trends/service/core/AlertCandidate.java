package quest.gekko.trends.service.core;

import quest.gekko.trends.domain.AlertPriority;
import quest.gekko.trends.domain.GrowthWindow;

public record AlertCandidate(AlertPriority priority, GrowthWindow triggerWindow, double triggerRate) {
}
