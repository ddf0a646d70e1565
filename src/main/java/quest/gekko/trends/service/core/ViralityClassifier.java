package quest.gekko.trends.service.core;

import org.springframework.stereotype.Component;
import quest.gekko.trends.domain.ViralityStage;

import java.util.List;
import java.util.function.Predicate;

/**
 * Maps (view count, growth rates) to a virality stage through an ordered rule list; the first
 * matching rule wins. Stateless: equal inputs always give the same stage.
 */
@Component
public class ViralityClassifier {

    public ViralityStage classify(final ClassificationInput input, final ClassifierThresholds thresholds) {
        return decide(input, thresholds).stage();
    }

    /**
     * Name of the rule that decides the stage, for logging.
     */
    public String decidingRule(final ClassificationInput input, final ClassifierThresholds thresholds) {
        return decide(input, thresholds).name();
    }

    private Rule decide(final ClassificationInput input, final ClassifierThresholds thresholds) {
        List<Rule> rules = rules(thresholds);
        return rules.stream()
                .filter(rule -> rule.guard().test(input))
                .findFirst()
                .orElse(rules.get(rules.size() - 1));
    }

    List<Rule> rules(final ClassifierThresholds t) {
        return List.of(
                new Rule("single-snapshot", in -> !in.hasHistory(), ViralityStage.NEW),
                new Rule("massive-floor", in -> in.viewCount() >= t.massiveFloor(), ViralityStage.MASSIVE),
                // high growth also qualifies, so an entity crossing the floor within hours keeps rising
                new Rule("steady-growth",
                        in -> in.viewCount() >= t.steadyFloor() && in.viewCount() < t.massiveFloor()
                                && (in.rates().meetsAny(t.moderateGrowth()) || in.rates().meetsAny(t.highGrowth())),
                        ViralityStage.STEADY),
                new Rule("early-traction-high-growth",
                        in -> in.viewCount() >= t.earlyTractionFloor() && in.viewCount() < t.steadyFloor()
                                && in.rates().meetsAny(t.highGrowth()),
                        ViralityStage.EARLY_TRACTION),
                // stagnant counts in any bracket below the floor fall back here
                new Rule("default-new", in -> true, ViralityStage.NEW)
        );
    }

    record Rule(String name, Predicate<ClassificationInput> guard, ViralityStage stage) {}
}
