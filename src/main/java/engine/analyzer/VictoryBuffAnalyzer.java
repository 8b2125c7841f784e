package engine.analyzer;

import common.config.AnalyzerConfig;
import common.consts.EncounterEnum;
import model.bo.EncounterTrigger;
import model.entity.Log;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 首领获得特定增益（无敌）即胜利，如 Soulless Horror
 */
@Component
public class VictoryBuffAnalyzer extends AbstractEncounterAnalyzer<EncounterTracker> {

    private static final Set<EncounterEnum> ENCOUNTERS =
            Collections.unmodifiableSet(EnumSet.of(EncounterEnum.SOULLESS_HORROR));

    public VictoryBuffAnalyzer(TriggerCatalog catalog, AnalyzerConfig config) {
        super(catalog, config);
    }

    @Override
    public Set<EncounterEnum> getEncounters() {
        return ENCOUNTERS;
    }

    @Override
    protected EncounterTracker newTracker(Log log, EncounterEnum encounter, EncounterTrigger trigger) {
        return new EncounterTracker(log, encounter, trigger);
    }

    @Override
    protected boolean isVictory(EncounterTracker tracker) {
        return !tracker.getVictoryBuffTimes().isEmpty();
    }

    @Override
    protected boolean isDefeat(EncounterTracker tracker) {
        return tracker.isLogEnded() || tracker.allBossesGone();
    }
}
