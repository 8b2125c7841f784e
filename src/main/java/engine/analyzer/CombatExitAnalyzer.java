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
 * 首领不会死亡的战斗 (Xera、Qadim)：玩家晚于首领脱战才算胜利
 */
@Component
public class CombatExitAnalyzer extends AbstractEncounterAnalyzer<EncounterTracker> {

    private static final Set<EncounterEnum> ENCOUNTERS =
            Collections.unmodifiableSet(EnumSet.of(EncounterEnum.XERA, EncounterEnum.QADIM));

    public CombatExitAnalyzer(TriggerCatalog catalog, AnalyzerConfig config) {
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
        return tracker.playersExitAfterBoss(config.getExitSafetyMarginMs());
    }
}
