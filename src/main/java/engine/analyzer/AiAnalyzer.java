package engine.analyzer;

import common.config.AnalyzerConfig;
import common.consts.EncounterEnum;
import model.bo.EncounterTrigger;
import model.entity.Event;
import model.entity.Log;
import model.entity.payload.ActivationPayload;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Ai：首领在 1% 时获得无敌而不是死亡
 * 只有存在黑暗阶段的日志才可能胜利，且无敌必须出现在黑暗阶段开始之后
 */
@Component
public class AiAnalyzer extends AbstractEncounterAnalyzer<AiAnalyzer.AiTracker> {

    private static final Set<EncounterEnum> ENCOUNTERS = Collections.unmodifiableSet(EnumSet.of(EncounterEnum.AI));

    public AiAnalyzer(TriggerCatalog catalog, AnalyzerConfig config) {
        super(catalog, config);
    }

    @Override
    public Set<EncounterEnum> getEncounters() {
        return ENCOUNTERS;
    }

    @Override
    protected AiTracker newTracker(Log log, EncounterEnum encounter, EncounterTrigger trigger) {
        return new AiTracker(log, encounter, trigger);
    }

    @Override
    protected boolean isVictory(AiTracker tracker) {
        if (!tracker.darkMode) {
            return false;
        }
        // 整份日志都在黑暗阶段时起点为 0
        for (Long time : tracker.getVictoryBuffTimes()) {
            if (time >= tracker.darkPhaseStart) {
                return true;
            }
        }
        return false;
    }

    static class AiTracker extends EncounterTracker {
        private boolean darkMode;
        private long darkPhaseStart;

        AiTracker(Log log, EncounterEnum encounter, EncounterTrigger trigger) {
            super(log, encounter, trigger);
        }

        @Override
        protected void onActivation(Event event, ActivationPayload payload) {
            Long darkModeSkill = trigger.getDarkModeSkill();
            Long phaseSkill = trigger.getPhaseSkill();
            if (darkModeSkill != null && darkModeSkill == payload.getSkillId()) {
                darkMode = true;
            }
            if (phaseSkill != null && phaseSkill == payload.getSkillId()) {
                darkPhaseStart = event.getTime();
            }
        }
    }
}
