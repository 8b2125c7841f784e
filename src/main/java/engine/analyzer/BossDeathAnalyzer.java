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
 * 首领死亡即胜利的战斗：大部分团队副本、训练场、攻坚任务与碎层挑战
 * 双子这类需要全部首领死亡的战斗由 victoryRequiresAllBosses 控制
 * 首领全部离开视野而未死亡视为团灭重置
 */
@Component
public class BossDeathAnalyzer extends AbstractEncounterAnalyzer<EncounterTracker> {

    private static final Set<EncounterEnum> ENCOUNTERS = Collections.unmodifiableSet(EnumSet.of(
            EncounterEnum.VALE_GUARDIAN, EncounterEnum.GORSEVAL, EncounterEnum.SABETHA,
            EncounterEnum.SLOTHASOR, EncounterEnum.MATTHIAS, EncounterEnum.KEEP_CONSTRUCT,
            EncounterEnum.CAIRN, EncounterEnum.MURSAAT_OVERSEER, EncounterEnum.SAMAROG,
            EncounterEnum.VOICE_IN_THE_VOID, EncounterEnum.TWIN_LARGOS,
            EncounterEnum.CARDINAL_ADINA, EncounterEnum.CARDINAL_SABIR, EncounterEnum.QADIM_THE_PEERLESS,
            EncounterEnum.STANDARD_KITTY_GOLEM, EncounterEnum.MEDIUM_KITTY_GOLEM, EncounterEnum.LARGE_KITTY_GOLEM,
            EncounterEnum.SKORVALD, EncounterEnum.ARTSARIIV, EncounterEnum.ARKK,
            EncounterEnum.MAMA, EncounterEnum.SIAX, EncounterEnum.ENSOLYSS,
            EncounterEnum.ICEBROOD_CONSTRUCT, EncounterEnum.SUPER_KODAN_BROTHERS, EncounterEnum.FRAENIR_OF_JORMAG,
            EncounterEnum.BONESKINNER, EncounterEnum.WHISPER_OF_JORMAG));

    public BossDeathAnalyzer(TriggerCatalog catalog, AnalyzerConfig config) {
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
        if (tracker.getTrigger().isVictoryRequiresAllBosses()) {
            return tracker.allBossesDead();
        }
        return tracker.anyBossDead();
    }

    @Override
    protected boolean isDefeat(EncounterTracker tracker) {
        return tracker.isLogEnded() || tracker.allBossesGone();
    }
}
