package engine.analyzer;

import common.config.AnalyzerConfig;
import common.consts.EncounterEnum;
import model.bo.EncounterTrigger;
import model.entity.Agent;
import model.entity.Event;
import model.entity.Gadget;
import model.entity.Log;
import model.entity.payload.StateChangeDetail;
import model.entity.payload.StateChangePayload;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Deimos：10% 时首领变为名为 "Deimos" 的装置，胜利后该装置的攻击目标变为不可选中
 * 先确认进入了 10% 阶段，再比较玩家脱战时间与攻击目标不可选中的时间
 */
@Component
public class DeimosAnalyzer extends AbstractEncounterAnalyzer<DeimosAnalyzer.DeimosTracker> {

    static final String SPLIT_GADGET_NAME = "Deimos";

    private static final Set<EncounterEnum> ENCOUNTERS =
            Collections.unmodifiableSet(EnumSet.of(EncounterEnum.DEIMOS));

    public DeimosAnalyzer(TriggerCatalog catalog, AnalyzerConfig config) {
        super(catalog, config);
    }

    @Override
    public Set<EncounterEnum> getEncounters() {
        return ENCOUNTERS;
    }

    @Override
    protected DeimosTracker newTracker(Log log, EncounterEnum encounter, EncounterTrigger trigger) {
        return new DeimosTracker(log, encounter, trigger);
    }

    @Override
    protected boolean isVictory(DeimosTracker tracker) {
        if (tracker.splitTime == 0 || tracker.attackTargetAddr == null) {
            return false;
        }
        long untargetable = tracker.untargetableAt.getOrDefault(tracker.attackTargetAddr, 0L);
        return tracker.getLastPlayerExit() > untargetable + config.getExitSafetyMarginMs();
    }

    static class DeimosTracker extends EncounterTracker {
        // 最后一次有对象变为可选中的时间
        private long splitTime;
        // 父对象为 Deimos 装置的最后一个攻击目标
        private Long attackTargetAddr;
        private final Map<Long, Long> untargetableAt = new HashMap<>();

        DeimosTracker(Log log, EncounterEnum encounter, EncounterTrigger trigger) {
            super(log, encounter, trigger);
        }

        @Override
        protected void onStateChange(Event event, StateChangePayload payload) {
            switch (payload.getStateChange()) {
                case TARGETABLE:
                    if (((StateChangeDetail.Targetable) payload.getDetail()).isTargetable()) {
                        splitTime = event.getTime();
                    } else {
                        untargetableAt.merge(payload.getAgentAddr(), event.getTime(), Math::max);
                    }
                    break;
                case ATTACK_TARGET:
                    StateChangeDetail.AttackTarget detail = (StateChangeDetail.AttackTarget) payload.getDetail();
                    Agent parent = log.findAgent(detail.getParentAddr());
                    if (parent != null && parent.getKind() instanceof Gadget gadget
                            && SPLIT_GADGET_NAME.equals(gadget.getName())) {
                        attackTargetAddr = payload.getAgentAddr();
                    }
                    break;
                default:
                    break;
            }
        }
    }
}
