package engine.analyzer;

import common.config.AnalyzerConfig;
import common.consts.ChallengeStatusEnum;
import common.consts.EncounterEnum;
import common.consts.OutcomeEnum;
import common.consts.PayloadKindEnum;
import model.bo.AnalysisResult;
import model.bo.EncounterTrigger;
import model.entity.Event;
import model.entity.Log;

/**
 * 分析器骨架：一次有序遍历驱动 tracker，最后统一判定
 * 奖励标记优先于任何战斗特有的胜利条件；没有胜利也没有失败信号时为 UNKNOWN
 */
public abstract class AbstractEncounterAnalyzer<T extends EncounterTracker> implements EncounterAnalyzer {

    protected final TriggerCatalog catalog;
    protected final AnalyzerConfig config;

    protected AbstractEncounterAnalyzer(TriggerCatalog catalog, AnalyzerConfig config) {
        this.catalog = catalog;
        this.config = config;
    }

    @Override
    public AnalysisResult analyze(Log log, EncounterEnum encounter) {
        EncounterTrigger trigger = catalog.get(encounter);
        T tracker = newTracker(log, encounter, trigger);
        for (Event event : log.getEvents()) {
            // 未识别事件不参与触发匹配
            if (event.getPayload().getKind() != PayloadKindEnum.UNKNOWN) {
                tracker.observe(event);
            }
        }
        OutcomeEnum outcome = decideOutcome(tracker);
        ChallengeStatusEnum challenge = ChallengeEvaluator.evaluate(trigger, tracker, outcome,
                config.getDuplicateBuffWindowMs());
        return new AnalysisResult(encounter, outcome, challenge);
    }

    protected OutcomeEnum decideOutcome(T tracker) {
        if (tracker.isRewarded() || isVictory(tracker)) {
            return OutcomeEnum.SUCCESS;
        }
        if (isDefeat(tracker)) {
            return OutcomeEnum.FAILURE;
        }
        return OutcomeEnum.UNKNOWN;
    }

    protected abstract T newTracker(Log log, EncounterEnum encounter, EncounterTrigger trigger);

    protected abstract boolean isVictory(T tracker);

    /**
     * 默认只有日志结束标记才是明确的失败信号
     */
    protected boolean isDefeat(T tracker) {
        return tracker.isLogEnded();
    }
}
