package engine.analyzer;

import common.consts.ChallengeStatusEnum;
import common.consts.OutcomeEnum;
import model.bo.EncounterTrigger;

import java.util.ArrayList;
import java.util.List;

/**
 * 挑战模式判定，与胜负判定相互独立
 * 规则全部来自触发条件表；条件从未出现时返回 UNKNOWN，不做猜测
 */
public final class ChallengeEvaluator {

    private ChallengeEvaluator() {}

    /**
     * @return 战斗没有挑战模式规则时返回 null
     */
    public static ChallengeStatusEnum evaluate(EncounterTrigger trigger, EncounterTracker tracker,
                                               OutcomeEnum outcome, long duplicateWindowMs) {
        if (trigger == null || !trigger.hasChallengeRule()) {
            return null;
        }
        if (trigger.isAlwaysChallenge()) {
            return ChallengeStatusEnum.ACTIVE;
        }
        List<ChallengeStatusEnum> verdicts = new ArrayList<>();
        if (trigger.getChallengeHealth() != null) {
            verdicts.add(byHealth(trigger.getChallengeHealth(), tracker.getBossMaxHealth()));
        }
        if (trigger.getChallengeBuff() != null) {
            if (trigger.getChallengeBuffIntervalMs() != null) {
                long gap = minBuffGap(tracker, duplicateWindowMs);
                verdicts.add(byInterval(trigger.getChallengeBuffIntervalMs(), gap));
            } else {
                verdicts.add(byPresence(!tracker.getChallengeBuffTimes().isEmpty(), outcome));
            }
        }
        if (!trigger.getChallengeSpecies().isEmpty()) {
            verdicts.add(byPresence(tracker.isChallengeSpeciesPresent(), outcome));
        }
        return combine(verdicts);
    }

    static ChallengeStatusEnum byHealth(long threshold, Long maxHealth) {
        if (maxHealth == null) {
            return ChallengeStatusEnum.UNKNOWN;
        }
        return maxHealth >= threshold ? ChallengeStatusEnum.ACTIVE : ChallengeStatusEnum.INACTIVE;
    }

    /**
     * 出现即开启；未出现只有在战斗已分出结果时才能判为未开启
     */
    static ChallengeStatusEnum byPresence(boolean present, OutcomeEnum outcome) {
        if (present) {
            return ChallengeStatusEnum.ACTIVE;
        }
        return outcome.isDecided() ? ChallengeStatusEnum.INACTIVE : ChallengeStatusEnum.UNKNOWN;
    }

    static ChallengeStatusEnum byInterval(long thresholdMs, long gapMs) {
        if (gapMs <= 0) {
            return ChallengeStatusEnum.UNKNOWN;
        }
        return gapMs <= thresholdMs ? ChallengeStatusEnum.ACTIVE : ChallengeStatusEnum.INACTIVE;
    }

    /**
     * 取施加次数最多的目标，计算相邻两次施加的最小间隔；过近的视为重复记录
     * 不足两次有效施加时返回 0
     */
    static long minBuffGap(EncounterTracker tracker, long duplicateWindowMs) {
        List<Long> timestamps = null;
        for (List<Long> times : tracker.getChallengeBuffTimes().values()) {
            if (timestamps == null || times.size() > timestamps.size()) {
                timestamps = times;
            }
        }
        if (timestamps == null) {
            return 0;
        }
        long min = 0;
        for (int i = 1; i < timestamps.size(); i++) {
            long gap = timestamps.get(i) - timestamps.get(i - 1);
            if (gap > duplicateWindowMs && (min == 0 || gap < min)) {
                min = gap;
            }
        }
        return min;
    }

    /**
     * 任一规则开启即开启；全部规则都判为未开启才是未开启
     */
    static ChallengeStatusEnum combine(List<ChallengeStatusEnum> verdicts) {
        boolean allInactive = !verdicts.isEmpty();
        for (ChallengeStatusEnum verdict : verdicts) {
            if (verdict == ChallengeStatusEnum.ACTIVE) {
                return ChallengeStatusEnum.ACTIVE;
            }
            if (verdict != ChallengeStatusEnum.INACTIVE) {
                allInactive = false;
            }
        }
        return allInactive ? ChallengeStatusEnum.INACTIVE : ChallengeStatusEnum.UNKNOWN;
    }
}
