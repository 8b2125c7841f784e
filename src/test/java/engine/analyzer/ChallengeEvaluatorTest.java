package engine.analyzer;

import common.consts.ChallengeStatusEnum;
import common.consts.OutcomeEnum;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("挑战模式规则测试")
class ChallengeEvaluatorTest {

    @Test
    @DisplayName("血量规则")
    void testByHealth() {
        assertEquals(ChallengeStatusEnum.ACTIVE, ChallengeEvaluator.byHealth(100, 100L));
        assertEquals(ChallengeStatusEnum.INACTIVE, ChallengeEvaluator.byHealth(100, 99L));
        assertEquals(ChallengeStatusEnum.UNKNOWN, ChallengeEvaluator.byHealth(100, null));
    }

    @Test
    @DisplayName("出现规则只有在胜负已定时才判为未开启")
    void testByPresence() {
        assertEquals(ChallengeStatusEnum.ACTIVE, ChallengeEvaluator.byPresence(true, OutcomeEnum.UNKNOWN));
        assertEquals(ChallengeStatusEnum.INACTIVE, ChallengeEvaluator.byPresence(false, OutcomeEnum.SUCCESS));
        assertEquals(ChallengeStatusEnum.INACTIVE, ChallengeEvaluator.byPresence(false, OutcomeEnum.FAILURE));
        assertEquals(ChallengeStatusEnum.UNKNOWN, ChallengeEvaluator.byPresence(false, OutcomeEnum.UNKNOWN));
    }

    @Test
    @DisplayName("间隔规则：阈值包含在内，没有有效间隔无法判定")
    void testByInterval() {
        assertEquals(ChallengeStatusEnum.ACTIVE, ChallengeEvaluator.byInterval(11000, 11000));
        assertEquals(ChallengeStatusEnum.INACTIVE, ChallengeEvaluator.byInterval(11000, 11001));
        assertEquals(ChallengeStatusEnum.UNKNOWN, ChallengeEvaluator.byInterval(11000, 0));
    }

    @Test
    @DisplayName("多条规则合并")
    void testCombine() {
        assertEquals(ChallengeStatusEnum.ACTIVE, ChallengeEvaluator.combine(
                List.of(ChallengeStatusEnum.UNKNOWN, ChallengeStatusEnum.ACTIVE)));
        assertEquals(ChallengeStatusEnum.INACTIVE, ChallengeEvaluator.combine(
                List.of(ChallengeStatusEnum.INACTIVE, ChallengeStatusEnum.INACTIVE)));
        assertEquals(ChallengeStatusEnum.UNKNOWN, ChallengeEvaluator.combine(
                List.of(ChallengeStatusEnum.INACTIVE, ChallengeStatusEnum.UNKNOWN)));
        assertEquals(ChallengeStatusEnum.UNKNOWN, ChallengeEvaluator.combine(Collections.emptyList()));
    }
}
