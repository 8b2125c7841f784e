package model.bo;

import common.consts.ChallengeStatusEnum;
import common.consts.EncounterEnum;
import common.consts.OutcomeEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * 单份日志的分析结论
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class AnalysisResult {
    // 无法识别战斗时为 null
    private final EncounterEnum encounter;
    private final OutcomeEnum outcome;
    // 战斗没有挑战模式时为 null
    private final ChallengeStatusEnum challengeStatus;

    public Optional<ChallengeStatusEnum> challenge() {
        return Optional.ofNullable(challengeStatus);
    }
}
