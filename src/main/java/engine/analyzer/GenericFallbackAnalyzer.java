package engine.analyzer;

import common.consts.ChallengeStatusEnum;
import common.consts.EncounterEnum;
import common.consts.OutcomeEnum;
import model.bo.AnalysisResult;
import model.entity.Log;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Set;

/**
 * 无法识别的战斗统一走这里，结论总是 UNKNOWN
 */
@Component
public class GenericFallbackAnalyzer implements EncounterAnalyzer {

    @Override
    public Set<EncounterEnum> getEncounters() {
        return Collections.emptySet();
    }

    @Override
    public AnalysisResult analyze(Log log, EncounterEnum encounter) {
        return new AnalysisResult(encounter, OutcomeEnum.UNKNOWN, ChallengeStatusEnum.UNKNOWN);
    }
}
