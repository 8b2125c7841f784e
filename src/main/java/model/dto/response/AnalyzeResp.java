package model.dto.response;

import common.consts.ChallengeStatusEnum;
import common.consts.EncounterEnum;
import common.consts.OutcomeEnum;
import lombok.Data;
import model.bo.DecodeWarning;

import java.time.Instant;
import java.util.List;

/**
 * 日志分析接口返回
 */
@Data
public class AnalyzeResp {
    private String fileName;
    private String arcdpsBuild;
    private int revision;
    private int contentId;
    private long gameBuild;

    private EncounterEnum encounter;
    private String encounterName;
    private OutcomeEnum outcome;
    private ChallengeStatusEnum challengeStatus;   // 不适用时不输出

    private Instant logStart;      // 服务器时间
    private String duration;

    private List<PlayerSummaryDto> players;
    private int agentCount;
    private int skillCount;
    private int eventCount;
    private List<DecodeWarning> warnings;
}
