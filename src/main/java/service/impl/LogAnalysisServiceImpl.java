package service.impl;

import common.consts.ErrorCodes;
import common.consts.StateChangeEnum;
import common.exception.BusinessException;
import common.util.TimeUtil;
import engine.EvtcProcessor;
import engine.analyzer.AnalyzerEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.bo.AnalysisResult;
import model.dto.response.AnalyzeResp;
import model.dto.response.PlayerSummaryDto;
import model.entity.Agent;
import model.entity.Event;
import model.entity.Log;
import model.entity.Player;
import model.entity.payload.StateChangeDetail;
import model.entity.payload.StateChangePayload;
import org.springframework.stereotype.Service;
import service.LogAnalysisService;
import service.source.LogByteSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class LogAnalysisServiceImpl implements LogAnalysisService {

    private final LogByteSource byteSource;
    private final EvtcProcessor processor;
    private final AnalyzerEngine analyzerEngine;

    @Override
    public AnalyzeResp analyze(String fileName, InputStream input) {
        Log combatLog = parse(input);
        AnalysisResult result = analyzerEngine.analyze(combatLog);
        log.info("日志 {} 分析完成: 战斗={}, 结果={}, 挑战模式={}", fileName,
                result.getEncounter(), result.getOutcome(), result.getChallengeStatus());
        return toResp(fileName, combatLog, result);
    }

    @Override
    public Log parse(InputStream input) {
        byte[] data;
        try {
            data = byteSource.read(input);
        } catch (IOException e) {
            throw new UncheckedIOException(ErrorCodes.READ_FAILED, e);
        }
        if (data.length == 0) {
            throw new BusinessException(ErrorCodes.EMPTY_UPLOAD);
        }
        return processor.process(data);
    }

    static AnalyzeResp toResp(String fileName, Log combatLog, AnalysisResult result) {
        AnalyzeResp resp = new AnalyzeResp();
        resp.setFileName(fileName);
        resp.setArcdpsBuild(combatLog.getArcdpsBuild());
        resp.setRevision(combatLog.getRevision());
        resp.setContentId(combatLog.getContentId());
        resp.setGameBuild(combatLog.getGameBuild());
        if (result.getEncounter() != null) {
            resp.setEncounter(result.getEncounter());
            resp.setEncounterName(result.getEncounter().getDesc());
        }
        resp.setOutcome(result.getOutcome());
        resp.setChallengeStatus(result.getChallengeStatus());

        List<Event> events = combatLog.getEvents();
        for (Event event : events) {
            if (event.getPayload() instanceof StateChangePayload payload
                    && payload.getStateChange() == StateChangeEnum.LOG_START) {
                long server = ((StateChangeDetail.Timestamps) payload.getDetail()).getServerTimestamp();
                resp.setLogStart(TimeUtil.fromServerSeconds(server));
                break;
            }
        }
        if (!events.isEmpty()) {
            long span = events.get(events.size() - 1).getTime() - events.get(0).getTime();
            resp.setDuration(TimeUtil.formatDuration(span));
        }

        List<PlayerSummaryDto> players = new ArrayList<>();
        for (Agent agent : combatLog.players()) {
            Player player = (Player) agent.getKind();
            PlayerSummaryDto dto = new PlayerSummaryDto();
            dto.setCharacterName(player.getCharacterName());
            dto.setAccountName(player.getAccountName());
            dto.setSubgroup(player.getSubgroup());
            if (player.getProfession() != null) {
                dto.setProfession(player.getProfession().getDesc());
            }
            if (player.getEliteSpec() != null) {
                dto.setEliteSpec(player.getEliteSpec().getDesc());
            }
            players.add(dto);
        }
        resp.setPlayers(players);
        resp.setAgentCount(combatLog.getAgents().size());
        resp.setSkillCount(combatLog.getSkills().size());
        resp.setEventCount(events.size());
        resp.setWarnings(combatLog.getWarnings());
        return resp;
    }
}
