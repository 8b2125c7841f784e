package engine;

import common.consts.StateChangeEnum;
import engine.build.DomainBuilder;
import engine.classify.EventClassifier;
import engine.decode.RawDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.bo.DecodeWarning;
import model.bo.DecodeWarnings;
import model.bo.DomainGraph;
import model.entity.Event;
import model.entity.Log;
import model.entity.payload.StateChangeDetail;
import model.entity.payload.StateChangePayload;
import model.raw.RawEvtc;
import model.raw.RawHeader;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 解析流水线：结构解码 -> 身份解析 -> 事件分类
 * 各阶段只向后传递数据；告警收集器每次调用新建，可被多个线程同时调用
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EvtcProcessor {

    private final RawDecoder rawDecoder;
    private final DomainBuilder domainBuilder;
    private final EventClassifier eventClassifier;

    public Log process(byte[] data) {
        DecodeWarnings warnings = new DecodeWarnings();
        RawEvtc raw = rawDecoder.decode(data, warnings);
        DomainGraph graph = domainBuilder.build(raw, warnings);
        List<Event> events = eventClassifier.classify(graph.getRawEvents(), warnings);

        RawHeader header = raw.getHeader();
        List<DecodeWarning> warningList = warnings.toList();
        Log combatLog = new Log(header.getArcdpsBuild(), header.getRevision(), header.getContentId(),
                findGameBuild(events), graph.getAgents(), graph.getSkills(), events, warningList);

        log.info("日志解析完成: build={}, revision={}, contentId={}, 参与者={}, 技能={}, 事件={}, 告警={}",
                combatLog.getArcdpsBuild(), combatLog.getRevision(), combatLog.getContentId(),
                combatLog.getAgents().size(), combatLog.getSkills().size(), events.size(), warningList.size());
        if (log.isDebugEnabled()) {
            for (DecodeWarning warning : warningList) {
                log.debug("解析告警 [{}] x{}: {}", warning.getType(), warning.getCount(), warning.getMessage());
            }
        }
        return combatLog;
    }

    /** 取第一个游戏版本标记，没有则为 0 */
    static long findGameBuild(List<Event> events) {
        for (Event event : events) {
            if (event.getPayload() instanceof StateChangePayload payload
                    && payload.getStateChange() == StateChangeEnum.GW_BUILD
                    && payload.getDetail() instanceof StateChangeDetail.Numeric numeric) {
                return numeric.getValue();
            }
        }
        return 0;
    }
}
