package engine.build;

import common.consts.DecodeWarningEnum;
import common.consts.StateChangeEnum;
import lombok.extern.slf4j.Slf4j;
import model.bo.DecodeWarnings;
import model.bo.DomainGraph;
import model.entity.Agent;
import model.entity.AwareInterval;
import model.entity.Skill;
import model.raw.RawAgent;
import model.raw.RawEvent;
import model.raw.RawEvtc;
import model.raw.RawSkill;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 从原始记录构建参与者身份：类别、实例号占用区间、主从关系
 * 四个步骤必须按顺序执行，主从解析依赖完整的区间集合
 */
@Component
@Slf4j
public class DomainBuilder {

    public DomainGraph build(RawEvtc raw, DecodeWarnings warnings) {
        Map<Long, AgentDraft> drafts = seedAgents(raw.getAgents(), warnings);
        trackAwareness(drafts, raw.getEvents());
        InstanceIdTimeline timeline = buildTimeline(drafts);
        resolveMasters(drafts, timeline, raw.getEvents());
        collapseMasters(drafts);

        List<Agent> agents = new ArrayList<>(drafts.size());
        for (AgentDraft draft : drafts.values()) {
            agents.add(freeze(draft));
        }
        List<Skill> skills = new ArrayList<>(raw.getSkills().size());
        for (RawSkill skill : raw.getSkills()) {
            skills.add(new Skill(skill.getId(), skill.getName()));
        }
        return new DomainGraph(agents, skills, raw.getEvents());
    }

    /**
     * 第一步：每条参与者记录生成一个草稿，重复地址保留首条
     */
    Map<Long, AgentDraft> seedAgents(List<RawAgent> rawAgents, DecodeWarnings warnings) {
        Map<Long, AgentDraft> drafts = new LinkedHashMap<>();
        for (RawAgent rawAgent : rawAgents) {
            if (drafts.containsKey(rawAgent.getAddr())) {
                warnings.add(DecodeWarningEnum.DUPLICATE_ADDRESS,
                        String.format("地址 0x%X 重复出现", rawAgent.getAddr()));
                continue;
            }
            drafts.put(rawAgent.getAddr(), new AgentDraft(rawAgent,
                    AgentKindResolver.resolve(rawAgent.getProf(), rawAgent.getIsElite(), rawAgent.getName(), warnings)));
        }
        return drafts;
    }

    /**
     * 第二步：非状态变更事件的源参与者记录实例号与出现区间
     * 离开视野的状态变更关闭源参与者的当前区间，其余状态变更不延长区间
     * 地址不在参与者表中的事件忽略
     */
    void trackAwareness(Map<Long, AgentDraft> drafts, List<RawEvent> events) {
        for (RawEvent event : events) {
            if (event.getIsStateChange() == StateChangeEnum.DESPAWN.getCode()) {
                AgentDraft draft = drafts.get(event.getSrcAgent());
                if (draft != null) {
                    draft.leftTracking();
                }
                continue;
            }
            if (event.getIsStateChange() != 0 || event.getSrcInstId() == 0) {
                continue;
            }
            AgentDraft draft = drafts.get(event.getSrcAgent());
            if (draft != null) {
                draft.sighted(event.getSrcInstId(), event.getTime());
            }
        }
    }

    InstanceIdTimeline buildTimeline(Map<Long, AgentDraft> drafts) {
        InstanceIdTimeline timeline = new InstanceIdTimeline();
        for (AgentDraft draft : drafts.values()) {
            for (long[] interval : draft.intervals) {
                timeline.bind(draft.addr(), new AwareInterval((int) interval[0], interval[1], interval[2]));
            }
        }
        return timeline;
    }

    /**
     * 第三步：按事件时间查找持有主人实例号的地址
     * 同一随从以第一次解析出的主人为准，不允许自己是自己的主人
     */
    void resolveMasters(Map<Long, AgentDraft> drafts, InstanceIdTimeline timeline, List<RawEvent> events) {
        for (RawEvent event : events) {
            if (event.getSrcMasterInstId() != 0) {
                bindMaster(drafts, timeline, event.getSrcAgent(), event.getSrcMasterInstId(), event.getTime());
            }
            if (event.getDstMasterInstId() != 0) {
                bindMaster(drafts, timeline, event.getDstAgent(), event.getDstMasterInstId(), event.getTime());
            }
        }
    }

    private void bindMaster(Map<Long, AgentDraft> drafts, InstanceIdTimeline timeline,
                            long minionAddr, int masterInstId, long time) {
        AgentDraft minion = drafts.get(minionAddr);
        if (minion == null || minion.masterAddr != null) {
            return;
        }
        Long master = timeline.addressAt(masterInstId, time);
        if (master != null && master != minionAddr) {
            minion.masterAddr = master;
        }
    }

    /**
     * 主从链收敛到最上层主人；先断开环，再逐个向上查找
     */
    void collapseMasters(Map<Long, AgentDraft> drafts) {
        for (AgentDraft draft : drafts.values()) {
            if (leadsBackTo(drafts, draft)) {
                log.debug("主从关系成环，断开 0x{}", Long.toHexString(draft.addr()));
                draft.masterAddr = null;
            }
        }
        Map<Long, Long> topMost = new HashMap<>();
        for (AgentDraft draft : drafts.values()) {
            Long top = draft.masterAddr;
            while (top != null) {
                AgentDraft next = drafts.get(top);
                if (next == null || next.masterAddr == null) {
                    break;
                }
                top = next.masterAddr;
            }
            topMost.put(draft.addr(), top);
        }
        for (AgentDraft draft : drafts.values()) {
            draft.masterAddr = topMost.get(draft.addr());
        }
    }

    private boolean leadsBackTo(Map<Long, AgentDraft> drafts, AgentDraft start) {
        Set<Long> seen = new HashSet<>();
        Long current = start.masterAddr;
        while (current != null && seen.add(current)) {
            if (current == start.addr()) {
                return true;
            }
            AgentDraft next = drafts.get(current);
            current = next == null ? null : next.masterAddr;
        }
        return false;
    }

    private Agent freeze(AgentDraft draft) {
        RawAgent raw = draft.raw;
        return new Agent(raw.getAddr(), draft.kind, raw.getToughness(), raw.getConcentration(), raw.getHealing(),
                raw.getCondition(), draft.instanceId, draft.freezeIntervals(), draft.masterAddr);
    }
}
