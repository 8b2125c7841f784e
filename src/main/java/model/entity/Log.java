package model.entity;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import model.bo.DecodeWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 一份完整解析的战斗日志，构建后不可变，由调用方独占
 */
@Getter
@EqualsAndHashCode(exclude = "agentIndex")
@ToString(exclude = {"agentIndex", "events"})
public class Log {
    private final String arcdpsBuild;
    private final int revision;
    private final int contentId;
    // 游戏版本号，来自 GW_BUILD 状态变更，缺失为 0
    private final long gameBuild;
    private final List<Agent> agents;
    private final List<Skill> skills;
    private final List<Event> events;
    private final List<DecodeWarning> warnings;

    @Getter(AccessLevel.NONE)
    private final Map<Long, Agent> agentIndex;

    public Log(String arcdpsBuild, int revision, int contentId, long gameBuild, List<Agent> agents,
               List<Skill> skills, List<Event> events, List<DecodeWarning> warnings) {
        this.arcdpsBuild = arcdpsBuild;
        this.revision = revision;
        this.contentId = contentId;
        this.gameBuild = gameBuild;
        this.agents = Collections.unmodifiableList(new ArrayList<>(agents));
        this.skills = Collections.unmodifiableList(new ArrayList<>(skills));
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        Map<Long, Agent> index = new HashMap<>();
        for (Agent agent : this.agents) {
            index.put(agent.getAddr(), agent);
        }
        this.agentIndex = Collections.unmodifiableMap(index);
    }

    /** 地址不在参与者表中时返回 null */
    public Agent findAgent(long addr) {
        return agentIndex.get(addr);
    }

    public List<Agent> players() {
        return agents.stream().filter(Agent::isPlayer).collect(Collectors.toList());
    }

    public List<Agent> npcs() {
        return agents.stream().filter(a -> a.getKind() instanceof NpcCharacter).collect(Collectors.toList());
    }
}
