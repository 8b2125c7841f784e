package model.entity;

import common.consts.AgentKindEnum;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 日志中的参与者，地址在整份日志内唯一
 * 构建完成后不可变
 */
@Getter
@EqualsAndHashCode
@ToString
public class Agent {
    private final long addr;
    private final AgentKind kind;
    private final short toughness;
    private final short concentration;
    private final short healing;
    private final short condition;
    // 最后一次出现时的实例号，从未出现为 0
    private final int instanceId;
    private final List<AwareInterval> awareIntervals;
    // 最上层主人地址，没有时为 null
    private final Long masterAddr;

    public Agent(long addr, AgentKind kind, short toughness, short concentration, short healing, short condition,
                 int instanceId, List<AwareInterval> awareIntervals, Long masterAddr) {
        this.addr = addr;
        this.kind = kind;
        this.toughness = toughness;
        this.concentration = concentration;
        this.healing = healing;
        this.condition = condition;
        this.instanceId = instanceId;
        this.awareIntervals = Collections.unmodifiableList(new ArrayList<>(awareIntervals));
        this.masterAddr = masterAddr;
    }

    public AgentKindEnum getType() {
        return kind.getType();
    }

    public String getName() {
        return kind.getName();
    }

    public boolean isPlayer() {
        return kind.getType() == AgentKindEnum.PLAYER;
    }

    /** 非 NPC 返回 -1 */
    public int getSpeciesId() {
        return kind instanceof NpcCharacter npc ? npc.getSpeciesId() : -1;
    }

    public long getFirstAware() {
        return awareIntervals.isEmpty() ? 0 : awareIntervals.get(0).getFirstAware();
    }

    public long getLastAware() {
        return awareIntervals.isEmpty() ? 0 : awareIntervals.get(awareIntervals.size() - 1).getLastAware();
    }
}
