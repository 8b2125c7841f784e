package model.entity;

import common.consts.AgentKindEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 具有可靠种类 id 的 NPC
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class NpcCharacter implements AgentKind {
    private final int speciesId;
    private final String name;

    @Override
    public AgentKindEnum getType() {
        return AgentKindEnum.CHARACTER;
    }
}
