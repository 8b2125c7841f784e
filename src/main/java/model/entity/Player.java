package model.entity;

import common.consts.AgentKindEnum;
import common.consts.EliteSpecEnum;
import common.consts.ProfessionEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class Player implements AgentKind {
    private final long professionCode;
    private final long eliteCode;
    private final String characterName;
    private final String accountName;
    private final int subgroup;

    @Override
    public AgentKindEnum getType() {
        return AgentKindEnum.PLAYER;
    }

    @Override
    public String getName() {
        return characterName;
    }

    public ProfessionEnum getProfession() {
        return ProfessionEnum.getByCode(professionCode);
    }

    /** 未装备精英特长时为 null */
    public EliteSpecEnum getEliteSpec() {
        return EliteSpecEnum.getByCode(eliteCode);
    }
}
