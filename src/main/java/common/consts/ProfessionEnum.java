package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 玩家职业
 */
@Getter
@AllArgsConstructor
public enum ProfessionEnum {
    GUARDIAN(1, "守护者"),
    WARRIOR(2, "战士"),
    ENGINEER(3, "工程师"),
    RANGER(4, "游侠"),
    THIEF(5, "潜行者"),
    ELEMENTALIST(6, "元素使"),
    MESMER(7, "幻术师"),
    NECROMANCER(8, "唤灵师"),
    REVENANT(9, "魂武者");

    private final int code;
    private final String desc;

    public static ProfessionEnum getByCode(long code) {
        for (ProfessionEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return null;
    }
}
