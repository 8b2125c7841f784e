package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 精英特长，code 为特性线 id
 */
@Getter
@AllArgsConstructor
public enum EliteSpecEnum {
    // 荆棘之心
    DRAGONHUNTER(27, "猎龙者", ProfessionEnum.GUARDIAN),
    BERSERKER(18, "狂战士", ProfessionEnum.WARRIOR),
    SCRAPPER(43, "机械师", ProfessionEnum.ENGINEER),
    DRUID(5, "德鲁伊", ProfessionEnum.RANGER),
    DAREDEVIL(7, "独行侠", ProfessionEnum.THIEF),
    TEMPEST(48, "暴风使", ProfessionEnum.ELEMENTALIST),
    CHRONOMANCER(40, "时空术士", ProfessionEnum.MESMER),
    REAPER(34, "夺魂者", ProfessionEnum.NECROMANCER),
    HERALD(52, "预告者", ProfessionEnum.REVENANT),
    // 无尽之路
    FIREBRAND(62, "燃火者", ProfessionEnum.GUARDIAN),
    SPELLBREAKER(61, "破法者", ProfessionEnum.WARRIOR),
    HOLOSMITH(57, "全息师", ProfessionEnum.ENGINEER),
    SOULBEAST(55, "魂兽师", ProfessionEnum.RANGER),
    DEADEYE(58, "神枪手", ProfessionEnum.THIEF),
    WEAVER(56, "编织者", ProfessionEnum.ELEMENTALIST),
    MIRAGE(59, "幻象术士", ProfessionEnum.MESMER),
    SCOURGE(60, "灾厄师", ProfessionEnum.NECROMANCER),
    RENEGADE(63, "叛誓者", ProfessionEnum.REVENANT);

    private final int code;
    private final String desc;
    private final ProfessionEnum profession;

    /**
     * 旧版本日志的 elite 字段只记录 0/1，此时返回 null
     */
    public static EliteSpecEnum getByCode(long code) {
        for (EliteSpecEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return null;
    }
}
