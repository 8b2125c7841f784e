package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 直接伤害结果码 (cbtevent.result)
 */
@Getter
@AllArgsConstructor
public enum CbtResultEnum {
    NORMAL(0, "普通"),
    CRIT(1, "暴击"),
    GLANCE(2, "偏斜"),
    BLOCK(3, "格挡"),
    EVADE(4, "闪避"),
    INTERRUPT(5, "打断"),
    ABSORB(6, "吸收"),
    BLIND(7, "致盲"),
    KILLING_BLOW(8, "击杀"),
    DOWNED(9, "击倒"),
    NONE(10, "无");

    private final int code;
    private final String desc;

    public static CbtResultEnum getByCode(int code) {
        for (CbtResultEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return null;
    }
}
