package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 敌我关系 (cbtevent.iff)
 */
@Getter
@AllArgsConstructor
public enum IffEnum {
    FRIEND(0, "友方"),
    FOE(1, "敌方"),
    UNKNOWN(2, "未知"),
    NONE(3, "无");

    private final int code;
    private final String desc;

    /**
     * 超出范围的值统一视为 NONE
     */
    public static IffEnum getByCode(int code) {
        for (IffEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return NONE;
    }
}
