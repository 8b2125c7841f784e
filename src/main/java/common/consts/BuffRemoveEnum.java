package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 增益移除类型 (cbtevent.is_buffremove)
 */
@Getter
@AllArgsConstructor
public enum BuffRemoveEnum {
    NONE(0, "无"),
    ALL(1, "移除全部层"),
    SINGLE(2, "移除单层"),
    MANUAL(3, "自动移除");

    private final int code;
    private final String desc;

    public static BuffRemoveEnum getByCode(int code) {
        for (BuffRemoveEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return null;
    }
}
