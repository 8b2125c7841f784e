package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 技能释放类型 (cbtevent.is_activation)
 * value 字段的含义随类型变化：完成类为预期动作时长，取消类为已引导时长
 */
@Getter
@AllArgsConstructor
public enum ActivationEnum {
    NONE(0, "无"),
    NORMAL(1, "正常释放"),
    QUICKNESS(2, "急速释放"),
    CANCEL_FIRE(3, "过阈值后取消"),
    CANCEL_CANCEL(4, "阈值前取消"),
    RESET(5, "重置");

    private final int code;
    private final String desc;

    public static ActivationEnum getByCode(int code) {
        for (ActivationEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return null;
    }
}
