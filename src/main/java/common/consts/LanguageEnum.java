package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 客户端语言
 */
@Getter
@AllArgsConstructor
public enum LanguageEnum {
    ENGLISH(0, "英语"),
    FRENCH(2, "法语"),
    GERMAN(3, "德语"),
    SPANISH(4, "西班牙语"),
    UNKNOWN(-1, "未知");

    private final int code;
    private final String desc;

    public static LanguageEnum getByCode(long code) {
        for (LanguageEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
