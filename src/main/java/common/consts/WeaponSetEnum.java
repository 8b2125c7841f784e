package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 武器组，取值来自 arcdps 说明
 */
@Getter
@AllArgsConstructor
public enum WeaponSetEnum {
    WATER_0(0, "水下武器一"),
    WATER_1(1, "水下武器二"),
    LAND_0(4, "陆地武器一"),
    LAND_1(5, "陆地武器二"),
    UNKNOWN(-1, "未知");

    private final int code;
    private final String desc;

    public static WeaponSetEnum getByCode(long code) {
        for (WeaponSetEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
