package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 增益事件子类型，由 value 与 buff_dmg 是否为零区分
 */
@Getter
@AllArgsConstructor
public enum BuffKindEnum {
    APPLICATION(1, "增益施加"),      // value = 持续时间, overstack = 被覆盖时长
    NEGATED_TICK(2, "被抵消的跳伤"),
    DAMAGE_TICK(3, "增益跳伤");      // buff_dmg 正负代表方向

    private final int code;
    private final String desc;
}
