package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 事件负载类别，按分类优先级从高到低排列
 */
@Getter
@AllArgsConstructor
public enum PayloadKindEnum {
    STATE_CHANGE(1, "状态变更"),
    ACTIVATION(2, "技能释放"),
    BUFF_REMOVAL(3, "增益移除"),
    BUFF(4, "增益"),
    PHYSICAL(5, "直接伤害"),
    UNKNOWN(0, "未识别");

    private final int code;
    private final String desc;
}
