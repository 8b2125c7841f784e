package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 战斗结果
 */
@Getter
@AllArgsConstructor
public enum OutcomeEnum {
    SUCCESS(1, "成功"),
    FAILURE(2, "失败"),
    UNKNOWN(0, "无法判定");    // 日志在任何胜负触发点之前被截断

    private final int code;
    private final String desc;

    public boolean isDecided() {
        return this != UNKNOWN;
    }
}
