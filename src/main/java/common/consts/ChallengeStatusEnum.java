package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 挑战模式状态
 */
@Getter
@AllArgsConstructor
public enum ChallengeStatusEnum {
    ACTIVE(1, "已开启"),
    INACTIVE(2, "未开启"),
    UNKNOWN(0, "无法判定");

    private final int code;
    private final String desc;
}
