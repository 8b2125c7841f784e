package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 致命解析错误，整个解析中止
 */
@Getter
@AllArgsConstructor
public enum DecodeErrorEnum {
    BAD_MAGIC(1, "文件头标识不是 EVTC"),
    TRUNCATED(2, "数据被截断"),
    INSTANCE_CONFLICT(3, "同一实例号在同一时间属于多个参与者");

    private final int code;
    private final String desc;
}
