package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 非致命解析问题，记录后继续解析
 */
@Getter
@AllArgsConstructor
public enum DecodeWarningEnum {
    UNSUPPORTED_REVISION(1, "不支持的日志修订版本，按已知最新布局解析"),
    INVALID_TEXT(2, "文本编码无效，截取有效前缀"),
    UNRECOGNIZED_CODE(3, "未识别的事件码，事件记为未知"),
    DUPLICATE_ADDRESS(4, "参与者地址重复，保留首条记录");

    private final int code;
    private final String desc;
}
