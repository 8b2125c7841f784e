package model.bo;

import common.consts.DecodeWarningEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 非致命解析问题；同一未识别码只记录一次并累计次数
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class DecodeWarning {
    private final DecodeWarningEnum type;
    private final String message;
    private final int count;
}
