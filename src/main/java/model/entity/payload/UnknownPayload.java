package model.entity.payload;

import common.consts.PayloadKindEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 未识别或暂不解析的事件，保留在日志中但不参与分析
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class UnknownPayload implements EventPayload {
    // 导致无法识别的字段，如 statechange / activation
    private final String field;
    private final int code;

    @Override
    public PayloadKindEnum getKind() {
        return PayloadKindEnum.UNKNOWN;
    }
}
