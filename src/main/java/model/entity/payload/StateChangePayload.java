package model.entity.payload;

import common.consts.PayloadKindEnum;
import common.consts.StateChangeEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 状态变更；agentAddr 为变更主体（奖励、日志开始等标记为记录者自身）
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class StateChangePayload implements EventPayload {
    private final StateChangeEnum stateChange;
    private final long agentAddr;
    private final StateChangeDetail detail;

    @Override
    public PayloadKindEnum getKind() {
        return PayloadKindEnum.STATE_CHANGE;
    }
}
