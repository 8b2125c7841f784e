package model.entity.payload;

import common.consts.BuffRemoveEnum;
import common.consts.PayloadKindEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class BuffRemovalPayload implements EventPayload {
    private final BuffRemoveEnum removal;
    private final long buffId;
    private final int totalDuration;
    private final int longestStack;

    @Override
    public PayloadKindEnum getKind() {
        return PayloadKindEnum.BUFF_REMOVAL;
    }
}
