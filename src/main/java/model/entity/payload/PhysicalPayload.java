package model.entity.payload;

import common.consts.CbtResultEnum;
import common.consts.IffEnum;
import common.consts.PayloadKindEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 直接伤害；value 的正负保留给治疗
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class PhysicalPayload implements EventPayload {
    private final long skillId;
    private final int value;
    private final CbtResultEnum result;
    private final IffEnum iff;

    @Override
    public PayloadKindEnum getKind() {
        return PayloadKindEnum.PHYSICAL;
    }
}
