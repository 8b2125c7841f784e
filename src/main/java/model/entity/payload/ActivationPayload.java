package model.entity.payload;

import common.consts.ActivationEnum;
import common.consts.PayloadKindEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 技能释放；durationMs 对完成类为预期动作时长，对取消类为已引导时长，重置为 0
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class ActivationPayload implements EventPayload {
    private final ActivationEnum activation;
    private final long skillId;
    private final int durationMs;

    @Override
    public PayloadKindEnum getKind() {
        return PayloadKindEnum.ACTIVATION;
    }
}
