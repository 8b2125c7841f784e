package model.entity.payload;

import common.consts.BuffKindEnum;
import common.consts.PayloadKindEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 增益施加 / 跳伤
 * APPLICATION: duration、overstack 有效；DAMAGE_TICK: damage 有效；NEGATED_TICK: 都为 0
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class BuffPayload implements EventPayload {
    private final BuffKindEnum buffKind;
    private final long buffId;
    private final int duration;
    private final long overstack;
    private final int damage;

    @Override
    public PayloadKindEnum getKind() {
        return PayloadKindEnum.BUFF;
    }
}
