package model.entity.payload;

import common.consts.PayloadKindEnum;

/**
 * 事件负载，一条原始事件只对应其中一种
 */
public sealed interface EventPayload
        permits StateChangePayload, ActivationPayload, BuffRemovalPayload, BuffPayload, PhysicalPayload, UnknownPayload {

    PayloadKindEnum getKind();
}
