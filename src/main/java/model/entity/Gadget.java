package model.entity;

import common.consts.AgentKindEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 装置 / 陷阱 / 特效
 * volatileId 只在当前日志中有意义，跨日志可能与无关装置重复
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class Gadget implements AgentKind {
    private final int volatileId;
    private final String name;

    @Override
    public AgentKindEnum getType() {
        return AgentKindEnum.GADGET;
    }
}
