package model.entity;

import common.consts.AgentKindEnum;

/**
 * 参与者类别，封闭为玩家 / NPC / 装置三种
 * 消费方按 getType() 做穷举 switch
 */
public sealed interface AgentKind permits Player, NpcCharacter, Gadget {

    AgentKindEnum getType();

    String getName();
}
