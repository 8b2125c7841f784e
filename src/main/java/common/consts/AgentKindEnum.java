package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 参与者类别
 */
@Getter
@AllArgsConstructor
public enum AgentKindEnum {
    PLAYER(1, "玩家"),
    CHARACTER(2, "NPC"),       // 种类 id 可靠
    GADGET(3, "装置");         // id 只在本日志内有效

    private final int code;
    private final String desc;
}
