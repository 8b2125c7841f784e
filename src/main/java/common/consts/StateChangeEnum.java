package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 状态变更码 (cbtevent.is_statechange)
 * interpreted = false 的码是已知但暂不解析的，分类为未知事件但不产生告警
 */
@Getter
@AllArgsConstructor
public enum StateChangeEnum {
    NONE(0, "无", false),
    ENTER_COMBAT(1, "进入战斗", true),      // dst = 小队号
    EXIT_COMBAT(2, "离开战斗", true),
    CHANGE_UP(3, "恢复存活", true),
    CHANGE_DEAD(4, "死亡", true),
    CHANGE_DOWN(5, "倒地", true),
    SPAWN(6, "进入视野", true),
    DESPAWN(7, "离开视野", true),
    HEALTH_UPDATE(8, "血量百分比", true),   // dst = 百分比 * 10000
    LOG_START(9, "日志开始", true),         // value = 服务器时间, buff_dmg = 本地时间
    LOG_END(10, "日志结束", true),
    WEAP_SWAP(11, "切换武器", true),        // dst = 武器组
    MAX_HEALTH_UPDATE(12, "最大血量", true),
    POINT_OF_VIEW(13, "记录者视角", true),
    LANGUAGE(14, "客户端语言", true),
    GW_BUILD(15, "游戏版本", true),
    SHARD_ID(16, "服务器分片", true),
    REWARD(17, "奖励", true),               // dst = 奖励 id, value = 奖励类型
    BUFF_INITIAL(18, "初始增益", false),
    POSITION(19, "坐标", true),
    VELOCITY(20, "速度", true),
    FACING(21, "朝向", true),
    TEAM_CHANGE(22, "阵营变更", true),
    ATTACK_TARGET(23, "攻击目标", true),    // dst = 父对象, value = 可攻击
    TARGETABLE(24, "可选中状态", true),     // dst = 可选中
    MAP_ID(25, "地图", true),
    REPL_INFO(26, "内部同步", false),
    STACK_ACTIVE(27, "激活层", false),
    STACK_RESET(28, "重置层", false),
    GUILD(29, "公会", false),
    BUFF_INFO(30, "增益信息", false),
    BUFF_FORMULA(31, "增益公式", false),
    SKILL_INFO(32, "技能信息", false),
    SKILL_TIMING(33, "技能时序", false);

    private final int code;
    private final String desc;
    private final boolean interpreted;

    public static StateChangeEnum getByCode(int code) {
        for (StateChangeEnum value : values()) {
            if (value.getCode() == code) {
                return value;
            }
        }
        return null;
    }
}
