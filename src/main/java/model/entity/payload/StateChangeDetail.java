package model.entity.payload;

import common.consts.LanguageEnum;
import common.consts.WeaponSetEnum;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 状态变更携带的附加字段，按变更类型只保留有意义的部分
 */
public sealed interface StateChangeDetail {

    /** 进出战斗、死亡、倒地、进出视野、视角标记 */
    @EqualsAndHashCode
    @ToString
    final class Empty implements StateChangeDetail {
        public static final Empty INSTANCE = new Empty();

        private Empty() {}
    }

    /** 小队号、血量、版本号、分片、地图、阵营等单一数值 */
    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    final class Numeric implements StateChangeDetail {
        private final long value;
    }

    /** 日志开始 / 结束：服务器时间（秒）与本地时间 */
    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    final class Timestamps implements StateChangeDetail {
        private final long serverTimestamp;
        private final long localTimestamp;
    }

    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    final class WeaponSwap implements StateChangeDetail {
        private final WeaponSetEnum weaponSet;
    }

    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    final class Language implements StateChangeDetail {
        private final LanguageEnum language;
    }

    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    final class Reward implements StateChangeDetail {
        private final long rewardId;
        private final int rewardType;
    }

    /** 坐标、速度、朝向（朝向 z 恒为 0） */
    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    final class Vector implements StateChangeDetail {
        private final float x;
        private final float y;
        private final float z;
    }

    /** 攻击目标与其所属的父对象 */
    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    final class AttackTarget implements StateChangeDetail {
        private final long parentAddr;
        private final boolean targetable;
    }

    @Getter
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    final class Targetable implements StateChangeDetail {
        private final boolean targetable;
    }
}
