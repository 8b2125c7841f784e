package model.bo;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个战斗的经验触发条件，来自 encounter-triggers.json
 * 未配置的字段为 null，表示该规则不适用
 * 只由 Jackson 按字段填充，加载后只读
 */
@Getter
@ToString
@NoArgsConstructor
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY)
public class EncounterTrigger {

    /** 首领最大血量不低于该值即为挑战模式 */
    private Long challengeHealth;

    /** 出现该增益即为挑战模式 */
    private Long challengeBuff;

    /** 配合 challengeBuff：同一目标两次施加的最小间隔不超过该值即为挑战模式 */
    private Long challengeBuffIntervalMs;

    /** 出现任一该种类 NPC 即为挑战模式 */
    private List<Integer> challengeSpecies = new ArrayList<>();

    /** 只会以挑战模式记录的战斗 */
    private boolean alwaysChallenge;

    /** 首领获得该增益即胜利 */
    private Long victoryBuff;

    /** 该种类 NPC 出现即胜利 */
    private Integer victorySpecies;

    /** 所有首领都死亡才算胜利 */
    private boolean victoryRequiresAllBosses;

    /** 阶段切换技能 */
    private Long phaseSkill;

    /** 存在该技能表示有黑暗阶段 */
    private Long darkModeSkill;

    public List<Integer> getChallengeSpecies() {
        return Collections.unmodifiableList(challengeSpecies);
    }

    public boolean hasChallengeRule() {
        return alwaysChallenge || challengeHealth != null || challengeBuff != null || !challengeSpecies.isEmpty();
    }
}
