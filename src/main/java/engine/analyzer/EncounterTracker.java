package engine.analyzer;

import common.consts.BossEnum;
import common.consts.BuffKindEnum;
import common.consts.EncounterEnum;
import lombok.Getter;
import model.bo.EncounterTrigger;
import model.entity.Agent;
import model.entity.Event;
import model.entity.Log;
import model.entity.payload.ActivationPayload;
import model.entity.payload.BuffPayload;
import model.entity.payload.StateChangeDetail;
import model.entity.payload.StateChangePayload;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单次分析的状态机，每次 analyze 新建
 * 记录所有分析器共用的信号：视角、奖励、日志结束、首领死亡 / 离开、首领血量、挑战增益
 * 子类通过 on* 钩子补充战斗特有的状态
 */
@Getter
public class EncounterTracker {

    protected final Log log;
    protected final EncounterEnum encounter;
    protected final EncounterTrigger trigger;

    private final Set<Long> bossAddrs = new HashSet<>();
    private final Set<Integer> bossSpecies = new HashSet<>();
    private final boolean challengeSpeciesPresent;

    private Long povAddr;
    private final Set<Long> rewardedAddrs = new HashSet<>();
    private boolean logEnded;
    private final Set<Long> deadBosses = new HashSet<>();
    private final Set<Integer> deadBossSpecies = new HashSet<>();
    private final Set<Long> despawnedBosses = new HashSet<>();
    private Long bossMaxHealth;
    // 目标地址 -> 挑战增益施加时间
    private final Map<Long, List<Long>> challengeBuffTimes = new LinkedHashMap<>();
    // 首领获得胜利增益的时间
    private final List<Long> victoryBuffTimes = new ArrayList<>();
    private long lastPlayerExit;
    private long lastBossExit;

    public EncounterTracker(Log log, EncounterEnum encounter, EncounterTrigger trigger) {
        this.log = log;
        this.encounter = encounter;
        this.trigger = trigger;
        for (BossEnum boss : encounter.getBosses()) {
            bossSpecies.add(boss.getCode());
        }
        boolean speciesPresent = false;
        for (Agent agent : log.getAgents()) {
            int species = agent.getSpeciesId();
            if (bossSpecies.contains(species)) {
                bossAddrs.add(agent.getAddr());
            }
            if (trigger.getChallengeSpecies().contains(species)) {
                speciesPresent = true;
            }
        }
        this.challengeSpeciesPresent = speciesPresent;
    }

    public void observe(Event event) {
        switch (event.getPayload().getKind()) {
            case STATE_CHANGE:
                StateChangePayload stateChange = (StateChangePayload) event.getPayload();
                trackStateChange(event, stateChange);
                onStateChange(event, stateChange);
                break;
            case BUFF:
                BuffPayload buff = (BuffPayload) event.getPayload();
                trackBuff(event, buff);
                onBuff(event, buff);
                break;
            case ACTIVATION:
                onActivation(event, (ActivationPayload) event.getPayload());
                break;
            case BUFF_REMOVAL:
            case PHYSICAL:
            case UNKNOWN:
            default:
                break;
        }
    }

    private void trackStateChange(Event event, StateChangePayload payload) {
        long addr = payload.getAgentAddr();
        switch (payload.getStateChange()) {
            case POINT_OF_VIEW:
                povAddr = addr;
                break;
            case REWARD:
                rewardedAddrs.add(addr);
                break;
            case LOG_END:
                logEnded = true;
                break;
            case CHANGE_DEAD:
                if (isBoss(addr)) {
                    deadBosses.add(addr);
                    deadBossSpecies.add(log.findAgent(addr).getSpeciesId());
                }
                break;
            case DESPAWN:
                if (isBoss(addr)) {
                    despawnedBosses.add(addr);
                }
                break;
            case MAX_HEALTH_UPDATE:
                if (isBoss(addr)) {
                    long health = ((StateChangeDetail.Numeric) payload.getDetail()).getValue();
                    bossMaxHealth = bossMaxHealth == null ? health : Math.max(bossMaxHealth, health);
                }
                break;
            case EXIT_COMBAT:
                Agent agent = log.findAgent(addr);
                if (agent == null) {
                    break;
                }
                if (agent.isPlayer()) {
                    lastPlayerExit = Math.max(lastPlayerExit, event.getTime());
                } else if (isBoss(addr)) {
                    lastBossExit = Math.max(lastBossExit, event.getTime());
                }
                break;
            default:
                break;
        }
    }

    private void trackBuff(Event event, BuffPayload payload) {
        if (payload.getBuffKind() != BuffKindEnum.APPLICATION) {
            return;
        }
        Long challengeBuff = trigger.getChallengeBuff();
        if (challengeBuff != null && challengeBuff == payload.getBuffId()) {
            challengeBuffTimes.computeIfAbsent(event.getDstAddr(), k -> new ArrayList<>()).add(event.getTime());
        }
        Long victoryBuff = trigger.getVictoryBuff();
        if (victoryBuff != null && victoryBuff == payload.getBuffId() && isBoss(event.getDstAddr())) {
            victoryBuffTimes.add(event.getTime());
        }
    }

    protected void onStateChange(Event event, StateChangePayload payload) {
    }

    protected void onBuff(Event event, BuffPayload payload) {
    }

    protected void onActivation(Event event, ActivationPayload payload) {
    }

    public boolean isBoss(long addr) {
        return bossAddrs.contains(addr);
    }

    /**
     * 有视角标记时只认发给记录者的奖励，否则任何奖励都算
     */
    public boolean isRewarded() {
        if (povAddr != null) {
            return rewardedAddrs.contains(povAddr);
        }
        return !rewardedAddrs.isEmpty();
    }

    public boolean anyBossDead() {
        return !deadBosses.isEmpty();
    }

    /**
     * 战斗的每一种首领都有死亡记录
     */
    public boolean allBossesDead() {
        return !bossSpecies.isEmpty() && deadBossSpecies.containsAll(bossSpecies);
    }

    /**
     * 所有已跟踪的首领都已死亡或离开视野
     */
    public boolean allBossesGone() {
        if (bossAddrs.isEmpty()) {
            return false;
        }
        for (Long addr : bossAddrs) {
            if (!deadBosses.contains(addr) && !despawnedBosses.contains(addr)) {
                return false;
            }
        }
        return true;
    }

    public boolean playersExitAfterBoss(long marginMs) {
        return lastBossExit != 0 && lastPlayerExit > lastBossExit + marginMs;
    }
}
