package engine.classify;

import common.consts.ActivationEnum;
import common.consts.BuffKindEnum;
import common.consts.BuffRemoveEnum;
import common.consts.CbtResultEnum;
import common.consts.IffEnum;
import common.consts.LanguageEnum;
import common.consts.StateChangeEnum;
import common.consts.WeaponSetEnum;
import model.bo.DecodeWarnings;
import model.entity.Event;
import model.entity.payload.ActivationPayload;
import model.entity.payload.BuffPayload;
import model.entity.payload.BuffRemovalPayload;
import model.entity.payload.EventPayload;
import model.entity.payload.PhysicalPayload;
import model.entity.payload.StateChangeDetail;
import model.entity.payload.StateChangePayload;
import model.entity.payload.UnknownPayload;
import model.raw.RawEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 原始事件 -> 唯一一种负载
 * 优先级：状态变更 > 技能释放 > 增益移除 > 增益 > 直接伤害
 * 未识别的码记为未知事件并累计告警，不中止解析
 */
@Component
public class EventClassifier {

    public List<Event> classify(List<RawEvent> rawEvents, DecodeWarnings warnings) {
        List<Event> events = new ArrayList<>(rawEvents.size());
        for (RawEvent raw : rawEvents) {
            events.add(classify(raw, warnings));
        }
        return events;
    }

    public Event classify(RawEvent raw, DecodeWarnings warnings) {
        return new Event(raw.getTime(), raw.getSrcAgent(), raw.getDstAgent(), payloadOf(raw, warnings),
                raw.isNinety(), raw.isFifty(), raw.isMoving(), raw.isFlanking(), raw.isShields(), raw.isOffcycle());
    }

    private EventPayload payloadOf(RawEvent raw, DecodeWarnings warnings) {
        if (raw.getIsStateChange() != 0) {
            return stateChange(raw, warnings);
        }
        if (raw.getIsActivation() != 0) {
            ActivationEnum activation = ActivationEnum.getByCode(raw.getIsActivation());
            if (activation == null) {
                return unrecognized("activation", raw.getIsActivation(), warnings);
            }
            int duration = activation == ActivationEnum.RESET ? 0 : raw.getValue();
            return new ActivationPayload(activation, raw.getSkillId(), duration);
        }
        if (raw.getIsBuffRemove() != 0) {
            BuffRemoveEnum removal = BuffRemoveEnum.getByCode(raw.getIsBuffRemove());
            if (removal == null) {
                return unrecognized("buffremove", raw.getIsBuffRemove(), warnings);
            }
            return new BuffRemovalPayload(removal, raw.getSkillId(), raw.getValue(), raw.getBuffDmg());
        }
        if (raw.getBuff() != 0) {
            return buff(raw);
        }
        CbtResultEnum result = CbtResultEnum.getByCode(raw.getResult());
        if (result == null) {
            return unrecognized("result", raw.getResult(), warnings);
        }
        return new PhysicalPayload(raw.getSkillId(), raw.getValue(), result, IffEnum.getByCode(raw.getIff()));
    }

    private EventPayload buff(RawEvent raw) {
        boolean hasValue = raw.getValue() != 0;
        boolean hasDamage = raw.getBuffDmg() != 0;
        if (hasDamage && !hasValue) {
            return new BuffPayload(BuffKindEnum.DAMAGE_TICK, raw.getSkillId(), 0, 0, raw.getBuffDmg());
        }
        if (hasValue && !hasDamage) {
            return new BuffPayload(BuffKindEnum.APPLICATION, raw.getSkillId(), raw.getValue(), raw.getOverstackValue(), 0);
        }
        if (!hasValue) {
            return new BuffPayload(BuffKindEnum.NEGATED_TICK, raw.getSkillId(), 0, 0, 0);
        }
        // value 与 buff_dmg 同时非零的组合没有定义
        return new UnknownPayload("buff", raw.getBuff());
    }

    private EventPayload stateChange(RawEvent raw, DecodeWarnings warnings) {
        StateChangeEnum stateChange = StateChangeEnum.getByCode(raw.getIsStateChange());
        if (stateChange == null) {
            return unrecognized("statechange", raw.getIsStateChange(), warnings);
        }
        if (!stateChange.isInterpreted()) {
            return new UnknownPayload("statechange", raw.getIsStateChange());
        }
        return new StateChangePayload(stateChange, raw.getSrcAgent(), detailOf(stateChange, raw));
    }

    private StateChangeDetail detailOf(StateChangeEnum stateChange, RawEvent raw) {
        switch (stateChange) {
            case ENTER_COMBAT:
            case HEALTH_UPDATE:
            case MAX_HEALTH_UPDATE:
            case TEAM_CHANGE:
                return new StateChangeDetail.Numeric(raw.getDstAgent());
            case GW_BUILD:
            case SHARD_ID:
            case MAP_ID:
                return new StateChangeDetail.Numeric(raw.getSrcAgent());
            case LOG_START:
            case LOG_END:
                return new StateChangeDetail.Timestamps(raw.getValue() & 0xFFFFFFFFL, raw.getBuffDmg() & 0xFFFFFFFFL);
            case WEAP_SWAP:
                return new StateChangeDetail.WeaponSwap(WeaponSetEnum.getByCode(raw.getDstAgent()));
            case LANGUAGE:
                return new StateChangeDetail.Language(LanguageEnum.getByCode(raw.getSrcAgent()));
            case REWARD:
                return new StateChangeDetail.Reward(raw.getDstAgent(), raw.getValue());
            case POSITION:
            case VELOCITY:
                return new StateChangeDetail.Vector(highFloat(raw.getDstAgent()), lowFloat(raw.getDstAgent()),
                        Float.intBitsToFloat(raw.getValue()));
            case FACING:
                return new StateChangeDetail.Vector(highFloat(raw.getDstAgent()), lowFloat(raw.getDstAgent()), 0f);
            case ATTACK_TARGET:
                return new StateChangeDetail.AttackTarget(raw.getDstAgent(), raw.getValue() != 0);
            case TARGETABLE:
                return new StateChangeDetail.Targetable(raw.getDstAgent() != 0);
            default:
                return StateChangeDetail.Empty.INSTANCE;
        }
    }

    // 坐标类事件把两个 f32 打包在 dst_agent 中
    private static float highFloat(long packed) {
        return Float.intBitsToFloat((int) (packed >>> 32));
    }

    private static float lowFloat(long packed) {
        return Float.intBitsToFloat((int) packed);
    }

    private static UnknownPayload unrecognized(String field, int code, DecodeWarnings warnings) {
        warnings.unrecognizedCode(field, code);
        return new UnknownPayload(field, code);
    }
}
