package engine.classify;

import common.consts.ActivationEnum;
import common.consts.BuffKindEnum;
import common.consts.BuffRemoveEnum;
import common.consts.CbtResultEnum;
import common.consts.DecodeWarningEnum;
import common.consts.IffEnum;
import common.consts.PayloadKindEnum;
import common.consts.StateChangeEnum;
import model.bo.DecodeWarning;
import model.bo.DecodeWarnings;
import model.entity.Event;
import model.entity.payload.ActivationPayload;
import model.entity.payload.BuffPayload;
import model.entity.payload.BuffRemovalPayload;
import model.entity.payload.PhysicalPayload;
import model.entity.payload.StateChangeDetail;
import model.entity.payload.StateChangePayload;
import model.entity.payload.UnknownPayload;
import model.raw.RawEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("事件分类测试")
class EventClassifierTest {

    private final EventClassifier classifier = new EventClassifier();
    private DecodeWarnings warnings;

    @BeforeEach
    void setUp() {
        warnings = new DecodeWarnings();
    }

    private static RawEvent raw() {
        RawEvent raw = new RawEvent();
        raw.setTime(1000);
        raw.setSrcAgent(0x10);
        raw.setDstAgent(0x20);
        raw.setSkillId(5492);
        return raw;
    }

    @Test
    @DisplayName("状态变更优先于其他标志")
    void testStateChangePrecedence() {
        RawEvent raw = raw();
        raw.setIsStateChange(StateChangeEnum.CHANGE_DEAD.getCode());
        raw.setIsActivation(1);
        raw.setBuff(1);
        raw.setValue(100);

        Event event = classifier.classify(raw, warnings);
        StateChangePayload payload = assertInstanceOf(StateChangePayload.class, event.getPayload());
        assertEquals(StateChangeEnum.CHANGE_DEAD, payload.getStateChange());
        assertEquals(0x10, payload.getAgentAddr());
        assertSame(StateChangeDetail.Empty.INSTANCE, payload.getDetail());
    }

    @Test
    @DisplayName("日志开始携带服务器与本地时间")
    void testLogStartTimestamps() {
        RawEvent raw = raw();
        raw.setIsStateChange(StateChangeEnum.LOG_START.getCode());
        raw.setValue((int) 0xF0000000L);
        raw.setBuffDmg(1_700_000_000);

        StateChangePayload payload = (StateChangePayload) classifier.classify(raw, warnings).getPayload();
        StateChangeDetail.Timestamps detail = assertInstanceOf(StateChangeDetail.Timestamps.class, payload.getDetail());
        assertEquals(0xF0000000L, detail.getServerTimestamp());
        assertEquals(1_700_000_000L, detail.getLocalTimestamp());
    }

    @Test
    @DisplayName("奖励与可选中状态")
    void testRewardAndTargetable() {
        RawEvent reward = raw();
        reward.setIsStateChange(StateChangeEnum.REWARD.getCode());
        reward.setDstAgent(55);
        reward.setValue(13);
        StateChangeDetail.Reward detail = assertInstanceOf(StateChangeDetail.Reward.class,
                ((StateChangePayload) classifier.classify(reward, warnings).getPayload()).getDetail());
        assertEquals(55, detail.getRewardId());
        assertEquals(13, detail.getRewardType());

        RawEvent targetable = raw();
        targetable.setIsStateChange(StateChangeEnum.TARGETABLE.getCode());
        targetable.setDstAgent(1);
        StateChangeDetail.Targetable t = assertInstanceOf(StateChangeDetail.Targetable.class,
                ((StateChangePayload) classifier.classify(targetable, warnings).getPayload()).getDetail());
        assertTrue(t.isTargetable());
    }

    @Test
    @DisplayName("已知但不解释的状态变更不告警")
    void testUninterpretedStateChange() {
        RawEvent raw = raw();
        raw.setIsStateChange(StateChangeEnum.SKILL_INFO.getCode());

        Event event = classifier.classify(raw, warnings);
        assertEquals(PayloadKindEnum.UNKNOWN, event.getPayload().getKind());
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("技能释放：持续时间取 value，重置为 0")
    void testActivation() {
        RawEvent raw = raw();
        raw.setIsActivation(ActivationEnum.QUICKNESS.getCode());
        raw.setValue(750);
        ActivationPayload payload = assertInstanceOf(ActivationPayload.class,
                classifier.classify(raw, warnings).getPayload());
        assertEquals(ActivationEnum.QUICKNESS, payload.getActivation());
        assertEquals(5492, payload.getSkillId());
        assertEquals(750, payload.getDurationMs());

        raw.setIsActivation(ActivationEnum.RESET.getCode());
        ActivationPayload reset = (ActivationPayload) classifier.classify(raw, warnings).getPayload();
        assertEquals(0, reset.getDurationMs());
    }

    @Test
    @DisplayName("增益移除优先于增益标志")
    void testBuffRemoval() {
        RawEvent raw = raw();
        raw.setIsBuffRemove(BuffRemoveEnum.ALL.getCode());
        raw.setBuff(1);
        raw.setValue(4000);
        raw.setBuffDmg(2500);
        BuffRemovalPayload payload = assertInstanceOf(BuffRemovalPayload.class,
                classifier.classify(raw, warnings).getPayload());
        assertEquals(BuffRemoveEnum.ALL, payload.getRemoval());
        assertEquals(4000, payload.getTotalDuration());
        assertEquals(2500, payload.getLongestStack());
    }

    @Test
    @DisplayName("增益事件按 value 与 buff_dmg 区分施加、伤害与抵消")
    void testBuffKinds() {
        RawEvent apply = raw();
        apply.setBuff(1);
        apply.setValue(3000);
        apply.setOverstackValue(200);
        BuffPayload application = (BuffPayload) classifier.classify(apply, warnings).getPayload();
        assertEquals(BuffKindEnum.APPLICATION, application.getBuffKind());
        assertEquals(3000, application.getDuration());
        assertEquals(200, application.getOverstack());

        RawEvent tick = raw();
        tick.setBuff(1);
        tick.setBuffDmg(450);
        BuffPayload damage = (BuffPayload) classifier.classify(tick, warnings).getPayload();
        assertEquals(BuffKindEnum.DAMAGE_TICK, damage.getBuffKind());
        assertEquals(450, damage.getDamage());

        RawEvent negated = raw();
        negated.setBuff(1);
        BuffPayload none = (BuffPayload) classifier.classify(negated, warnings).getPayload();
        assertEquals(BuffKindEnum.NEGATED_TICK, none.getBuffKind());

        RawEvent both = raw();
        both.setBuff(1);
        both.setValue(1);
        both.setBuffDmg(1);
        assertInstanceOf(UnknownPayload.class, classifier.classify(both, warnings).getPayload());
    }

    @Test
    @DisplayName("其余事件为直接伤害")
    void testPhysical() {
        RawEvent raw = raw();
        raw.setValue(12345);
        raw.setResult(CbtResultEnum.CRIT.getCode());
        raw.setIff(IffEnum.FOE.getCode());
        raw.setFlanking(true);

        Event event = classifier.classify(raw, warnings);
        PhysicalPayload payload = assertInstanceOf(PhysicalPayload.class, event.getPayload());
        assertEquals(12345, payload.getValue());
        assertEquals(CbtResultEnum.CRIT, payload.getResult());
        assertEquals(IffEnum.FOE, payload.getIff());
        assertTrue(event.isFlanking());
        assertEquals(0x10, event.getSrcAddr());
        assertEquals(0x20, event.getDstAddr());
    }

    @Test
    @DisplayName("未识别的码产生 Unknown 并按码聚合告警")
    void testUnrecognizedCodes() {
        RawEvent unknownStateChange = raw();
        unknownStateChange.setIsStateChange(200);
        RawEvent unknownResult = raw();
        unknownResult.setResult(77);

        List<Event> events = classifier.classify(
                List.of(unknownStateChange, unknownStateChange, unknownResult), warnings);

        assertEquals(3, events.size());
        UnknownPayload first = assertInstanceOf(UnknownPayload.class, events.get(0).getPayload());
        assertEquals("statechange", first.getField());
        assertEquals(200, first.getCode());
        List<DecodeWarning> list = warnings.toList();
        assertEquals(2, list.size());
        assertEquals(DecodeWarningEnum.UNRECOGNIZED_CODE, list.get(0).getType());
        assertEquals(2, list.get(0).getCount());
        assertEquals(1, list.get(1).getCount());
    }
}
