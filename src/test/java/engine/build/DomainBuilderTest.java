package engine.build;

import common.consts.DecodeErrorEnum;
import common.consts.DecodeWarningEnum;
import common.exception.EvtcParseException;
import engine.EvtcTestLogBuilder;
import engine.EvtcTestLogBuilder.EventRecord;
import engine.decode.RawDecoder;
import model.bo.DecodeWarnings;
import model.bo.DomainGraph;
import model.entity.Agent;
import model.entity.AwareInterval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("身份解析测试")
class DomainBuilderTest {

    private static final long PLAYER_A = 0x100;
    private static final long PLAYER_B = 0x200;
    private static final long MINION = 0x300;
    private static final long SUB_MINION = 0x400;
    private static final long LATE_MINION = 0x500;

    private final RawDecoder decoder = new RawDecoder();
    private final DomainBuilder builder = new DomainBuilder();

    private DomainGraph build(EvtcTestLogBuilder log, DecodeWarnings warnings) {
        return builder.build(decoder.decode(log.toBytes(), warnings), warnings);
    }

    private static Map<Long, Agent> byAddr(DomainGraph graph) {
        Map<Long, Agent> map = new HashMap<>();
        for (Agent agent : graph.getAgents()) {
            map.put(agent.getAddr(), agent);
        }
        return map;
    }

    @Test
    @DisplayName("出现区间右端为最后出现时间 + 1，状态变更不计入")
    void testAwareInterval() {
        EvtcTestLogBuilder log = new EvtcTestLogBuilder()
                .player(PLAYER_A, 1, 0, "A", ":a.1", "1")
                .hit(100, PLAYER_A, 5, 0, 1, 10)
                .stateChange(150, PLAYER_A, 2)
                .hit(200, PLAYER_A, 5, 0, 1, 10)
                .stateChange(900, PLAYER_A, 4);
        Agent agent = byAddr(build(log, new DecodeWarnings())).get(PLAYER_A);

        assertEquals(5, agent.getInstanceId());
        assertEquals(List.of(new AwareInterval(5, 100, 201)), agent.getAwareIntervals());
        assertEquals(100, agent.getFirstAware());
        assertEquals(201, agent.getLastAware());
    }

    @Test
    @DisplayName("实例号变化时开启新区间")
    void testInstanceChangeOpensInterval() {
        EvtcTestLogBuilder log = new EvtcTestLogBuilder()
                .player(PLAYER_A, 1, 0, "A", ":a.1", "1")
                .hit(100, PLAYER_A, 5, 0, 1, 10)
                .hit(300, PLAYER_A, 6, 0, 1, 10);
        Agent agent = byAddr(build(log, new DecodeWarnings())).get(PLAYER_A);

        assertEquals(6, agent.getInstanceId());
        assertEquals(2, agent.getAwareIntervals().size());
        assertEquals(6, agent.getAwareIntervals().get(1).getInstanceId());
    }

    @Test
    @DisplayName("实例号回收后按事件时间解析主人")
    void testMasterAfterInstanceReuse() {
        EvtcTestLogBuilder log = new EvtcTestLogBuilder()
                .player(PLAYER_A, 1, 0, "A", ":a.1", "1")
                .player(PLAYER_B, 2, 0, "B", ":b.1", "1")
                .npc(MINION, 1000, "Minion")
                .npc(LATE_MINION, 1001, "Late Minion")
                .hit(100, PLAYER_A, 7, 0, 1, 10)
                .event(new EventRecord().time(150).src(MINION).srcInst(20).srcMaster(7))
                .hit(200, PLAYER_A, 7, 0, 1, 10)
                .hit(500, PLAYER_B, 7, 0, 1, 10)
                .event(new EventRecord().time(550).src(LATE_MINION).srcInst(21).srcMaster(7))
                .hit(600, PLAYER_B, 7, 0, 1, 10);
        Map<Long, Agent> agents = byAddr(build(log, new DecodeWarnings()));

        assertEquals(PLAYER_A, agents.get(MINION).getMasterAddr());
        assertEquals(PLAYER_B, agents.get(LATE_MINION).getMasterAddr());
        assertNull(agents.get(PLAYER_A).getMasterAddr());
    }

    @Test
    @DisplayName("主从链收敛到最上层主人")
    void testMasterChainCollapses() {
        EvtcTestLogBuilder log = new EvtcTestLogBuilder()
                .player(PLAYER_A, 1, 0, "A", ":a.1", "1")
                .npc(MINION, 1000, "Minion")
                .npc(SUB_MINION, 1001, "Sub")
                .hit(100, PLAYER_A, 7, 0, 1, 10)
                .event(new EventRecord().time(110).src(MINION).srcInst(8).srcMaster(7))
                .event(new EventRecord().time(120).src(SUB_MINION).srcInst(9).srcMaster(8))
                .hit(200, PLAYER_A, 7, 0, 1, 10)
                .event(new EventRecord().time(200).src(MINION).srcInst(8));
        Map<Long, Agent> agents = byAddr(build(log, new DecodeWarnings()));

        assertEquals(PLAYER_A, agents.get(MINION).getMasterAddr());
        assertEquals(PLAYER_A, agents.get(SUB_MINION).getMasterAddr());
    }

    @Test
    @DisplayName("目标方主人实例号同样参与解析，自身不作为主人")
    void testDstMasterAndSelfReference() {
        EvtcTestLogBuilder log = new EvtcTestLogBuilder()
                .player(PLAYER_A, 1, 0, "A", ":a.1", "1")
                .npc(MINION, 1000, "Minion")
                .hit(100, PLAYER_A, 7, 0, 1, 10)
                .event(new EventRecord().time(110).src(PLAYER_A).srcInst(7).srcMaster(7)
                        .dst(MINION).dstMaster(7))
                .hit(200, PLAYER_A, 7, 0, 1, 10);
        Map<Long, Agent> agents = byAddr(build(log, new DecodeWarnings()));

        assertNull(agents.get(PLAYER_A).getMasterAddr());
        assertEquals(PLAYER_A, agents.get(MINION).getMasterAddr());
    }

    @Test
    @DisplayName("同一实例号的区间重叠视为冲突")
    void testInstanceConflict() {
        EvtcTestLogBuilder log = new EvtcTestLogBuilder()
                .player(PLAYER_A, 1, 0, "A", ":a.1", "1")
                .player(PLAYER_B, 2, 0, "B", ":b.1", "1")
                .hit(100, PLAYER_A, 7, 0, 1, 10)
                .hit(200, PLAYER_B, 7, 0, 1, 10)
                .hit(300, PLAYER_A, 7, 0, 1, 10);
        EvtcParseException e = assertThrows(EvtcParseException.class,
                () -> build(log, new DecodeWarnings()));
        assertEquals(DecodeErrorEnum.INSTANCE_CONFLICT, e.getErrorType());
        assertEquals(200, e.getOffset());
    }

    @Test
    @DisplayName("离开视野后以相同实例号重新出现时开启新区间，期间他人占用该实例号不算冲突")
    void testReentryAfterDespawn() {
        EvtcTestLogBuilder log = new EvtcTestLogBuilder()
                .player(PLAYER_A, 1, 0, "A", ":a.1", "1")
                .player(PLAYER_B, 2, 0, "B", ":b.1", "1")
                .hit(100, PLAYER_A, 7, 0, 1, 10)
                .stateChange(150, PLAYER_A, 7)
                .stateChange(180, PLAYER_B, 6)
                .hit(200, PLAYER_B, 7, 0, 1, 10)
                .stateChange(220, PLAYER_B, 7)
                .stateChange(280, PLAYER_A, 6)
                .hit(300, PLAYER_A, 7, 0, 1, 10);
        Map<Long, Agent> agents = assertDoesNotThrow(() -> byAddr(build(log, new DecodeWarnings())));

        assertEquals(List.of(new AwareInterval(7, 100, 101), new AwareInterval(7, 300, 301)),
                agents.get(PLAYER_A).getAwareIntervals());
        assertEquals(List.of(new AwareInterval(7, 200, 201)), agents.get(PLAYER_B).getAwareIntervals());
    }

    @Test
    @DisplayName("未知地址与重复地址不影响其余参与者")
    void testUnknownAndDuplicateAddress() {
        DecodeWarnings warnings = new DecodeWarnings();
        EvtcTestLogBuilder log = new EvtcTestLogBuilder()
                .player(PLAYER_A, 1, 0, "A", ":a.1", "1")
                .npc(PLAYER_A, 1000, "Duplicate")
                .hit(100, 0xDEAD, 7, PLAYER_A, 1, 10)
                .event(new EventRecord().time(110).src(0xBEEF).srcInst(9).srcMaster(3));
        DomainGraph graph = build(log, warnings);

        assertEquals(1, graph.getAgents().size());
        assertTrue(graph.getAgents().get(0).isPlayer());
        assertTrue(graph.getAgents().get(0).getAwareIntervals().isEmpty());
        assertEquals(2, graph.getRawEvents().size());
        assertEquals(DecodeWarningEnum.DUPLICATE_ADDRESS, warnings.toList().get(0).getType());
    }
}
