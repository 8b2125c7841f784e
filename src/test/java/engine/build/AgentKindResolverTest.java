package engine.build;

import common.consts.AgentKindEnum;
import common.consts.DecodeWarningEnum;
import common.consts.EliteSpecEnum;
import common.consts.ProfessionEnum;
import engine.EvtcTestLogBuilder;
import model.bo.DecodeWarnings;
import model.entity.AgentKind;
import model.entity.Gadget;
import model.entity.NpcCharacter;
import model.entity.Player;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("参与者类别判定测试")
class AgentKindResolverTest {

    private static final long ALL = AgentKindResolver.ALL_BITS_SET;

    @Test
    @DisplayName("elite 与 prof 高位组合决定类别")
    void testClassify() {
        assertEquals(AgentKindEnum.GADGET, AgentKindResolver.classify(0xFFFF1234L, ALL));
        assertEquals(AgentKindEnum.CHARACTER, AgentKindResolver.classify(0x00001234L, ALL));
        assertEquals(AgentKindEnum.CHARACTER, AgentKindResolver.classify(0x00011234L, ALL));
        assertEquals(AgentKindEnum.PLAYER, AgentKindResolver.classify(1, 0));
        assertEquals(AgentKindEnum.PLAYER, AgentKindResolver.classify(0xFFFF0001L, 55));
    }

    @Test
    @DisplayName("NPC 与装置取 prof 低 16 位")
    void testNpcAndGadget() {
        DecodeWarnings warnings = new DecodeWarnings();
        AgentKind npc = AgentKindResolver.resolve(0x00024D37L, ALL, EvtcTestLogBuilder.name("Soulless Horror"), warnings);
        AgentKind gadget = AgentKindResolver.resolve(0xFFFF0042L, ALL, EvtcTestLogBuilder.name("Deimos"), warnings);

        NpcCharacter character = assertInstanceOf(NpcCharacter.class, npc);
        assertEquals(0x4D37, character.getSpeciesId());
        assertEquals("Soulless Horror", character.getName());
        Gadget g = assertInstanceOf(Gadget.class, gadget);
        assertEquals(0x42, g.getVolatileId());
        assertEquals("Deimos", g.getName());
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("玩家名称拆分为角色名、账号名与小队号")
    void testPlayerName() {
        DecodeWarnings warnings = new DecodeWarnings();
        byte[] name = EvtcTestLogBuilder.playerName("Zhang Wei", ":zhang.1234", "3");
        Player player = assertInstanceOf(Player.class, AgentKindResolver.resolve(1, 27, name, warnings));

        assertEquals("Zhang Wei", player.getCharacterName());
        assertEquals(":zhang.1234", player.getAccountName());
        assertEquals(3, player.getSubgroup());
        assertEquals(ProfessionEnum.GUARDIAN, player.getProfession());
        assertEquals(EliteSpecEnum.DRAGONHUNTER, player.getEliteSpec());
        assertTrue(warnings.isEmpty());
    }

    @Test
    @DisplayName("无效小队号告警并置 0")
    void testInvalidSubgroup() {
        DecodeWarnings warnings = new DecodeWarnings();
        byte[] name = EvtcTestLogBuilder.playerName("A", ":a.1", "x");
        Player player = assertInstanceOf(Player.class, AgentKindResolver.resolve(1, 0, name, warnings));

        assertEquals(0, player.getSubgroup());
        assertEquals(DecodeWarningEnum.INVALID_TEXT, warnings.toList().get(0).getType());
    }
}
