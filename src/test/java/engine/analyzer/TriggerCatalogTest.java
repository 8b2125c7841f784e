package engine.analyzer;

import common.config.AnalyzerConfig;
import common.config.JacksonConfig;
import common.consts.EncounterEnum;
import model.bo.EncounterTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("战斗触发条件表测试")
class TriggerCatalogTest {

    private TriggerCatalog catalog;

    @BeforeEach
    void setUp() throws Exception {
        catalog = new TriggerCatalog(JacksonConfig.create(), new AnalyzerConfig());
        catalog.afterPropertiesSet();
    }

    @Test
    @DisplayName("按字段加载触发条件")
    void testLoad() {
        EncounterTrigger skorvald = catalog.get(EncounterEnum.SKORVALD);
        assertEquals(5551340L, skorvald.getChallengeHealth());
        assertEquals(List.of(17599, 17673, 17770, 17851), skorvald.getChallengeSpecies());
        assertTrue(skorvald.hasChallengeRule());

        EncounterTrigger ai = catalog.get(EncounterEnum.AI);
        assertTrue(ai.isAlwaysChallenge());
        assertEquals(895L, ai.getVictoryBuff());
    }

    @Test
    @DisplayName("加载后的触发条件不可修改")
    void testReadOnly() {
        EncounterTrigger skorvald = catalog.get(EncounterEnum.SKORVALD);
        assertThrows(UnsupportedOperationException.class, () -> skorvald.getChallengeSpecies().add(1));
        assertThrows(UnsupportedOperationException.class, () -> skorvald.getChallengeSpecies().clear());
        assertEquals(4, catalog.get(EncounterEnum.SKORVALD).getChallengeSpecies().size());
    }
}
