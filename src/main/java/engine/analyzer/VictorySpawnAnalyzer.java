package engine.analyzer;

import common.config.AnalyzerConfig;
import common.consts.EncounterEnum;
import common.consts.StateChangeEnum;
import model.bo.EncounterTrigger;
import model.entity.Agent;
import model.entity.Event;
import model.entity.Log;
import model.entity.payload.StateChangePayload;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 特定 NPC 出现即胜利，如 Conjured Amalgamate 击败后出现的 Zommoros
 */
@Component
public class VictorySpawnAnalyzer extends AbstractEncounterAnalyzer<VictorySpawnAnalyzer.SpawnTracker> {

    private static final Set<EncounterEnum> ENCOUNTERS =
            Collections.unmodifiableSet(EnumSet.of(EncounterEnum.CONJURED_AMALGAMATE));

    public VictorySpawnAnalyzer(TriggerCatalog catalog, AnalyzerConfig config) {
        super(catalog, config);
    }

    @Override
    public Set<EncounterEnum> getEncounters() {
        return ENCOUNTERS;
    }

    @Override
    protected SpawnTracker newTracker(Log log, EncounterEnum encounter, EncounterTrigger trigger) {
        return new SpawnTracker(log, encounter, trigger);
    }

    @Override
    protected boolean isVictory(SpawnTracker tracker) {
        return tracker.victorySpawned;
    }

    static class SpawnTracker extends EncounterTracker {
        private boolean victorySpawned;

        SpawnTracker(Log log, EncounterEnum encounter, EncounterTrigger trigger) {
            super(log, encounter, trigger);
        }

        @Override
        protected void onStateChange(Event event, StateChangePayload payload) {
            Integer species = trigger.getVictorySpecies();
            if (species == null || payload.getStateChange() != StateChangeEnum.SPAWN) {
                return;
            }
            Agent agent = log.findAgent(payload.getAgentAddr());
            if (agent != null && agent.getSpeciesId() == species) {
                victorySpawned = true;
            }
        }
    }
}
