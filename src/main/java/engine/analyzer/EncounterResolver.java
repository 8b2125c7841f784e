package engine.analyzer;

import common.consts.BossEnum;
import common.consts.EncounterEnum;
import model.entity.Agent;
import model.entity.Log;
import org.springframework.stereotype.Component;

/**
 * 由文件头内容 id 与参与者组成确定战斗
 * 先看文件头；文件头不是首领时按参与者表顺序找第一个首领种类的 NPC
 */
@Component
public class EncounterResolver {

    /**
     * @return 无法识别时返回 null
     */
    public EncounterEnum resolve(Log log) {
        BossEnum boss = BossEnum.getByCode(log.getContentId());
        if (boss != null) {
            return boss.getEncounter();
        }
        for (Agent agent : log.getAgents()) {
            int species = agent.getSpeciesId();
            if (species < 0) {
                continue;
            }
            boss = BossEnum.getByCode(species);
            if (boss != null) {
                return boss.getEncounter();
            }
        }
        return null;
    }
}
