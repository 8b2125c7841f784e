package engine.analyzer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import common.config.AnalyzerConfig;
import common.consts.EncounterEnum;
import lombok.extern.slf4j.Slf4j;
import model.bo.EncounterTrigger;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 各战斗的经验触发条件表，启动时加载一次，运行期只读
 */
@Component
@Slf4j
public class TriggerCatalog implements InitializingBean {

    private static final EncounterTrigger NO_TRIGGER = new EncounterTrigger();

    private final ObjectMapper objectMapper;
    private final AnalyzerConfig config;
    private Map<EncounterEnum, EncounterTrigger> triggers = Collections.emptyMap();

    public TriggerCatalog(ObjectMapper objectMapper, AnalyzerConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public void afterPropertiesSet() throws IOException {
        ClassPathResource resource = new ClassPathResource(config.getTriggerCatalog());
        Map<String, EncounterTrigger> raw;
        try (InputStream in = resource.getInputStream()) {
            raw = objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, EncounterTrigger>>() {
            });
        }
        Map<EncounterEnum, EncounterTrigger> loaded = new EnumMap<>(EncounterEnum.class);
        for (Map.Entry<String, EncounterTrigger> entry : raw.entrySet()) {
            EncounterEnum encounter;
            try {
                encounter = EncounterEnum.valueOf(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("触发条件表中存在未知战斗: " + entry.getKey(), e);
            }
            loaded.put(encounter, entry.getValue());
        }
        triggers = Collections.unmodifiableMap(loaded);
        log.info("加载战斗触发条件 {} 条 ({})", triggers.size(), config.getTriggerCatalog());
    }

    /**
     * 未登记的战斗返回空条件：没有挑战模式，也没有特殊胜利条件
     */
    public EncounterTrigger get(EncounterEnum encounter) {
        EncounterTrigger trigger = triggers.get(encounter);
        return trigger != null ? trigger : NO_TRIGGER;
    }
}
