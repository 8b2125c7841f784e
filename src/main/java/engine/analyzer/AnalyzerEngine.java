package engine.analyzer;

import common.consts.EncounterEnum;
import lombok.extern.slf4j.Slf4j;
import model.bo.AnalysisResult;
import model.entity.Log;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 战斗 -> 分析器 注册表
 * 启动时由 Spring 注入的分析器列表构建一次，之后只读，可被多个线程同时使用
 */
@Component
@Slf4j
public class AnalyzerEngine implements InitializingBean {

    private final List<EncounterAnalyzer> analyzerBeans;
    private final GenericFallbackAnalyzer fallback;
    private final EncounterResolver resolver;
    private Map<EncounterEnum, EncounterAnalyzer> registry = Collections.emptyMap();

    public AnalyzerEngine(List<EncounterAnalyzer> analyzerBeans, GenericFallbackAnalyzer fallback,
                          EncounterResolver resolver) {
        this.analyzerBeans = analyzerBeans;
        this.fallback = fallback;
        this.resolver = resolver;
    }

    @Override
    public void afterPropertiesSet() {
        Map<EncounterEnum, EncounterAnalyzer> map = new EnumMap<>(EncounterEnum.class);
        for (EncounterAnalyzer analyzer : analyzerBeans) {
            for (EncounterEnum encounter : analyzer.getEncounters()) {
                EncounterAnalyzer previous = map.put(encounter, analyzer);
                if (previous != null && previous != analyzer) {
                    throw new IllegalStateException("战斗 " + encounter + " 注册了多个分析器: "
                            + previous.getClass().getSimpleName() + ", " + analyzer.getClass().getSimpleName());
                }
            }
        }
        registry = Collections.unmodifiableMap(map);
        log.info("注册战斗分析器 {} 个，覆盖战斗 {}/{}", analyzerBeans.size(), registry.size(),
                EncounterEnum.values().length);
    }

    public AnalysisResult analyze(Log combatLog) {
        EncounterEnum encounter = resolver.resolve(combatLog);
        AnalysisResult result = analyzerFor(encounter).analyze(combatLog, encounter);
        log.debug("分析完成: encounter={}, outcome={}, challenge={}",
                encounter, result.getOutcome(), result.getChallengeStatus());
        return result;
    }

    public EncounterAnalyzer analyzerFor(EncounterEnum encounter) {
        if (encounter == null) {
            return fallback;
        }
        return registry.getOrDefault(encounter, fallback);
    }
}
