package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 战斗分析参数配置
 * 与“判定容忍度”相关的常量统一从这里集中管理，可以通过 Spring 配置文件覆盖：
 *
 * evtc.analyzer.exit-safety-margin-ms
 * evtc.analyzer.duplicate-buff-window-ms
 * evtc.analyzer.trigger-catalog
 */
@Configuration
@ConfigurationProperties(prefix = "evtc.analyzer")
@Data
public class AnalyzerConfig {

    /**
     * 玩家脱战必须晚于首领脱战的最小间隔 (毫秒)
     */
    private long exitSafetyMarginMs = 1000;

    /**
     * 同一目标两次增益施加间隔不超过该值时视为重复记录 (毫秒)
     */
    private long duplicateBuffWindowMs = 50;

    /**
     * 各战斗触发条件表的 classpath 位置
     */
    private String triggerCatalog = "encounter-triggers.json";
}
