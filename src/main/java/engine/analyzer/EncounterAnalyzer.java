package engine.analyzer;

import common.consts.EncounterEnum;
import model.bo.AnalysisResult;
import model.entity.Log;

import java.util.Set;

/**
 * 战斗分析器扩展点
 * 新增战斗时只需新增实现类并在触发条件表中登记，无需修改 AnalyzerEngine 本身。
 * 实现必须是日志的纯函数：调用之间不共享可变状态
 */
public interface EncounterAnalyzer {

    /**
     * 该分析器负责的战斗
     */
    Set<EncounterEnum> getEncounters();

    /**
     * 单次有序遍历事件，给出胜负与挑战模式结论
     */
    AnalysisResult analyze(Log log, EncounterEnum encounter);
}
