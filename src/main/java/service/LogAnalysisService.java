package service;

import model.dto.response.AnalyzeResp;
import model.entity.Log;

import java.io.InputStream;

/**
 * 日志解析与战斗分析服务
 */
public interface LogAnalysisService {

    /**
     * 解析并分析一份日志，返回战斗摘要
     */
    AnalyzeResp analyze(String fileName, InputStream input);

    /**
     * 只解析，返回完整的日志模型
     */
    Log parse(InputStream input);
}
