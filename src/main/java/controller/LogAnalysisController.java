package controller;

import common.Result;
import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import model.dto.response.AnalyzeResp;
import model.entity.Log;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import service.LogAnalysisService;

import java.io.IOException;
import java.io.InputStream;

/**
 * 日志上传接口，支持 .evtc 与 .zevtc
 */
@RestController
@RequestMapping("/evtc")
@Slf4j
public class LogAnalysisController {

    @Autowired
    private LogAnalysisService logAnalysisService;

    /**
     * 解析并判定战斗结果
     */
    @PostMapping("/analyze")
    public Result analyze(@RequestParam("file") MultipartFile file) throws IOException {
        requireContent(file);
        log.info("收到日志分析请求: {}, {} 字节", file.getOriginalFilename(), file.getSize());
        try (InputStream input = file.getInputStream()) {
            AnalyzeResp resp = logAnalysisService.analyze(file.getOriginalFilename(), input);
            return Result.success(resp);
        }
    }

    /**
     * 返回完整的日志模型（参与者、技能、分类后的事件）
     */
    @PostMapping("/log")
    public Result parse(@RequestParam("file") MultipartFile file) throws IOException {
        requireContent(file);
        log.info("收到日志解析请求: {}, {} 字节", file.getOriginalFilename(), file.getSize());
        try (InputStream input = file.getInputStream()) {
            Log combatLog = logAnalysisService.parse(input);
            return Result.success(combatLog);
        }
    }

    private void requireContent(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new BusinessException(ErrorCodes.EMPTY_UPLOAD);
        }
    }
}
