package common.exception;

import common.Result;
import common.consts.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理器
 * 解析失败返回错误类型与字节偏移，其他异常统一包装为 Result
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 日志结构性错误
     */
    @ExceptionHandler(EvtcParseException.class)
    public Result handleParseException(EvtcParseException e) {
        log.warn("日志解析失败 [{}]: {}", e.getErrorType(), e.getMessage());
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("errorType", e.getErrorType());
        detail.put("offset", e.getOffset());
        detail.put("expected", e.getExpected());
        detail.put("available", e.getAvailable());
        return Result.error(ErrorCodes.PARSE_ERROR_CODE, ErrorCodes.PARSE_FAILED + ": " + e.getMessage(), detail);
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public Result handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return Result.error(e.getCode(), e.getMessage());
    }

    @ExceptionHandler({MultipartException.class, IOException.class, UncheckedIOException.class,
            IllegalArgumentException.class})
    public Result handleBadRequest(Exception e) {
        log.warn("请求无效: {}", e.getMessage());
        return Result.error(ErrorCodes.BAD_REQUEST_CODE, e.getMessage());
    }

    /**
     * 处理所有其他异常
     */
    @ExceptionHandler(Exception.class)
    public Result handleException(Exception e) {
        log.error("系统异常", e);
        return Result.error(ErrorCodes.SYSTEM_ERROR + ": " + e.getMessage());
    }
}
