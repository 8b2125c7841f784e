package common.exception;

import common.consts.ErrorCodes;

/**
 * 请求层面的业务异常，如上传为空、压缩包内没有日志
 */
public class BusinessException extends RuntimeException {
    private final int code;

    public BusinessException(String message) {
        this(ErrorCodes.BAD_REQUEST_CODE, message);
    }

    public BusinessException(int code, String message) {
        super(message);
        this.code = code;
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
        this.code = ErrorCodes.BAD_REQUEST_CODE;
    }

    public int getCode() {
        return code;
    }
}
