package common.consts;

/**
 * 全局错误信息与错误码常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";
    public static final int PARSE_ERROR_CODE = 422;
    public static final int BAD_REQUEST_CODE = 400;

    // 上传错误
    public static final String EMPTY_UPLOAD = "上传的日志文件为空";
    public static final String EMPTY_ARCHIVE = "压缩包中没有日志条目";
    public static final String READ_FAILED = "读取日志文件失败";

    // 解析错误
    public static final String PARSE_FAILED = "日志解析失败";
}
