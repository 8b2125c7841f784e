package common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一响应结构
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result {
    public static final int SUCCESS_CODE = 200;
    public static final int ERROR_CODE = 500;

    private Integer code; // 200成功，其余为错误码
    private String msg;
    private Object data;

    public static Result success(Object data) {
        return new Result(SUCCESS_CODE, "解析成功", data);
    }

    public static Result success(String msg, Object data) {
        return new Result(SUCCESS_CODE, msg, data);
    }

    public static Result error(String msg) {
        return new Result(ERROR_CODE, msg, null);
    }

    public static Result error(Integer code, String msg) {
        return new Result(code, msg, null);
    }

    // 带定位信息的错误，如解析失败的字节偏移
    public static Result error(Integer code, String msg, Object data) {
        return new Result(code, msg, data);
    }
}
