package common.exception;

import common.consts.DecodeErrorEnum;

/**
 * 日志结构性错误，整个解析中止，不返回部分结果
 * 携带字节偏移与期望/实际长度，便于定位损坏的日志
 */
public class EvtcParseException extends RuntimeException {
    private final DecodeErrorEnum errorType;
    private final long offset;
    private final long expected;
    private final long available;

    public EvtcParseException(DecodeErrorEnum errorType, String message, long offset, long expected, long available) {
        super(message);
        this.errorType = errorType;
        this.offset = offset;
        this.expected = expected;
        this.available = available;
    }

    public static EvtcParseException badMagic(long available) {
        return new EvtcParseException(DecodeErrorEnum.BAD_MAGIC,
                DecodeErrorEnum.BAD_MAGIC.getDesc(), 0, 4, available);
    }

    public static EvtcParseException truncated(String section, long offset, long expected, long available) {
        String message = String.format("%s: %s 在偏移 %d 处需要 %d 字节，剩余 %d 字节",
                DecodeErrorEnum.TRUNCATED.getDesc(), section, offset, expected, available);
        return new EvtcParseException(DecodeErrorEnum.TRUNCATED, message, offset, expected, available);
    }

    /**
     * 时间以 offset 字段携带，冲突双方地址写入消息
     */
    public static EvtcParseException instanceConflict(int instanceId, long firstAddr, long secondAddr, long time) {
        String message = String.format("%s: 实例号 %d 在 %d ms 同时属于 0x%X 与 0x%X",
                DecodeErrorEnum.INSTANCE_CONFLICT.getDesc(), instanceId, time, firstAddr, secondAddr);
        return new EvtcParseException(DecodeErrorEnum.INSTANCE_CONFLICT, message, time, 0, 0);
    }

    public DecodeErrorEnum getErrorType() {
        return errorType;
    }

    public long getOffset() {
        return offset;
    }

    public long getExpected() {
        return expected;
    }

    public long getAvailable() {
        return available;
    }
}
