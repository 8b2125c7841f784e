package common.util;

import java.time.Instant;

/**
 * 日志时间换算工具
 * 事件时间为 arcdps 本地毫秒计时，服务器时间为 Unix 秒
 */
public final class TimeUtil {

    private TimeUtil() {}

    /** 毫秒时长转可读文本，如 4m 05.120s */
    public static String formatDuration(long durationMs) {
        if (durationMs < 0) {
            durationMs = 0;
        }
        long min = durationMs / 60_000;
        long sec = (durationMs % 60_000) / 1000;
        long ms = durationMs % 1000;
        if (min == 0) {
            return sec + "." + String.format("%03d", ms) + "s";
        }
        return min + "m " + String.format("%02d", sec) + "." + String.format("%03d", ms) + "s";
    }

    /** 日志开始标记中的服务器时间（u32 秒） */
    public static Instant fromServerSeconds(long serverSeconds) {
        return Instant.ofEpochSecond(serverSeconds & 0xFFFFFFFFL);
    }
}
