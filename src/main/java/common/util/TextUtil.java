package common.util;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 定长名称缓冲区的文本解码
 * 在第一个 NUL 或缓冲区末尾停止，NUL 之后的字节不参与解码
 */
public final class TextUtil {

    private TextUtil() {}

    /**
     * 解码结果：valid = false 时 text 为有效前缀
     */
    @Getter
    @AllArgsConstructor
    public static class DecodedText {
        private final String text;
        private final boolean valid;
        // 下一个字段的起始位置（NUL 之后）
        private final int next;
    }

    public static int indexOfNul(byte[] buf, int from, int to) {
        for (int i = from; i < to; i++) {
            if (buf[i] == 0) {
                return i;
            }
        }
        return -1;
    }

    public static DecodedText decode(byte[] buf) {
        return decode(buf, 0, buf.length);
    }

    /**
     * 解码 [from, to) 中第一个 NUL 之前的 UTF-8 文本
     */
    public static DecodedText decode(byte[] buf, int from, int to) {
        if (from >= to) {
            return new DecodedText("", true, to);
        }
        int nul = indexOfNul(buf, from, to);
        int end = nul < 0 ? to : nul;
        int next = nul < 0 ? to : nul + 1;

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(buf, from, end - from);
        CharBuffer out = CharBuffer.allocate(end - from);
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        out.flip();
        return new DecodedText(out.toString(), !result.isError(), next);
    }
}
