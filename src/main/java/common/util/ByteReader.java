package common.util;

import common.exception.EvtcParseException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * 小端字节游标
 * 所有读取前先检查剩余长度，不足时抛出 TRUNCATED 并带上当前偏移
 */
public final class ByteReader {

    private final ByteBuffer buffer;

    public ByteReader(byte[] data) {
        this.buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    public int position() {
        return buffer.position();
    }

    public int remaining() {
        return buffer.remaining();
    }

    public boolean hasRemaining() {
        return buffer.hasRemaining();
    }

    /**
     * 确认还剩 count 个定长记录
     */
    public void requireRecords(String section, long count, int recordSize) {
        require(section, count * recordSize);
    }

    public void require(String section, long length) {
        if (buffer.remaining() < length) {
            throw EvtcParseException.truncated(section, buffer.position(), length, buffer.remaining());
        }
    }

    public int u8(String section) {
        require(section, 1);
        return buffer.get() & 0xFF;
    }

    public int u16(String section) {
        require(section, 2);
        return buffer.getShort() & 0xFFFF;
    }

    public short i16(String section) {
        require(section, 2);
        return buffer.getShort();
    }

    public long u32(String section) {
        require(section, 4);
        return buffer.getInt() & 0xFFFFFFFFL;
    }

    public int i32(String section) {
        require(section, 4);
        return buffer.getInt();
    }

    /**
     * 无符号 64 位按位保存在 long 中，比较时使用 Long.compareUnsigned
     */
    public long u64(String section) {
        require(section, 8);
        return buffer.getLong();
    }

    public byte[] bytes(String section, int length) {
        require(section, length);
        byte[] out = new byte[length];
        buffer.get(out);
        return out;
    }

    public void skip(String section, int length) {
        require(section, length);
        buffer.position(buffer.position() + length);
    }
}
