package service.source;

import java.io.IOException;
import java.io.InputStream;

/**
 * 日志字节来源，负责去掉文件容器，只交出 EVTC 原始字节
 */
public interface LogByteSource {

    /**
     * 读取完整日志内容
     * @param input 上传或磁盘上的文件流，由调用方关闭
     * @return 以 EVTC 魔数开头的原始字节（是否合法交给解码器判断）
     */
    byte[] read(InputStream input) throws IOException;
}
