package service.source;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * 支持未压缩的 .evtc 与单条目 zip 的 .zevtc
 * 以 zip 本地文件头签名判断，不依赖文件扩展名
 */
@Component
@Slf4j
public class ContainerAwareLogByteSource implements LogByteSource {

    private static final byte[] ZIP_SIGNATURE = {0x50, 0x4B, 0x03, 0x04};

    @Override
    public byte[] read(InputStream input) throws IOException {
        byte[] data = input.readAllBytes();
        if (!isZip(data)) {
            return data;
        }
        try (ZipArchiveInputStream zip = new ZipArchiveInputStream(new ByteArrayInputStream(data))) {
            ZipArchiveEntry entry = zip.getNextZipEntry();
            while (entry != null && entry.isDirectory()) {
                entry = zip.getNextZipEntry();
            }
            if (entry == null) {
                throw new BusinessException(ErrorCodes.EMPTY_ARCHIVE);
            }
            byte[] inner = zip.readAllBytes();
            log.debug("解压日志条目 {}: {} -> {} 字节", entry.getName(), data.length, inner.length);
            return inner;
        }
    }

    static boolean isZip(byte[] data) {
        if (data.length < ZIP_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < ZIP_SIGNATURE.length; i++) {
            if (data[i] != ZIP_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }
}
