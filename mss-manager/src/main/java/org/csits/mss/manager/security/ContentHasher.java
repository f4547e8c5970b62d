package org.csits.mss.manager.security;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 内容寻址摘要抽象，所有块、副本与目录条目均以 SHA-256 十六进制串标识。
 */
public interface ContentHasher {

    /**
     * 流式计算文件的 SHA-256 摘要。
     */
    String sha256(Path file) throws IOException;

    /**
     * 计算字节区间的 SHA-256 摘要。
     */
    String sha256(byte[] data, int offset, int length);

    default String sha256(byte[] data) {
        return sha256(data, 0, data.length);
    }
}
