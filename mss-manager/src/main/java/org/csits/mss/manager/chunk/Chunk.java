package org.csits.mss.manager.chunk;

import lombok.Value;

/**
 * 文件中一个定长窗口（末块可能更短），以内容的 SHA-256 标识。
 */
@Value
public class Chunk {

    String digest;

    /**
     * 在源文件中的起始偏移。
     */
    long offset;

    byte[] data;

    public int length() {
        return data.length;
    }
}
