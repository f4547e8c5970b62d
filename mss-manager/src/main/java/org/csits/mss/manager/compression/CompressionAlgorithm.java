package org.csits.mss.manager.compression;

import java.util.Locale;

/**
 * 支持的压缩算法。名称与配置文件中 compression.algorithm 字段一致。
 */
public enum CompressionAlgorithm {

    /**
     * 带 zlib 头的 deflate，默认算法。
     */
    DEFLATE("zlib", ".zz"),

    GZIP("gzip", ".gz"),

    /**
     * 压缩率更高、速度更慢。
     */
    BZIP2("bz2", ".bz2");

    public static final int MIN_LEVEL = 1;

    public static final int MAX_LEVEL = 9;

    private final String name;

    private final String extension;

    CompressionAlgorithm(String name, String extension) {
        this.name = name;
        this.extension = extension;
    }

    public String getName() {
        return name;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * 按名称解析算法，大小写不敏感，也接受枚举常量名（如 DEFLATE）。
     *
     * @throws IllegalArgumentException 未知算法
     */
    public static CompressionAlgorithm fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("压缩算法不能为空");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (CompressionAlgorithm algorithm : values()) {
            if (algorithm.name.equals(key) || algorithm.name().toLowerCase(Locale.ROOT).equals(key)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown compression algorithm: " + name);
    }
}
