package org.csits.mss.manager.compression;

import java.nio.file.Path;

/**
 * 单文件压缩与解压。
 * 所有方法都不向调用方抛出异常：压缩失败返回带 error 的结果，解压失败返回 false。
 */
public interface CompressionManager {

    /**
     * 使用指定算法和级别（1-9）压缩文件。
     */
    CompressionResult compress(Path input, Path output, CompressionAlgorithm algorithm, int level);

    /**
     * 按名称选择算法压缩文件，未知算法返回带 error 的结果，不会退化为其他算法。
     */
    CompressionResult compress(Path input, Path output, String algorithm, int level);

    /**
     * 解压文件到 output。
     *
     * @return 是否成功
     */
    boolean decompress(Path input, Path output, CompressionAlgorithm algorithm);

    boolean decompress(Path input, Path output, String algorithm);
}
