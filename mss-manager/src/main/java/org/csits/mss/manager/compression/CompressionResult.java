package org.csits.mss.manager.compression;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * 单次压缩结果。失败时只有 error 字段有值。
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompressionResult {

    Long originalSize;

    Long compressedSize;

    /**
     * 原始大小 / 压缩后大小，压缩后大小为 0 时为 0。
     */
    Double compressionRatio;

    String algorithm;

    String outputPath;

    String error;

    public boolean isSuccess() {
        return error == null;
    }

    public static CompressionResult failed(String error) {
        return CompressionResult.builder().error(error).build();
    }

    public static double ratio(long originalSize, long compressedSize) {
        return compressedSize > 0 ? (double) originalSize / compressedSize : 0.0;
    }
}
