package org.csits.mss.manager.chunk;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * 单个文件的去重结果。失败时 error 有值，计数均为 0。
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeduplicationResult {

    String filePath;

    int totalChunks;

    int newChunks;

    int duplicateChunks;

    long totalSize;

    /**
     * 因重复而未写入的字节数。
     */
    long savedSize;

    /**
     * savedSize / totalSize，totalSize 为 0 时为 0。
     */
    double deduplicationRatio;

    String error;

    public boolean isSuccess() {
        return error == null;
    }

    public static DeduplicationResult failed(String filePath, String error) {
        return DeduplicationResult.builder().filePath(filePath).error(error).build();
    }
}
