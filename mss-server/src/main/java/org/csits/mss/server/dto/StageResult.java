package org.csits.mss.server.dto;

import lombok.Builder;
import lombok.Value;
import org.csits.mss.server.constants.StageName;

/**
 * 流水线单个阶段的执行结果
 */
@Value
@Builder
public class StageResult {

    StageName stageName;

    /**
     * DeduplicationResult、CompressionResult 或 ReplicationResult，均为不可变对象。
     */
    Object result;

    long durationMs;

    public <T> T getResultAs(Class<T> type) {
        return type.cast(result);
    }
}
