package org.csits.mss.server.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.csits.mss.server.constants.StageName;

/**
 * 单个文件经过存储流水线后的记录，创建后不可变。
 */
@Value
@Builder
public class PipelineRecord {

    String originalFile;

    long originalSize;

    @Singular
    List<StageResult> stages;

    String contentId;

    /**
     * 写入本记录后的累计逻辑容量（字节）。
     */
    long totalSize;

    double totalSizeTb;

    double capacityUsedPercent;

    LocalDateTime storedAt;

    public Optional<StageResult> findStage(StageName stageName) {
        return stages.stream().filter(s -> s.getStageName() == stageName).findFirst();
    }
}
