package org.csits.mss.server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.csits.mss.manager.chunk.ChunkStoreStats;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageStatistics {

    private int totalFiles;

    private long totalSizeBytes;

    private double totalSizeTb;

    private double maxSizeTb;

    private double capacityUsedPercent;

    private ChunkStoreStats deduplication;
}
