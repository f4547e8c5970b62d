package org.csits.mss.manager.chunk;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 块存储统计。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChunkStoreStats {

    /**
     * 全局唯一块数量。
     */
    private int totalChunks;

    /**
     * 已建立块索引的文件数量。
     */
    private int totalFiles;

    private int chunkSize;
}
