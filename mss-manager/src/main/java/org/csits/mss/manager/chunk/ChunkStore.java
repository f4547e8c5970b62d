package org.csits.mss.manager.chunk;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 内容寻址的块存储：按定长切块，每个唯一块只落盘一次，并可按块索引还原文件。
 */
public interface ChunkStore {

    String CHUNK_DIR = "chunks";

    /**
     * 流式切块，同一时刻只持有一个窗口的数据。
     */
    void forEachChunk(Path file, ChunkConsumer consumer) throws IOException;

    /**
     * 切块并返回全部块。会把整个文件的数据放入返回列表，大文件请使用 {@link #forEachChunk}。
     */
    List<Chunk> chunk(Path file) throws IOException;

    /**
     * 去重存储文件，唯一块写入 storeDir/chunks/&lt;digest&gt;。
     * 不抛出异常，I/O 失败体现在结果的 error 字段。
     */
    DeduplicationResult deduplicate(Path file, Path storeDir);

    /**
     * 按文件的块索引还原到 output。索引不存在、块缺失或不可读时返回 false，且不会留下不完整的输出文件。
     */
    boolean reconstruct(Path fileKey, Path output);

    /**
     * 文件的有序块摘要列表，未处理过的文件返回空列表。
     */
    List<String> getChunkIndex(Path fileKey);

    ChunkStoreStats stats();

    @FunctionalInterface
    interface ChunkConsumer {
        void accept(Chunk chunk) throws IOException;
    }
}
