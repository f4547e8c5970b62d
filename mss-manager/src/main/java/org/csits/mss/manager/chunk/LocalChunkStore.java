package org.csits.mss.manager.chunk;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.csits.mss.manager.filesystem.FileSystemManager;
import org.csits.mss.manager.security.ContentHasher;

/**
 * 本地磁盘块存储。
 * 摘要到块路径的映射在同一实例处理的所有文件间共享，因此不同文件的相同块也只存一份。
 * 块一旦写入不会被删除。
 */
@Slf4j
public class LocalChunkStore implements ChunkStore {

    public static final int DEFAULT_CHUNK_SIZE = 4096;

    private final int chunkSize;

    private final ContentHasher contentHasher;

    private final FileSystemManager fileSystemManager;

    private final Map<String, Path> chunkLocations = new ConcurrentHashMap<>();

    private final Map<String, List<String>> fileIndex = new ConcurrentHashMap<>();

    /**
     * 保护"摘要是否已存在 -> 落盘 -> 登记"这一组操作。
     */
    private final Object persistLock = new Object();

    public LocalChunkStore(ContentHasher contentHasher, FileSystemManager fileSystemManager) {
        this(DEFAULT_CHUNK_SIZE, contentHasher, fileSystemManager);
    }

    public LocalChunkStore(int chunkSize, ContentHasher contentHasher, FileSystemManager fileSystemManager) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.contentHasher = contentHasher;
        this.fileSystemManager = fileSystemManager;
    }

    @Override
    public void forEachChunk(Path file, ChunkConsumer consumer) throws IOException {
        byte[] buffer = new byte[chunkSize];
        long offset = 0L;
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = IOUtils.read(in, buffer)) > 0) {
                byte[] data = read == chunkSize ? buffer.clone() : Arrays.copyOf(buffer, read);
                consumer.accept(new Chunk(contentHasher.sha256(data), offset, data));
                offset += read;
                if (read < chunkSize) {
                    break;
                }
            }
        }
    }

    @Override
    public List<Chunk> chunk(Path file) throws IOException {
        List<Chunk> chunks = new ArrayList<>();
        forEachChunk(file, chunks::add);
        return chunks;
    }

    @Override
    public DeduplicationResult deduplicate(Path file, Path storeDir) {
        String fileKey = keyOf(file);
        try {
            Path chunkDir = fileSystemManager.ensureDirectory(storeDir.resolve(CHUNK_DIR));
            List<String> digests = new ArrayList<>();
            Tally tally = new Tally();

            forEachChunk(file, chunk -> {
                digests.add(chunk.getDigest());
                tally.totalSize += chunk.length();
                if (persistIfAbsent(chunk, chunkDir)) {
                    tally.newChunks++;
                } else {
                    tally.duplicateChunks++;
                    tally.savedSize += chunk.length();
                }
            });

            List<String> previous = fileIndex.put(fileKey, Collections.unmodifiableList(digests));
            if (previous != null) {
                log.debug("覆盖已有块索引: {}", fileKey);
            }

            DeduplicationResult result = DeduplicationResult.builder()
                .filePath(fileKey)
                .totalChunks(digests.size())
                .newChunks(tally.newChunks)
                .duplicateChunks(tally.duplicateChunks)
                .totalSize(tally.totalSize)
                .savedSize(tally.savedSize)
                .deduplicationRatio(tally.totalSize > 0 ? (double) tally.savedSize / tally.totalSize : 0.0)
                .build();
            log.info("去重完成: file={}, chunks={}, new={}, duplicate={}, saved={}bytes",
                file.getFileName(), result.getTotalChunks(), result.getNewChunks(),
                result.getDuplicateChunks(), result.getSavedSize());
            return result;
        } catch (IOException e) {
            log.error("去重失败: {}", file, e);
            return DeduplicationResult.failed(fileKey, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public boolean reconstruct(Path fileKey, Path output) {
        List<String> digests = fileIndex.get(keyOf(fileKey));
        if (digests == null) {
            log.warn("未找到文件的块索引: {}", fileKey);
            return false;
        }
        try {
            fileSystemManager.writeAtomically(output, out -> {
                for (String digest : digests) {
                    Path chunkPath = chunkLocations.get(digest);
                    if (chunkPath == null || !Files.isRegularFile(chunkPath)) {
                        throw new IOException("Missing chunk " + digest);
                    }
                    Files.copy(chunkPath, out);
                }
            });
            log.info("文件还原完成: {} -> {}, chunks={}", fileKey.getFileName(), output, digests.size());
            return true;
        } catch (IOException e) {
            log.error("文件还原失败: {} -> {}: {}", fileKey, output, e.getMessage());
            return false;
        }
    }

    @Override
    public List<String> getChunkIndex(Path fileKey) {
        return fileIndex.getOrDefault(keyOf(fileKey), Collections.emptyList());
    }

    @Override
    public ChunkStoreStats stats() {
        return new ChunkStoreStats(chunkLocations.size(), fileIndex.size(), chunkSize);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * 摘要未登记时写入块文件并登记。
     *
     * @return 是否为新块
     */
    private boolean persistIfAbsent(Chunk chunk, Path chunkDir) throws IOException {
        synchronized (persistLock) {
            if (chunkLocations.containsKey(chunk.getDigest())) {
                return false;
            }
            Path chunkPath = chunkDir.resolve(chunk.getDigest());
            if (!Files.exists(chunkPath)) {
                fileSystemManager.writeAtomically(chunkPath, out -> out.write(chunk.getData()));
            }
            chunkLocations.put(chunk.getDigest(), chunkPath);
            return true;
        }
    }

    private static String keyOf(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }

    private static final class Tally {
        private int newChunks;
        private int duplicateChunks;
        private long totalSize;
        private long savedSize;
    }
}
