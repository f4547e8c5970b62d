package org.csits.mss.server.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.csits.mss.manager.chunk.ChunkStore;
import org.csits.mss.manager.chunk.DeduplicationResult;
import org.csits.mss.manager.compression.CompressionAlgorithm;
import org.csits.mss.manager.compression.CompressionManager;
import org.csits.mss.manager.compression.CompressionResult;
import org.csits.mss.manager.filesystem.FileSystemManager;
import org.csits.mss.manager.security.ContentHasher;
import org.csits.mss.server.constants.StageName;
import org.csits.mss.server.dto.CollectionStatistics;
import org.csits.mss.server.dto.PipelineRecord;
import org.csits.mss.server.dto.ReplicationResult;
import org.csits.mss.server.dto.StageResult;
import org.csits.mss.server.dto.StorageConfig;
import org.csits.mss.server.dto.StorageStatistics;
import org.springframework.stereotype.Service;

/**
 * 存储流水线服务
 * 固定顺序执行 去重 -> 压缩 -> 副本，阶段失败记录在结果中，不中断流水线。
 */
@Slf4j
@Service
public class StoragePipelineService {

    public static final String DEDUP_DIR = "deduplicated";

    public static final String COMPRESSED_DIR = "compressed";

    static final double BYTES_PER_TB = 1024d * 1024 * 1024 * 1024;

    private final ChunkStore chunkStore;

    private final CompressionManager compressionManager;

    private final ReplicationService replicationService;

    private final FileCatalogService fileCatalogService;

    private final FileSystemManager fileSystemManager;

    private final ContentHasher contentHasher;

    private final Path basePath;

    private final double maxCapacityTb;

    private final CompressionAlgorithm algorithm;

    private final int compressionLevel;

    private final int workers;

    private final AtomicLong totalSize = new AtomicLong(0);

    private final Map<String, PipelineRecord> registry = new ConcurrentHashMap<>();

    public StoragePipelineService(StorageConfig storageConfig, ChunkStore chunkStore,
                                  CompressionManager compressionManager, ReplicationService replicationService,
                                  FileCatalogService fileCatalogService, FileSystemManager fileSystemManager,
                                  ContentHasher contentHasher) {
        this.chunkStore = chunkStore;
        this.compressionManager = compressionManager;
        this.replicationService = replicationService;
        this.fileCatalogService = fileCatalogService;
        this.fileSystemManager = fileSystemManager;
        this.contentHasher = contentHasher;
        storageConfig.validate();
        this.basePath = Paths.get(storageConfig.getBasePath());
        this.maxCapacityTb = storageConfig.getMaxCapacityTb();
        if (maxCapacityTb <= 0) {
            throw new IllegalArgumentException("max_capacity_tb must be positive: " + maxCapacityTb);
        }

        StorageConfig.CompressionConfig compression = storageConfig.getCompression();
        this.algorithm = CompressionAlgorithm.fromName(compression.getAlgorithm());
        this.compressionLevel = compression.getLevel();
        if (compressionLevel < CompressionAlgorithm.MIN_LEVEL || compressionLevel > CompressionAlgorithm.MAX_LEVEL) {
            throw new IllegalArgumentException("Compression level must be between 1 and 9: " + compressionLevel);
        }
        this.workers = Math.max(1, storageConfig.getConcurrency().getWorkers());
        log.info("存储流水线初始化: base={}, 容量上限={}TB, 压缩={}/{}, 工作线程={}",
            basePath, maxCapacityTb, algorithm.getName(), compressionLevel, workers);
    }

    /**
     * 存储单个文件。
     *
     * @param file 待存储文件
     * @param dedup 是否分块去重
     * @param compress 是否压缩
     * @param replicate 是否写入副本
     * @return 不可变的流水线记录
     * @throws IOException 输入文件无法获取大小或计算摘要
     */
    public PipelineRecord storeFile(Path file, boolean dedup, boolean compress, boolean replicate)
        throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("输入文件不存在或不是普通文件: " + file);
        }
        long originalSize = Files.size(file);
        PipelineRecord.PipelineRecordBuilder builder = PipelineRecord.builder()
            .originalFile(file.toString())
            .originalSize(originalSize);
        Path activeFile = file;

        if (dedup) {
            long start = System.currentTimeMillis();
            DeduplicationResult result = chunkStore.deduplicate(file, basePath.resolve(DEDUP_DIR));
            builder.stage(stage(StageName.DEDUPLICATION, result, start));
            if (!result.isSuccess()) {
                log.warn("去重失败，继续后续阶段: file={}, error={}", file, result.getError());
            }
        }

        if (compress) {
            long start = System.currentTimeMillis();
            CompressionResult result = compressToBlob(activeFile);
            builder.stage(stage(StageName.COMPRESSION, result, start));
            if (result.isSuccess()) {
                activeFile = Paths.get(result.getOutputPath());
            } else {
                log.warn("压缩失败，使用原文件继续: file={}, error={}", file, result.getError());
            }
        }

        String contentId;
        if (replicate) {
            long start = System.currentTimeMillis();
            ReplicationResult result = replicationService.store(activeFile);
            builder.stage(stage(StageName.REPLICATION, result, start));
            contentId = result.getContentId();
        } else {
            contentId = contentHasher.sha256(activeFile);
        }

        long total = totalSize.addAndGet(originalSize);
        PipelineRecord record = builder
            .contentId(contentId)
            .totalSize(total)
            .totalSizeTb(total / BYTES_PER_TB)
            .capacityUsedPercent(capacityPercent(total))
            .storedAt(LocalDateTime.now())
            .build();

        PipelineRecord existing = registry.putIfAbsent(contentId, record);
        if (existing != null) {
            log.debug("内容已登记，保留首条记录: contentId={}", contentId);
        }
        log.info("文件存储完成: file={}, contentId={}, 阶段数={}, 容量占用={}%",
            file, contentId, record.getStages().size(), String.format("%.6f", record.getCapacityUsedPercent()));
        return record;
    }

    /**
     * 批量存储，使用固定大小线程池。单个文件失败只记录日志，不出现在返回列表中。
     */
    public List<PipelineRecord> storeFiles(List<Path> files, boolean dedup, boolean compress, boolean replicate) {
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        List<PipelineRecord> records = new ArrayList<>();
        try {
            List<Future<PipelineRecord>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(new Callable<PipelineRecord>() {
                    @Override
                    public PipelineRecord call() throws Exception {
                        return storeFile(file, dedup, compress, replicate);
                    }
                }));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    records.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.error("文件存储失败: {}", files.get(i), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            log.warn("批量存储被中断，已完成 {} 个", records.size());
            Thread.currentThread().interrupt();
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("批量存储完成: 成功 {}/{}", records.size(), files.size());
        return records;
    }

    /**
     * 收集整理后逐个存储本次归档出的文件（不写副本）。存储失败计入 errors。
     *
     * @throws IOException 遍历源目录失败
     */
    public CollectionStatistics smartCollection(Path source, boolean autoCategorize, boolean dedup,
                                                boolean compress) throws IOException {
        CollectionStatistics stats = fileCatalogService.collectAndOrganize(source, autoCategorize);
        if (!dedup && !compress) {
            return stats;
        }
        for (String storedPath : stats.getStoredPaths()) {
            try {
                storeFile(Paths.get(storedPath), dedup, compress, false);
            } catch (IOException e) {
                stats.recordError();
                log.warn("归档文件存储失败: {}", storedPath, e);
            }
        }
        return stats;
    }

    public StorageStatistics getStorageStats() {
        long total = totalSize.get();
        return StorageStatistics.builder()
            .totalFiles(registry.size())
            .totalSizeBytes(total)
            .totalSizeTb(total / BYTES_PER_TB)
            .maxSizeTb(maxCapacityTb)
            .capacityUsedPercent(capacityPercent(total))
            .deduplication(chunkStore.stats())
            .build();
    }

    public Optional<PipelineRecord> findRecord(String contentId) {
        return Optional.ofNullable(registry.get(contentId));
    }

    public ReplicationService getReplicationService() {
        return replicationService;
    }

    public ChunkStore getChunkStore() {
        return chunkStore;
    }

    private CompressionResult compressToBlob(Path input) {
        Path output;
        try {
            Path dir = fileSystemManager.ensureDirectory(basePath.resolve(COMPRESSED_DIR));
            output = Files.createTempFile(dir, "blob-", algorithm.getExtension());
        } catch (IOException e) {
            log.error("创建压缩输出文件失败: {}", basePath.resolve(COMPRESSED_DIR), e);
            return CompressionResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return compressionManager.compress(input, output, algorithm, compressionLevel);
    }

    private double capacityPercent(long total) {
        return total / (maxCapacityTb * BYTES_PER_TB) * 100;
    }

    private static StageResult stage(StageName name, Object result, long startMillis) {
        return StageResult.builder()
            .stageName(name)
            .result(result)
            .durationMs(System.currentTimeMillis() - startMillis)
            .build();
    }
}
