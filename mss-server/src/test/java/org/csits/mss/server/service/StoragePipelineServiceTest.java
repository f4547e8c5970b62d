package org.csits.mss.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.csits.mss.dao.InMemoryCatalogRepository;
import org.csits.mss.manager.chunk.ChunkStore;
import org.csits.mss.manager.chunk.DeduplicationResult;
import org.csits.mss.manager.chunk.LocalChunkStore;
import org.csits.mss.manager.compression.CompressionAlgorithm;
import org.csits.mss.manager.compression.CompressionManager;
import org.csits.mss.manager.compression.CompressionResult;
import org.csits.mss.manager.compression.LocalCompressionManager;
import org.csits.mss.manager.filesystem.LocalFileSystemManager;
import org.csits.mss.manager.security.BouncyCastleContentHasher;
import org.csits.mss.server.constants.ReplicaHealth;
import org.csits.mss.server.constants.StageName;
import org.csits.mss.server.dto.CollectionStatistics;
import org.csits.mss.server.dto.PipelineRecord;
import org.csits.mss.server.dto.ReplicationResult;
import org.csits.mss.server.dto.StageResult;
import org.csits.mss.server.dto.StorageConfig;
import org.csits.mss.server.dto.StorageStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StoragePipelineServiceTest {

    @TempDir
    Path tempDir;

    private final BouncyCastleContentHasher hasher = new BouncyCastleContentHasher();

    private final LocalFileSystemManager fileSystemManager = new LocalFileSystemManager();

    private StorageConfig config;

    private Path base;

    @BeforeEach
    void setUp() {
        base = tempDir.resolve("base");
        config = new StorageConfig();
        config.setBasePath(base.toString());
        config.getChunk().setSize(1024);
        config.getReplication().setLocations(Arrays.asList(
            tempDir.resolve("replica-1").toString(), tempDir.resolve("replica-2").toString()));
        config.getReplication().setFactor(2);
        config.getConcurrency().setWorkers(3);
    }

    @Test
    void storeFile_allStagesInFixedOrder() throws IOException {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path file = write("sample.txt", "Sample data ".repeat(1000));

        PipelineRecord record = pipeline.storeFile(file, true, true, true);

        assertThat(record.getStages()).extracting(StageResult::getStageName)
            .containsExactly(StageName.DEDUPLICATION, StageName.COMPRESSION, StageName.REPLICATION);
        assertThat(record.getOriginalFile()).isEqualTo(file.toString());
        assertThat(record.getOriginalSize()).isEqualTo(12_000L);

        DeduplicationResult dedup = record.findStage(StageName.DEDUPLICATION).get()
            .getResultAs(DeduplicationResult.class);
        assertThat(dedup.isSuccess()).isTrue();
        assertThat(base.resolve(StoragePipelineService.DEDUP_DIR).resolve(ChunkStore.CHUNK_DIR)).isDirectory();

        CompressionResult compression = record.findStage(StageName.COMPRESSION).get()
            .getResultAs(CompressionResult.class);
        assertThat(compression.isSuccess()).isTrue();
        Path blob = Paths.get(compression.getOutputPath());
        assertThat(blob.getParent()).isEqualTo(base.resolve(StoragePipelineService.COMPRESSED_DIR));

        ReplicationResult replication = record.findStage(StageName.REPLICATION).get()
            .getResultAs(ReplicationResult.class);
        assertThat(replication.getReplicationAchieved()).isEqualTo(2);
        // 复制的是压缩件，内容 ID 即压缩件摘要
        assertThat(record.getContentId()).isEqualTo(replication.getContentId()).isEqualTo(hasher.sha256(blob));
        assertThat(pipeline.getReplicationService().verify(record.getContentId()).getHealth())
            .isEqualTo(ReplicaHealth.GOOD);
    }

    @Test
    void storeFile_replicatedBlobRestoresOriginal() throws IOException {
        LocalCompressionManager compressionManager = new LocalCompressionManager();
        StoragePipelineService pipeline = newPipeline(compressionManager);
        Path file = write("restore.txt", "restore me ".repeat(500));

        PipelineRecord record = pipeline.storeFile(file, false, true, true);

        Path retrieved = tempDir.resolve("retrieved.zz");
        assertThat(pipeline.getReplicationService().retrieve(record.getContentId(), retrieved)).isTrue();
        Path restored = tempDir.resolve("restored.txt");
        assertThat(compressionManager.decompress(retrieved, restored, CompressionAlgorithm.DEFLATE)).isTrue();
        assertThat(restored).hasSameTextualContentAs(file);
    }

    @Test
    void storeFile_noStagesUsesHashOfOriginal() throws IOException {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path file = write("plain.bin", "plain");

        PipelineRecord record = pipeline.storeFile(file, false, false, false);

        assertThat(record.getStages()).isEmpty();
        assertThat(record.getContentId()).isEqualTo(hasher.sha256(file));
        assertThat(pipeline.findRecord(record.getContentId())).containsSame(record);
    }

    @Test
    void storeFile_compressionFailureKeepsOriginalAsActiveFile() throws IOException {
        CompressionManager failing = mock(CompressionManager.class);
        when(failing.compress(any(Path.class), any(Path.class), any(CompressionAlgorithm.class), anyInt()))
            .thenReturn(CompressionResult.failed("IOException: disk full"));
        StoragePipelineService pipeline = newPipeline(failing);
        Path file = write("data.json", "{\"k\":1}");

        PipelineRecord record = pipeline.storeFile(file, false, true, false);

        assertThat(record.getStages()).singleElement().satisfies(stage -> {
            assertThat(stage.getStageName()).isEqualTo(StageName.COMPRESSION);
            assertThat(stage.getResultAs(CompressionResult.class).getError()).isEqualTo("IOException: disk full");
        });
        assertThat(record.getContentId()).isEqualTo(hasher.sha256(file));
    }

    @Test
    void storeFile_eachCallWritesItsOwnCompressedBlob() throws IOException {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path a = write("a.txt", "alpha ".repeat(100));
        Path b = write("b.txt", "beta ".repeat(100));

        String blobA = pipeline.storeFile(a, false, true, false).findStage(StageName.COMPRESSION).get()
            .getResultAs(CompressionResult.class).getOutputPath();
        String blobB = pipeline.storeFile(b, false, true, false).findStage(StageName.COMPRESSION).get()
            .getResultAs(CompressionResult.class).getOutputPath();

        assertThat(blobA).isNotEqualTo(blobB);
        assertThat(Paths.get(blobA)).exists();
        assertThat(Paths.get(blobB)).exists();
    }

    @Test
    void storeFile_capacityAccountingUsesOriginalSizes() throws IOException {
        config.setMaxCapacityTb(1e-9);
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path first = write("first.bin", randomBytes(1000, 1));
        Path second = write("second.bin", randomBytes(3000, 2));

        pipeline.storeFile(first, true, true, false);
        PipelineRecord record = pipeline.storeFile(second, true, true, false);

        double maxBytes = 1e-9 * StoragePipelineService.BYTES_PER_TB;
        assertThat(record.getTotalSize()).isEqualTo(4000L);
        assertThat(record.getTotalSizeTb()).isCloseTo(4000 / StoragePipelineService.BYTES_PER_TB, within(1e-15));
        assertThat(record.getCapacityUsedPercent()).isCloseTo(4000 / maxBytes * 100, within(1e-6));

        StorageStatistics stats = pipeline.getStorageStats();
        assertThat(stats.getTotalFiles()).isEqualTo(2);
        assertThat(stats.getTotalSizeBytes()).isEqualTo(4000L);
        assertThat(stats.getMaxSizeTb()).isEqualTo(1e-9);
        assertThat(stats.getCapacityUsedPercent()).isCloseTo(record.getCapacityUsedPercent(), within(1e-9));
        assertThat(stats.getDeduplication().getTotalFiles()).isEqualTo(2);
        assertThat(stats.getDeduplication().getChunkSize()).isEqualTo(1024);
    }

    @Test
    void storeFile_sameContentKeepsFirstRecordButCountsSize() throws IOException {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path file = write("dup.txt", "duplicate");

        PipelineRecord first = pipeline.storeFile(file, false, false, false);
        PipelineRecord second = pipeline.storeFile(file, false, false, false);

        assertThat(second.getContentId()).isEqualTo(first.getContentId());
        assertThat(pipeline.findRecord(first.getContentId())).containsSame(first);
        assertThat(pipeline.getStorageStats().getTotalFiles()).isEqualTo(1);
        assertThat(pipeline.getStorageStats().getTotalSizeBytes()).isEqualTo(18L);
    }

    @Test
    void storeFile_missingInputThrows() {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());

        assertThatThrownBy(() -> pipeline.storeFile(tempDir.resolve("missing.txt"), true, true, true))
            .isInstanceOf(IOException.class);
        assertThat(pipeline.getStorageStats().getTotalSizeBytes()).isZero();
    }

    @Test
    void constructor_rejectsUnknownAlgorithmAndLevel() {
        config.getCompression().setAlgorithm("lz4");
        assertThatThrownBy(() -> newPipeline(new LocalCompressionManager()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("lz4");

        config.getCompression().setAlgorithm("gzip");
        config.getCompression().setLevel(0);
        assertThatThrownBy(() -> newPipeline(new LocalCompressionManager()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_rejectsMissingConfigValue() {
        config.setMaxCapacityTb(null);
        assertThatThrownBy(() -> newPipeline(new LocalCompressionManager()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max_capacity_tb");

        config.setMaxCapacityTb(1.0);
        config.getCompression().setLevel(null);
        assertThatThrownBy(() -> newPipeline(new LocalCompressionManager()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("compression.level");
    }

    @Test
    void storeFiles_isolatesFailures() throws IOException {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path a = write("a.csv", "1,2,3");
        Path b = write("b.csv", "4,5,6");
        Path missing = tempDir.resolve("gone.csv");

        List<PipelineRecord> records = pipeline.storeFiles(Arrays.asList(a, missing, b), true, true, true);

        assertThat(records).extracting(PipelineRecord::getOriginalFile)
            .containsExactly(a.toString(), b.toString());
        assertThat(pipeline.getStorageStats().getTotalFiles()).isEqualTo(2);
    }

    @Test
    void storeFiles_concurrentCallsShareChunkStore() throws IOException {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        byte[] shared = randomBytes(4096, 42);
        List<Path> files = Arrays.asList(
            write("c1.bin", shared), write("c2.bin", shared), write("c3.bin", shared), write("c4.bin", shared));

        List<PipelineRecord> records = pipeline.storeFiles(files, true, false, false);

        assertThat(records).hasSize(4);
        int newChunks = records.stream()
            .mapToInt(r -> r.findStage(StageName.DEDUPLICATION).get()
                .getResultAs(DeduplicationResult.class).getNewChunks())
            .sum();
        assertThat(newChunks).isEqualTo(4);
        assertThat(pipeline.getChunkStore().stats().getTotalChunks()).isEqualTo(4);
        assertThat(pipeline.getStorageStats().getTotalSizeBytes()).isEqualTo(4 * 4096L);
    }

    @Test
    void storeFiles_identicalFilesReplicateConcurrentlyWithoutFailures() throws IOException {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        byte[] shared = randomBytes(3000, 7);
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            files.add(write("same-" + i + ".bin", shared));
        }

        List<PipelineRecord> records = pipeline.storeFiles(files, false, false, true);

        assertThat(records).hasSize(12);
        for (PipelineRecord record : records) {
            ReplicationResult replication = record.findStage(StageName.REPLICATION).get()
                .getResultAs(ReplicationResult.class);
            assertThat(replication.getFailedLocations()).isEmpty();
            assertThat(replication.getReplicationAchieved()).isEqualTo(2);
        }
        String contentId = records.get(0).getContentId();
        assertThat(pipeline.getReplicationService().getLocations(contentId)).hasSize(2);
        assertThat(pipeline.getReplicationService().verify(contentId).getHealth()).isEqualTo(ReplicaHealth.GOOD);
    }

    @Test
    void storeFile_allReplicaTargetsFailingStillRecordsFile() throws IOException {
        // 两个副本位置都是普通文件
        Path blockedA = write("blocked-a", "x");
        Path blockedB = write("blocked-b", "y");
        config.getReplication().setLocations(Arrays.asList(blockedA.toString(), blockedB.toString()));
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path file = write("orphan.txt", "no replica available ".repeat(50));

        PipelineRecord record = pipeline.storeFile(file, true, true, true);

        ReplicationResult replication = record.findStage(StageName.REPLICATION).get()
            .getResultAs(ReplicationResult.class);
        assertThat(replication.getReplicationAchieved()).isZero();
        assertThat(replication.getStoredLocations()).isEmpty();
        assertThat(replication.getFailedLocations()).extracting(ReplicationResult.FailedLocation::getLocation)
            .containsExactly(blockedA.toString(), blockedB.toString());
        assertThat(record.getContentId()).isEqualTo(replication.getContentId());
        assertThat(record.getTotalSize()).isEqualTo(1050L);
        assertThat(pipeline.findRecord(record.getContentId())).containsSame(record);
        assertThat(pipeline.getStorageStats().getTotalFiles()).isEqualTo(1);
        assertThat(pipeline.getStorageStats().getTotalSizeBytes()).isEqualTo(1050L);
        assertThat(pipeline.getReplicationService().verify(record.getContentId()).getHealth())
            .isEqualTo(ReplicaHealth.FAILED);
    }

    @Test
    void storeFile_registeredRecordCannotBeModified() throws IOException {
        config.getReplication().setLocations(Arrays.asList(
            tempDir.resolve("replica-1").toString(), tempDir.resolve("blocked").toString()));
        write("blocked", "not a directory");
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path file = write("frozen.txt", "frozen ".repeat(200));

        PipelineRecord stored = pipeline.storeFile(file, true, true, true);
        PipelineRecord registered = pipeline.findRecord(stored.getContentId()).get();
        ReplicationResult replication = registered.findStage(StageName.REPLICATION).get()
            .getResultAs(ReplicationResult.class);

        assertThatThrownBy(() -> registered.getStages().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> replication.getStoredLocations().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> replication.getFailedLocations().clear())
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(pipeline.findRecord(stored.getContentId()).get().getStages()).hasSize(3);
        assertThat(replication.getStoredLocations()).hasSize(1);
        assertThat(replication.getFailedLocations()).hasSize(1);
    }

    @Test
    void smartCollection_organizesThenStoresWithoutReplication() throws IOException {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path source = Files.createDirectories(tempDir.resolve("incoming"));
        Files.write(source.resolve("notes.md"), "# notes".getBytes(StandardCharsets.UTF_8));
        Files.write(source.resolve("clip.mp4"), randomBytes(2048, 5));

        CollectionStatistics stats = pipeline.smartCollection(source, true, true, true);

        assertThat(stats.getTotal()).isEqualTo(2);
        assertThat(stats.getErrors()).isZero();
        assertThat(stats.getCount("documents")).isEqualTo(1);
        assertThat(stats.getCount("videos")).isEqualTo(1);
        assertThat(pipeline.getStorageStats().getTotalFiles()).isEqualTo(2);
        assertThat(tempDir.resolve("replica-1")).isEmptyDirectory();
    }

    @Test
    void smartCollection_withoutProcessingOnlyCollects() throws IOException {
        StoragePipelineService pipeline = newPipeline(new LocalCompressionManager());
        Path source = Files.createDirectories(tempDir.resolve("incoming"));
        Files.write(source.resolve("notes.md"), "# notes".getBytes(StandardCharsets.UTF_8));

        CollectionStatistics stats = pipeline.smartCollection(source, true, false, false);

        assertThat(stats.getTotal()).isEqualTo(1);
        assertThat(pipeline.getStorageStats().getTotalFiles()).isZero();
    }

    private StoragePipelineService newPipeline(CompressionManager compressionManager) {
        LocalChunkStore chunkStore = new LocalChunkStore(config.getChunk().getSize(), hasher, fileSystemManager);
        ReplicationService replicationService = new ReplicationService(config.getReplication().getLocations(),
            config.getReplication().getFactor(), fileSystemManager, hasher);
        FileCatalogService catalogService = new FileCatalogService(config, new InMemoryCatalogRepository(),
            fileSystemManager, hasher);
        return new StoragePipelineService(config, chunkStore, compressionManager, replicationService,
            catalogService, fileSystemManager, hasher);
    }

    private Path write(String name, String content) throws IOException {
        return write(name, content.getBytes(StandardCharsets.UTF_8));
    }

    private Path write(String name, byte[] content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content);
        return file;
    }

    private static byte[] randomBytes(int size, long seed) {
        byte[] data = new byte[size];
        new Random(seed).nextBytes(data);
        return data;
    }
}
