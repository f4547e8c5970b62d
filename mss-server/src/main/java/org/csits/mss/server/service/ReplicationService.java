package org.csits.mss.server.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.csits.mss.manager.filesystem.FileSystemManager;
import org.csits.mss.manager.security.ContentHasher;
import org.csits.mss.server.constants.ReplicaHealth;
import org.csits.mss.server.dto.ReplicationResult;
import org.csits.mss.server.dto.ReplicationStatus;
import org.csits.mss.server.dto.StorageLocation;

/**
 * 多位置副本服务
 * 按配置顺序将文件复制到前 K 个位置，远端位置只记录地址不做传输。
 */
@Slf4j
public class ReplicationService {

    private final List<StorageLocation> locations;

    private final int replicationFactor;

    private final FileSystemManager fileSystemManager;

    private final ContentHasher contentHasher;

    /**
     * contentId -> 副本地址列表
     */
    private final Map<String, List<String>> replicaIndex = new ConcurrentHashMap<>();

    public ReplicationService(List<String> locations, int replicationFactor,
                              FileSystemManager fileSystemManager, ContentHasher contentHasher) {
        if (locations == null || locations.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个存储位置");
        }
        if (replicationFactor < 1) {
            throw new IllegalArgumentException("Replication factor must be at least 1: " + replicationFactor);
        }
        this.locations = locations.stream().map(StorageLocation::parse).collect(Collectors.toList());
        this.replicationFactor = replicationFactor;
        this.fileSystemManager = fileSystemManager;
        this.contentHasher = contentHasher;

        if (replicationFactor > this.locations.size()) {
            log.warn("副本数 {} 大于存储位置数 {}，最多写入 {} 份", replicationFactor, this.locations.size(),
                this.locations.size());
        }
        for (StorageLocation location : this.locations) {
            if (location.isRemote()) {
                continue;
            }
            try {
                fileSystemManager.ensureDirectory(location.toPath());
            } catch (IOException e) {
                // 写入时会再次失败并计入 failedLocations
                log.error("创建存储目录失败: {}", location.getLocation(), e);
            }
        }
    }

    /**
     * 以文件 SHA-256 作为内容 ID 写入副本。
     *
     * @throws IOException 文件无法读取以计算摘要
     */
    public ReplicationResult store(Path file) throws IOException {
        return store(file, contentHasher.sha256(file));
    }

    /**
     * 写入副本，单个位置失败不影响其余位置。同一内容 ID 再次写入时与已有副本地址合并。
     */
    public ReplicationResult store(Path file, String contentId) {
        List<String> stored = new ArrayList<>();
        List<ReplicationResult.FailedLocation> failed = new ArrayList<>();

        for (StorageLocation location : targets()) {
            if (location.isRemote()) {
                stored.add(location.resolve(contentId));
                continue;
            }
            Path dest = location.toPath().resolve(contentId);
            try {
                // 经唯一临时文件原子替换，同一内容并发写入同一位置时不会互相删除
                fileSystemManager.writeAtomically(dest, out -> Files.copy(file, out));
                stored.add(dest.toString());
                log.debug("副本已写入: {}", dest);
            } catch (IOException e) {
                log.warn("副本写入失败: location={}, contentId={}", location.getLocation(), contentId, e);
                failed.add(new ReplicationResult.FailedLocation(location.getLocation(),
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        replicaIndex.merge(contentId, Collections.unmodifiableList(new ArrayList<>(stored)),
            ReplicationService::union);
        log.info("副本写入完成: contentId={}, 成功={}, 失败={}", contentId, stored.size(), failed.size());

        return ReplicationResult.builder()
            .contentId(contentId)
            .storedLocations(stored)
            .failedLocations(failed)
            .replicationAchieved(stored.size())
            .build();
    }

    /**
     * 从第一个可读的本地副本恢复文件，远端副本跳过。
     */
    public boolean retrieve(String contentId, Path output) {
        List<String> replicas = replicaIndex.get(contentId);
        if (replicas == null) {
            log.warn("未知内容ID: {}", contentId);
            return false;
        }
        for (String replica : replicas) {
            if (StorageLocation.isRemoteAddress(replica)) {
                continue;
            }
            Path source = Paths.get(replica);
            if (!Files.exists(source)) {
                continue;
            }
            try {
                fileSystemManager.copyFile(source, output);
                log.info("从副本恢复: {} -> {}", source, output);
                return true;
            } catch (IOException e) {
                log.warn("从副本恢复失败，尝试下一个: {}", source, e);
            }
        }
        return false;
    }

    public ReplicationStatus verify(String contentId) {
        List<String> replicas = replicaIndex.get(contentId);
        if (replicas == null) {
            return ReplicationStatus.builder()
                .contentId(contentId)
                .available(0)
                .missing(replicationFactor)
                .health(ReplicaHealth.FAILED)
                .build();
        }

        int available = 0;
        int missing = 0;
        int unverifiedRemote = 0;
        for (String replica : replicas) {
            if (StorageLocation.isRemoteAddress(replica)) {
                available++;
                unverifiedRemote++;
            } else if (Files.exists(Paths.get(replica))) {
                available++;
            } else {
                missing++;
            }
        }

        return ReplicationStatus.builder()
            .contentId(contentId)
            .available(available)
            .missing(missing)
            .unverifiedRemote(unverifiedRemote)
            .health(ReplicaHealth.of(available))
            .build();
    }

    public List<String> getLocations(String contentId) {
        return replicaIndex.getOrDefault(contentId, Collections.emptyList());
    }

    public int getReplicationFactor() {
        return replicationFactor;
    }

    private static List<String> union(List<String> existing, List<String> added) {
        Set<String> merged = new LinkedHashSet<>(existing);
        merged.addAll(added);
        return Collections.unmodifiableList(new ArrayList<>(merged));
    }

    private List<StorageLocation> targets() {
        return locations.subList(0, Math.min(replicationFactor, locations.size()));
    }
}
