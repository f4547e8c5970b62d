package org.csits.mss.server.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.mss.dao.CatalogEntryEntity;
import org.csits.mss.dao.CatalogRepository;
import org.csits.mss.manager.filesystem.FileSystemManager;
import org.csits.mss.manager.security.ContentHasher;
import org.csits.mss.server.constants.FileCategory;
import org.csits.mss.server.dto.CollectionStatistics;
import org.csits.mss.server.dto.StorageConfig;
import org.springframework.stereotype.Service;

/**
 * 文件分类与目录服务
 * 按扩展名分类，可选地复制到 {@code <base>/organized/<category>/}，并以内容哈希登记目录条目。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileCatalogService {

    public static final String ORGANIZED_DIR = "organized";

    private final StorageConfig storageConfig;

    private final CatalogRepository catalogRepository;

    private final FileSystemManager fileSystemManager;

    private final ContentHasher contentHasher;

    public FileCategory categorize(Path file) {
        Path name = file.getFileName();
        return FileCategory.fromFileName(name != null ? name.toString() : null);
    }

    /**
     * 读取文件元数据并计算内容哈希，storedPath 置为空串。
     */
    public CatalogEntryEntity extractMetadata(Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        if (!attrs.isRegularFile()) {
            throw new IOException("不是普通文件: " + file);
        }
        CatalogEntryEntity entry = new CatalogEntryEntity();
        entry.setFilename(file.getFileName().toString());
        entry.setSize(attrs.size());
        entry.setCreated(toLocalDateTime(attrs.creationTime()));
        entry.setModified(toLocalDateTime(attrs.lastModifiedTime()));
        entry.setContentHash(contentHasher.sha256(file));
        entry.setCategory(categorize(file).getDirName());
        entry.setStoredPath("");
        return entry;
    }

    /**
     * 收集目录（或单个文件）下的全部文件。单个文件失败计入 errors，不中断遍历。
     *
     * @param source 源目录或文件
     * @param autoCategorize 是否复制到分类目录
     * @throws IOException 遍历源目录失败
     */
    public CollectionStatistics collectAndOrganize(Path source, boolean autoCategorize) throws IOException {
        CollectionStatistics stats = new CollectionStatistics();
        List<Path> files = fileSystemManager.scanFiles(source, null);
        log.info("开始收集: source={}, 文件数={}, autoCategorize={}", source, files.size(), autoCategorize);

        for (Path file : files) {
            try {
                CatalogEntryEntity entry = extractMetadata(file);
                if (autoCategorize) {
                    Path categoryDir = fileSystemManager.ensureDirectory(getOrganizedDir().resolve(entry.getCategory()));
                    Path dest = fileSystemManager.resolveNonConflicting(categoryDir, entry.getFilename());
                    fileSystemManager.copyFile(file, dest);
                    entry.setStoredPath(dest.toString());
                }
                catalogRepository.save(entry);
                stats.recordProcessed(entry.getCategory(), entry.getStoredPath());
            } catch (Exception e) {
                stats.recordError();
                log.warn("处理文件失败: {}", file, e);
            }
        }

        log.info("收集完成: total={}, errors={}, 分类={}", stats.getTotal(), stats.getErrors(),
            stats.getCategoryCounts());
        return stats;
    }

    /**
     * 按条件检索目录，为 null 的条件不参与过滤。
     *
     * @param query 文件名子串，大小写不敏感
     */
    public List<CatalogEntryEntity> search(String query, FileCategory category, Long minSize, Long maxSize) {
        String needle = query != null ? query.toLowerCase(Locale.ROOT) : null;
        List<CatalogEntryEntity> candidates = category != null
            ? catalogRepository.findByCategory(category.getDirName())
            : catalogRepository.findAll();
        return candidates.stream()
            .filter(e -> minSize == null || e.getSize() >= minSize)
            .filter(e -> maxSize == null || e.getSize() <= maxSize)
            .filter(e -> needle == null || e.getFilename().toLowerCase(Locale.ROOT).contains(needle))
            .collect(Collectors.toList());
    }

    public Optional<CatalogEntryEntity> findByContentHash(String contentHash) {
        return catalogRepository.findByContentHash(contentHash);
    }

    public Path getOrganizedDir() {
        return Paths.get(storageConfig.getBasePath()).resolve(ORGANIZED_DIR);
    }

    private static LocalDateTime toLocalDateTime(FileTime time) {
        return LocalDateTime.ofInstant(time.toInstant(), ZoneId.systemDefault());
    }
}
