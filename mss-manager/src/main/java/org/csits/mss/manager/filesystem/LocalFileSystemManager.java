package org.csits.mss.manager.filesystem;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

/**
 * 本地文件系统实现。
 */
@Slf4j
@Component
public class LocalFileSystemManager implements FileSystemManager {

    private static final String TMP_SUFFIX = ".tmp";

    @Override
    public Path ensureDirectory(Path dir) throws IOException {
        if (Files.notExists(dir)) {
            Files.createDirectories(dir);
        }
        return dir;
    }

    @Override
    public void copyFile(Path source, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null && Files.notExists(parent)) {
            Files.createDirectories(parent);
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    }

    @Override
    public void moveFile(Path source, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null && Files.notExists(parent)) {
            Files.createDirectories(parent);
        }
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("不支持原子移动，退化为普通移动: {} -> {}", source, target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public List<Path> scanFiles(Path root, String pattern) throws IOException {
        if (Files.notExists(root)) {
            return new ArrayList<>();
        }
        if (Files.isRegularFile(root)) {
            List<Path> single = new ArrayList<>();
            single.add(root);
            return single;
        }
        PathMatcher matcher = pattern == null || pattern.isEmpty()
            ? null
            : FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(p -> matcher == null || matcher.matches(p.getFileName()))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    @Override
    public Path resolveNonConflicting(Path dir, String fileName) {
        Path candidate = dir.resolve(fileName);
        String baseName = FilenameUtils.getBaseName(fileName);
        String extension = FilenameUtils.getExtension(fileName);
        String suffix = extension.isEmpty() ? "" : "." + extension;
        int counter = 1;
        while (Files.exists(candidate)) {
            candidate = dir.resolve(baseName + "_" + counter + suffix);
            counter++;
        }
        return candidate;
    }

    @Override
    public Path writeAtomically(Path target, StreamWriter writer) throws IOException {
        Path parent = ensureDirectory(target.toAbsolutePath().getParent());
        // 每次调用独占一个临时文件，并发写同一目标时互不删除
        Path tmpPath = Files.createTempFile(parent, target.getFileName().toString() + ".", TMP_SUFFIX);
        try {
            try (OutputStream out = Files.newOutputStream(tmpPath)) {
                writer.write(out);
            }
            moveFile(tmpPath, target);
            return target;
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmpPath);
            } catch (IOException cleanup) {
                log.error("删除临时文件失败: {}", tmpPath, cleanup);
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }
}
