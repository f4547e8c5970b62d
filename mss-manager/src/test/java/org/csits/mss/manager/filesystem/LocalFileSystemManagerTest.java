package org.csits.mss.manager.filesystem;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFileSystemManagerTest {

    private LocalFileSystemManager manager;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        manager = new LocalFileSystemManager();
    }

    @Test
    void ensureDirectory_createsMultiLevelDirectory() throws IOException {
        Path deep = tempDir.resolve("a").resolve("b").resolve("c");
        assertThat(Files.exists(deep)).isFalse();

        Path result = manager.ensureDirectory(deep);

        assertThat(result).isEqualTo(deep);
        assertThat(Files.isDirectory(deep)).isTrue();
    }

    @Test
    void copyFile_copiesContentAndKeepsSource() throws IOException {
        Path source = tempDir.resolve("source.txt");
        Files.write(source, "hello".getBytes());
        Path target = tempDir.resolve("sub").resolve("target.txt");

        manager.copyFile(source, target);

        assertThat(Files.readAllBytes(target)).isEqualTo("hello".getBytes());
        assertThat(Files.readAllBytes(source)).isEqualTo("hello".getBytes());
        assertThat(Files.getLastModifiedTime(target)).isEqualTo(Files.getLastModifiedTime(source));
    }

    @Test
    void moveFile_movesFileToTarget() throws IOException {
        Path source = tempDir.resolve("moveMe.txt");
        Files.write(source, "moved".getBytes());
        Path target = tempDir.resolve("sub").resolve("moved.txt");

        manager.moveFile(source, target);

        assertThat(Files.exists(source)).isFalse();
        assertThat(Files.readAllBytes(target)).isEqualTo("moved".getBytes());
    }

    @Test
    void scanFiles_matchesGlobPatternRecursively() throws IOException {
        Path root = tempDir.resolve("scanRoot");
        Path sub = root.resolve("sub");
        Files.createDirectories(sub);
        Files.write(root.resolve("a.txt"), "a".getBytes());
        Files.write(root.resolve("b.dat"), "b".getBytes());
        Files.write(root.resolve("c.txt"), "c".getBytes());
        Files.write(sub.resolve("d.txt"), "d".getBytes());

        List<Path> txtFiles = manager.scanFiles(root, "*.txt");

        assertThat(txtFiles).extracting(Path::getFileName).extracting(Path::toString)
            .containsExactlyInAnyOrder("a.txt", "c.txt", "d.txt");
    }

    @Test
    void scanFiles_nullOrEmptyPattern_matchesAll() throws IOException {
        Path root = tempDir.resolve("allRoot");
        Files.createDirectories(root);
        Files.write(root.resolve("f1.txt"), "1".getBytes());
        Files.write(root.resolve("f2.dat"), "2".getBytes());

        assertThat(manager.scanFiles(root, null)).hasSize(2);
        assertThat(manager.scanFiles(root, "")).hasSize(2);
    }

    @Test
    void scanFiles_singleFileRoot_returnsThatFile() throws IOException {
        Path file = tempDir.resolve("only.bin");
        Files.write(file, new byte[]{1});

        assertThat(manager.scanFiles(file, null)).containsExactly(file);
    }

    @Test
    void scanFiles_returnsEmptyWhenRootNotExists() throws IOException {
        assertThat(manager.scanFiles(tempDir.resolve("notExists"), "*.txt")).isEmpty();
    }

    @Test
    void resolveNonConflicting_appendsIncrementingSuffix() throws IOException {
        assertThat(manager.resolveNonConflicting(tempDir, "report.pdf")).isEqualTo(tempDir.resolve("report.pdf"));

        Files.write(tempDir.resolve("report.pdf"), "1".getBytes());
        assertThat(manager.resolveNonConflicting(tempDir, "report.pdf")).isEqualTo(tempDir.resolve("report_1.pdf"));

        Files.write(tempDir.resolve("report_1.pdf"), "2".getBytes());
        assertThat(manager.resolveNonConflicting(tempDir, "report.pdf")).isEqualTo(tempDir.resolve("report_2.pdf"));
    }

    @Test
    void resolveNonConflicting_withoutExtension() throws IOException {
        Files.write(tempDir.resolve("Makefile"), "x".getBytes());

        assertThat(manager.resolveNonConflicting(tempDir, "Makefile")).isEqualTo(tempDir.resolve("Makefile_1"));
    }

    @Test
    void writeAtomically_replacesTargetOnSuccess() throws IOException {
        Path target = tempDir.resolve("out").resolve("data.bin");

        manager.writeAtomically(target, out -> out.write("first".getBytes()));
        manager.writeAtomically(target, out -> out.write("second".getBytes()));

        assertThat(Files.readAllBytes(target)).isEqualTo("second".getBytes());
        assertThat(listNames(target.getParent())).containsExactly("data.bin");
    }

    @Test
    void writeAtomically_failureLeavesNoFileBehind() throws IOException {
        Path target = tempDir.resolve("broken.bin");

        assertThatThrownBy(() -> manager.writeAtomically(target, out -> {
            out.write("partial".getBytes());
            throw new IOException("boom");
        })).isInstanceOf(IOException.class).hasMessage("boom");

        assertThat(Files.exists(target)).isFalse();
        assertThat(listNames(tempDir)).isEmpty();
    }

    @Test
    void writeAtomically_concurrentWritersToSameTargetAllSucceed() throws Exception {
        Path target = tempDir.resolve("shared").resolve("restored.bin");
        List<String> payloads = new ArrayList<>();
        List<Callable<Path>> writers = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            String payload = "payload-" + i + "-" + "x".repeat(64 * 1024);
            payloads.add(payload);
            writers.add(() -> {
                Path last = null;
                for (int round = 0; round < 20; round++) {
                    last = manager.writeAtomically(target,
                        out -> out.write(payload.getBytes(StandardCharsets.UTF_8)));
                }
                return last;
            });
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (Future<Path> future : pool.invokeAll(writers)) {
                assertThat(future.get()).isEqualTo(target);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(payloads).contains(new String(Files.readAllBytes(target), StandardCharsets.UTF_8));
        assertThat(listNames(target.getParent())).containsExactly("restored.bin");
    }

    private static List<String> listNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
        }
    }
}
