package org.csits.mss.manager.filesystem;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * 文件系统操作抽象。
 */
public interface FileSystemManager {

    Path ensureDirectory(Path dir) throws IOException;

    void copyFile(Path source, Path target) throws IOException;

    void moveFile(Path source, Path target) throws IOException;

    List<Path> scanFiles(Path root, String pattern) throws IOException;

    /**
     * 在目录下为文件名寻找不冲突的路径：name.ext 已存在时依次尝试 name_1.ext、name_2.ext ...
     */
    Path resolveNonConflicting(Path dir, String fileName);

    /**
     * 先写入同目录下的 .tmp 文件，全部写完后原子重命名为目标文件；
     * 写入失败时删除临时文件，目标文件保持原状。
     */
    Path writeAtomically(Path target, StreamWriter writer) throws IOException;

    /**
     * 可抛出 IOException 的输出回调。
     */
    @FunctionalInterface
    interface StreamWriter {
        void write(OutputStream out) throws IOException;
    }
}
