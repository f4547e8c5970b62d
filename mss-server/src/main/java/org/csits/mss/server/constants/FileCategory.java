package org.csits.mss.server.constants;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.io.FilenameUtils;

/**
 * 文件分类，按扩展名判定，大小写不敏感。
 */
public enum FileCategory {

    DOCUMENTS("documents", ".pdf", ".doc", ".docx", ".txt", ".md"),

    IMAGES("images", ".jpg", ".jpeg", ".png", ".gif", ".bmp", ".tiff"),

    VIDEOS("videos", ".mp4", ".avi", ".mkv", ".mov", ".wmv"),

    AUDIO("audio", ".mp3", ".wav", ".flac", ".ogg", ".m4a"),

    ARCHIVES("archives", ".zip", ".tar", ".gz", ".7z", ".rar"),

    DATA("data", ".json", ".xml", ".csv", ".xlsx", ".db"),

    CODE("code", ".py", ".js", ".java", ".cpp", ".c", ".h"),

    OTHER("other");

    private final String dirName;

    private final Set<String> extensions;

    FileCategory(String dirName, String... extensions) {
        this.dirName = dirName;
        this.extensions = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(extensions)));
    }

    /**
     * 归档目录名，同时作为目录条目中的分类名。
     */
    public String getDirName() {
        return dirName;
    }

    /**
     * 只看最后一个扩展名，例如 backup.tar.gz 归为 ARCHIVES（.gz）。
     */
    public static FileCategory fromFileName(String fileName) {
        if (fileName == null) {
            return OTHER;
        }
        String ext = FilenameUtils.getExtension(fileName);
        if (ext == null || ext.isEmpty()) {
            return OTHER;
        }
        String dotted = "." + ext.toLowerCase(Locale.ROOT);
        for (FileCategory category : values()) {
            if (category.extensions.contains(dotted)) {
                return category;
            }
        }
        return OTHER;
    }

    /**
     * 按目录名或枚举名解析，未知名称抛出 IllegalArgumentException。
     */
    public static FileCategory fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("分类不能为空");
        }
        String normalized = name.trim();
        for (FileCategory category : values()) {
            if (category.dirName.equalsIgnoreCase(normalized) || category.name().equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown file category: " + name);
    }
}
