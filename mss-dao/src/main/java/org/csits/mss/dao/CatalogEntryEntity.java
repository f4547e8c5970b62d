package org.csits.mss.dao;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * 文件目录条目，按内容哈希唯一。
 */
@Data
public class CatalogEntryEntity {

    private String filename;

    /**
     * 文件大小（字节）。
     */
    private Long size;

    private LocalDateTime created;

    private LocalDateTime modified;

    /**
     * 文件内容 SHA-256，十六进制小写。
     */
    private String contentHash;

    /**
     * 分类名，例如 documents、images。
     */
    private String category;

    /**
     * 归档后的路径，未归档时为空串。
     */
    private String storedPath;
}
