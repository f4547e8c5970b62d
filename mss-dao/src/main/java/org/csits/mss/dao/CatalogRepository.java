package org.csits.mss.dao;

import java.util.List;
import java.util.Optional;

/**
 * 文件目录仓储接口。
 */
public interface CatalogRepository {

    /**
     * 按内容哈希新增或覆盖。
     */
    CatalogEntryEntity save(CatalogEntryEntity entity);

    Optional<CatalogEntryEntity> findByContentHash(String contentHash);

    /**
     * 按分类名查询，大小写不敏感，按文件名排序。
     */
    List<CatalogEntryEntity> findByCategory(String category);

    /**
     * 查询全部条目，按文件名排序。
     */
    List<CatalogEntryEntity> findAll();

    long count();
}
