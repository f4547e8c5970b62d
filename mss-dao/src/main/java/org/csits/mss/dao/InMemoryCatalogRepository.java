package org.csits.mss.dao;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * 基于内存的文件目录实现，进程退出即丢失。
 */
@Repository
@ConditionalOnProperty(name = "mss.catalog.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryCatalogRepository implements CatalogRepository {

    private static final Comparator<CatalogEntryEntity> BY_FILENAME =
        Comparator.comparing(CatalogEntryEntity::getFilename, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Map<String, CatalogEntryEntity> store = new ConcurrentHashMap<>();

    @Override
    public CatalogEntryEntity save(CatalogEntryEntity entity) {
        if (entity.getContentHash() == null || entity.getContentHash().isEmpty()) {
            throw new IllegalArgumentException("contentHash 不能为空");
        }
        store.put(entity.getContentHash(), entity);
        return entity;
    }

    @Override
    public Optional<CatalogEntryEntity> findByContentHash(String contentHash) {
        return Optional.ofNullable(store.get(contentHash));
    }

    @Override
    public List<CatalogEntryEntity> findByCategory(String category) {
        return store.values().stream()
            .filter(e -> category.equalsIgnoreCase(e.getCategory()))
            .sorted(BY_FILENAME)
            .collect(Collectors.toList());
    }

    @Override
    public List<CatalogEntryEntity> findAll() {
        return store.values().stream()
            .sorted(BY_FILENAME)
            .collect(Collectors.toList());
    }

    @Override
    public long count() {
        return store.size();
    }
}
