package org.csits.mss.server.service;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.csits.mss.manager.chunk.LocalChunkStore;
import org.csits.mss.manager.filesystem.FileSystemManager;
import org.csits.mss.manager.security.ContentHasher;
import org.csits.mss.server.dto.StorageConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * 存储组件装配：加载 storage.yaml，创建块存储与副本服务。
 */
@Slf4j
@Configuration
public class StorageConfiguration {

    @Bean
    public StorageConfig storageConfig(YamlConfigLoader yamlConfigLoader, ResourceLoader resourceLoader,
                                       @Value("${mss.conf.location:classpath:conf/storage.yaml}") String location)
        throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("存储配置不存在，使用默认值: {}", location);
            return new StorageConfig();
        }
        return yamlConfigLoader.loadStorageConfig(resource);
    }

    @Bean
    public LocalChunkStore chunkStore(StorageConfig storageConfig, ContentHasher contentHasher,
                                      FileSystemManager fileSystemManager) {
        storageConfig.validate();
        return new LocalChunkStore(storageConfig.getChunk().getSize(), contentHasher, fileSystemManager);
    }

    @Bean
    public ReplicationService replicationService(StorageConfig storageConfig, FileSystemManager fileSystemManager,
                                                 ContentHasher contentHasher) {
        storageConfig.validate();
        List<String> locations = storageConfig.getReplication().getLocations();
        if (locations == null || locations.isEmpty()) {
            locations = Collections.singletonList(storageConfig.getBasePath());
        }
        return new ReplicationService(locations, storageConfig.getReplication().getFactor(),
            fileSystemManager, contentHasher);
    }
}
