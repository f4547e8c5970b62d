package org.csits.mss.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import lombok.extern.slf4j.Slf4j;
import org.csits.mss.server.dto.StorageConfig;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * 使用 Jackson YAML 将配置文件映射为 Java 对象。
 */
@Slf4j
@Component
public class YamlConfigLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * @throws IllegalArgumentException 配置项存在但取值为空
     */
    public StorageConfig loadStorageConfig(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            StorageConfig config = yamlMapper.readValue(in, StorageConfig.class);
            log.info("加载存储配置: {}", resource.getDescription());
            return config != null ? config.validate() : new StorageConfig();
        }
    }

    public StorageConfig loadStorageConfigFromString(String yaml) throws IOException {
        StorageConfig config = yamlMapper.readValue(new StringReader(yaml), StorageConfig.class);
        return config != null ? config.validate() : new StorageConfig();
    }
}
