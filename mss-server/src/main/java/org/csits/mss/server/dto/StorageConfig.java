package org.csits.mss.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 存储配置，对应 storage.yaml。未出现的键保留默认值。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageConfig {

    /**
     * 存储根目录，去重块、压缩件、归档文件均位于其下。
     */
    @JsonProperty("base_path")
    private String basePath = "./data/mss";

    /**
     * 容量上限（TB，按 1024^4 字节计）。
     */
    @JsonProperty("max_capacity_tb")
    private Double maxCapacityTb = 10.0;

    private ChunkConfig chunk = new ChunkConfig();

    private CompressionConfig compression = new CompressionConfig();

    private ReplicationConfig replication = new ReplicationConfig();

    private ConcurrencyConfig concurrency = new ConcurrencyConfig();

    /**
     * YAML 中键存在但值为空时 Jackson 写入 null，这里逐项检查。replication.locations 为空时允许回落到 base_path。
     *
     * @return 自身
     * @throws IllegalArgumentException 缺少取值的配置项，消息中包含键名
     */
    public StorageConfig validate() {
        require(basePath, "base_path");
        require(maxCapacityTb, "max_capacity_tb");
        require(chunk, "chunk");
        require(chunk.getSize(), "chunk.size");
        require(compression, "compression");
        require(compression.getAlgorithm(), "compression.algorithm");
        require(compression.getLevel(), "compression.level");
        require(replication, "replication");
        require(replication.getFactor(), "replication.factor");
        require(concurrency, "concurrency");
        require(concurrency.getWorkers(), "concurrency.workers");
        return this;
    }

    private static void require(Object value, String key) {
        if (value == null) {
            throw new IllegalArgumentException("Missing configuration value: " + key);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkConfig {

        /**
         * 固定分块大小（字节）。
         */
        private Integer size = 4096;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CompressionConfig {

        /**
         * zlib、gzip 或 bz2。
         */
        private String algorithm = "zlib";

        private Integer level = 6;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReplicationConfig {

        private Integer factor = 2;

        /**
         * 本地目录或 http://、https://、s3:// 远端地址；为空时使用 base_path。
         */
        private List<String> locations = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConcurrencyConfig {

        /**
         * 批量存储的工作线程数。
         */
        private Integer workers = 4;
    }
}
