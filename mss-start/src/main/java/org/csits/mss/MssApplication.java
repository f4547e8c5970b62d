package org.csits.mss;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.mss.server.dto.CollectionStatistics;
import org.csits.mss.server.dto.PipelineRecord;
import org.csits.mss.server.service.StoragePipelineService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * 启动类，通过命令行参数存储单个文件或整理整个目录。
 *
 * 示例：
 *  java -jar mss-start.jar --file=/data/in/report.pdf --compress=false
 *  java -jar mss-start.jar --collect=/data/incoming --categorize=true
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "org.csits.mss")
@RequiredArgsConstructor
public class MssApplication implements CommandLineRunner {

    private static final ObjectMapper OUTPUT_MAPPER = createOutputMapper();

    private final StoragePipelineService storagePipelineService;

    public static void main(String[] args) {
        SpringApplication.run(MssApplication.class, args);
    }

    private static ObjectMapper createOutputMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    @Override
    public void run(String... args) throws Exception {
        CommandOptions options = parseOptions(args);
        if (options.getFile() != null) {
            PipelineRecord record = storagePipelineService.storeFile(options.getFile(),
                options.isDedup(), options.isCompress(), options.isReplicate());
            log.info("存储结果:\n{}", OUTPUT_MAPPER.writeValueAsString(record));
        }
        if (options.getCollect() != null) {
            CollectionStatistics stats = storagePipelineService.smartCollection(options.getCollect(),
                options.isCategorize(), options.isDedup(), options.isCompress());
            log.info("整理结果:\n{}", OUTPUT_MAPPER.writeValueAsString(stats));
        }
        if (options.getFile() == null && options.getCollect() == null) {
            log.info("未指定 --file 或 --collect，仅输出存储统计");
        }
        log.info("存储统计:\n{}", OUTPUT_MAPPER.writeValueAsString(storagePipelineService.getStorageStats()));
    }

    static CommandOptions parseOptions(String... args) {
        CommandOptions options = new CommandOptions();
        for (String arg : args) {
            if (arg.startsWith("--file=")) {
                options.setFile(toPath(arg.substring("--file=".length())));
            } else if (arg.startsWith("--collect=")) {
                options.setCollect(toPath(arg.substring("--collect=".length())));
            } else if (arg.startsWith("--dedup=")) {
                options.setDedup(parseFlag(arg, "--dedup="));
            } else if (arg.startsWith("--compress=")) {
                options.setCompress(parseFlag(arg, "--compress="));
            } else if (arg.startsWith("--replicate=")) {
                options.setReplicate(parseFlag(arg, "--replicate="));
            } else if (arg.startsWith("--categorize=")) {
                options.setCategorize(parseFlag(arg, "--categorize="));
            }
        }
        return options;
    }

    private static Path toPath(String value) {
        return value.trim().isEmpty() ? null : Paths.get(value.trim());
    }

    private static boolean parseFlag(String arg, String prefix) {
        String value = arg.substring(prefix.length()).trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean value: " + arg);
    }

    @Data
    static class CommandOptions {

        private Path file;

        private Path collect;

        private boolean dedup = true;

        private boolean compress = true;

        private boolean replicate = true;

        private boolean categorize = true;
    }
}
