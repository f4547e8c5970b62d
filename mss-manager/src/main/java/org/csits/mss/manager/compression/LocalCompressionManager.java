package org.csits.mss.manager.compression;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.deflate.DeflateCompressorInputStream;
import org.apache.commons.compress.compressors.deflate.DeflateCompressorOutputStream;
import org.apache.commons.compress.compressors.deflate.DeflateParameters;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.apache.commons.io.IOUtils;
import org.springframework.stereotype.Component;

/**
 * 基于 Commons Compress 的流式压缩实现，不会一次性读入整个文件。
 */
@Slf4j
@Component
public class LocalCompressionManager implements CompressionManager {

    @Override
    public CompressionResult compress(Path input, Path output, String algorithm, int level) {
        CompressionAlgorithm resolved;
        try {
            resolved = CompressionAlgorithm.fromName(algorithm);
        } catch (IllegalArgumentException e) {
            log.error("压缩失败，不支持的算法: {}", algorithm);
            return CompressionResult.failed(e.getMessage());
        }
        return compress(input, output, resolved, level);
    }

    @Override
    public CompressionResult compress(Path input, Path output, CompressionAlgorithm algorithm, int level) {
        if (algorithm == null) {
            return CompressionResult.failed("压缩算法不能为空");
        }
        if (level < CompressionAlgorithm.MIN_LEVEL || level > CompressionAlgorithm.MAX_LEVEL) {
            return CompressionResult.failed("Compression level must be between "
                + CompressionAlgorithm.MIN_LEVEL + " and " + CompressionAlgorithm.MAX_LEVEL + ": " + level);
        }
        boolean outputOpened = false;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(input))) {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            long originalSize;
            OutputStream sink = Files.newOutputStream(output);
            outputOpened = true;
            try (OutputStream buffered = new BufferedOutputStream(sink);
                 OutputStream out = openCompressor(buffered, algorithm, level)) {
                originalSize = IOUtils.copyLarge(in, out);
            }
            long compressedSize = Files.size(output);
            CompressionResult result = CompressionResult.builder()
                .originalSize(originalSize)
                .compressedSize(compressedSize)
                .compressionRatio(CompressionResult.ratio(originalSize, compressedSize))
                .algorithm(algorithm.getName())
                .outputPath(output.toString())
                .build();
            log.info("压缩完成: {} -> {}, algorithm={}, original={}bytes, compressed={}bytes, ratio={}",
                input.getFileName(), output.getFileName(), algorithm.getName(),
                originalSize, compressedSize, String.format("%.2f", result.getCompressionRatio()));
            return result;
        } catch (IOException e) {
            log.error("压缩失败: {}", input, e);
            if (outputOpened) {
                deleteQuietly(output);
            }
            return CompressionResult.failed(describe(e));
        }
    }

    @Override
    public boolean decompress(Path input, Path output, String algorithm) {
        try {
            return decompress(input, output, CompressionAlgorithm.fromName(algorithm));
        } catch (IllegalArgumentException e) {
            log.error("解压失败，不支持的算法: {}", algorithm);
            return false;
        }
    }

    @Override
    public boolean decompress(Path input, Path output, CompressionAlgorithm algorithm) {
        if (algorithm == null) {
            log.error("解压失败，未指定算法: {}", input);
            return false;
        }
        boolean outputOpened = false;
        try (InputStream source = new BufferedInputStream(Files.newInputStream(input));
             InputStream in = openDecompressor(source, algorithm)) {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            OutputStream sink = Files.newOutputStream(output);
            outputOpened = true;
            try (OutputStream out = new BufferedOutputStream(sink)) {
                long written = IOUtils.copyLarge(in, out);
                log.debug("解压完成: {} -> {}, {}bytes", input.getFileName(), output.getFileName(), written);
            }
            return true;
        } catch (IOException e) {
            log.error("解压失败: {}, algorithm={}", input, algorithm.getName(), e);
            if (outputOpened) {
                deleteQuietly(output);
            }
            return false;
        }
    }

    private OutputStream openCompressor(OutputStream raw, CompressionAlgorithm algorithm, int level)
        throws IOException {
        switch (algorithm) {
            case DEFLATE:
                DeflateParameters deflateParameters = new DeflateParameters();
                deflateParameters.setWithZlibHeader(true);
                deflateParameters.setCompressionLevel(level);
                return new DeflateCompressorOutputStream(raw, deflateParameters);
            case GZIP:
                GzipParameters gzipParameters = new GzipParameters();
                gzipParameters.setCompressionLevel(level);
                return new GzipCompressorOutputStream(raw, gzipParameters);
            case BZIP2:
                // bzip2 的块大小（x100k）与压缩级别一一对应
                return new BZip2CompressorOutputStream(raw, level);
            default:
                raw.close();
                throw new IOException("Unsupported compression algorithm: " + algorithm);
        }
    }

    private InputStream openDecompressor(InputStream raw, CompressionAlgorithm algorithm) throws IOException {
        switch (algorithm) {
            case DEFLATE:
                DeflateParameters deflateParameters = new DeflateParameters();
                deflateParameters.setWithZlibHeader(true);
                return new DeflateCompressorInputStream(raw, deflateParameters);
            case GZIP:
                return new GzipCompressorInputStream(raw);
            case BZIP2:
                return new BZip2CompressorInputStream(raw);
            default:
                raw.close();
                throw new IOException("Unsupported compression algorithm: " + algorithm);
        }
    }

    private static String describe(IOException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("删除不完整的输出文件失败: {}", file, e);
        }
    }
}
