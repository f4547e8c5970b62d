package org.csits.mss.manager.security;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 基于 Bouncy Castle 的 SHA-256 实现。
 * 使用流式处理计算大文件摘要，避免内存溢出。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "mss.digest.provider", havingValue = "bouncycastle", matchIfMissing = true)
public class BouncyCastleContentHasher implements ContentHasher {

    private static final int BUFFER_SIZE = 8192; // 8KB缓冲区

    @Override
    public String sha256(Path file) throws IOException {
        SHA256Digest digest = new SHA256Digest();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int bytesRead;
            while ((bytesRead = in.read(buffer)) != -1) {
                digest.update(buffer, 0, bytesRead);
            }
        }
        String hex = finish(digest);
        log.debug("SHA-256计算完成: {} -> {}", file.getFileName(), hex);
        return hex;
    }

    @Override
    public String sha256(byte[] data, int offset, int length) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(data, offset, length);
        return finish(digest);
    }

    private String finish(SHA256Digest digest) {
        byte[] hash = new byte[digest.getDigestSize()];
        digest.doFinal(hash, 0);
        return Hex.toHexString(hash);
    }
}
