package org.csits.mss.server.dto;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Value;

/**
 * 副本存放位置：本地目录或远端地址（不做实际网络访问）。
 */
@Value
public class StorageLocation {

    private static final String[] REMOTE_PREFIXES = {"http://", "https://", "s3://"};

    String location;

    boolean remote;

    public static StorageLocation parse(String location) {
        if (location == null || location.trim().isEmpty()) {
            throw new IllegalArgumentException("存储位置不能为空");
        }
        String value = location.trim();
        return new StorageLocation(value, isRemoteAddress(value));
    }

    public static boolean isRemoteAddress(String location) {
        for (String prefix : REMOTE_PREFIXES) {
            if (location.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public Path toPath() {
        if (remote) {
            throw new IllegalStateException("Remote location has no local path: " + location);
        }
        return Paths.get(location);
    }

    /**
     * 内容在该位置下的地址：本地为 {@code <dir>/<contentId>}，远端为 {@code <endpoint>/<contentId>}。
     */
    public String resolve(String contentId) {
        if (remote) {
            return location.endsWith("/") ? location + contentId : location + "/" + contentId;
        }
        return toPath().resolve(contentId).toString();
    }
}
