package org.csits.mss.server.dto;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 一次副本写入的结果，部分失败也属于正常返回。
 */
@Value
@Builder
public class ReplicationResult {

    String contentId;

    @Singular
    List<String> storedLocations;

    @Singular
    List<FailedLocation> failedLocations;

    int replicationAchieved;

    @Value
    public static class FailedLocation {

        String location;

        String reason;
    }
}
