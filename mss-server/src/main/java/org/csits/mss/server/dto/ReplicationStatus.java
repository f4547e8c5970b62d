package org.csits.mss.server.dto;

import lombok.Builder;
import lombok.Value;
import org.csits.mss.server.constants.ReplicaHealth;

/**
 * 副本校验结果，每次调用重新计算。
 */
@Value
@Builder
public class ReplicationStatus {

    String contentId;

    int available;

    int missing;

    /**
     * 计入 available 但未实际检查的远端副本数。
     */
    int unverifiedRemote;

    ReplicaHealth health;
}
