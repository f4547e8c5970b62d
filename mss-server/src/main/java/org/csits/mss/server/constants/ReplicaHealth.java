package org.csits.mss.server.constants;

/**
 * 副本健康度，由可用副本数推导。
 */
public enum ReplicaHealth {

    GOOD,

    DEGRADED,

    FAILED;

    public static ReplicaHealth of(int available) {
        if (available >= 2) {
            return GOOD;
        }
        return available == 1 ? DEGRADED : FAILED;
    }
}
