package org.csits.mss.server.constants;

/**
 * 存储流水线阶段，按声明顺序执行。
 */
public enum StageName {

    DEDUPLICATION,

    COMPRESSION,

    REPLICATION
}
