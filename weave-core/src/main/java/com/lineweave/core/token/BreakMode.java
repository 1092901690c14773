package com.lineweave.core.token;

/**
 * 分组放不下时的换行方式
 */
public enum BreakMode {
    /** 一处换行则全部换行 */
    CONSISTENT,
    /** 每个换行点各自判断（贪心填充） */
    INCONSISTENT
}
