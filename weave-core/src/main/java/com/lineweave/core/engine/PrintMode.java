package com.lineweave.core.engine;

import com.lineweave.core.token.BreakMode;

/**
 * 分组在打印阶段确定的排版方式
 */
public enum PrintMode {
    /** 整组放得下，所有换行点输出空白 */
    FITS,
    CONSISTENT,
    INCONSISTENT;

    static PrintMode of(BreakMode mode) {
        return mode == BreakMode.CONSISTENT ? CONSISTENT : INCONSISTENT;
    }
}
