package com.lineweave.core.token;

/**
 * 排版词法单元类型
 */
public enum TokenKind {
    /** 原子文本，永不拆分 */
    STRING,
    /** 可选换行点 */
    BREAK,
    /** 分组开始 */
    BEGIN,
    /** 分组结束 */
    END,
    /** 流结束，触发清空 */
    EOF
}
