package com.lineweave.core.sink;

/**
 * 排版输出端
 *
 * <p>引擎只通过这三个操作输出。实现抛出的异常原样传给调用者。</p>
 */
public interface OutputSink {

    /** 输出原子文本 */
    void text(String text);

    /** 输出 {@code count} 个空白 */
    void blanks(int count);

    /** 换行，并缩进 {@code indent} 列 */
    void newline(int indent);
}
