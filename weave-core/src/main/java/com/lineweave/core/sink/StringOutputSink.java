package com.lineweave.core.sink;

import com.lineweave.core.PrettyPrintConfig;

/**
 * 输出到内存缓冲区
 *
 * <p>空白延迟写出：紧跟换行或位于末尾的空白被丢弃，因此不会产生行尾空格。</p>
 */
public class StringOutputSink implements OutputSink {
    private final StringBuilder output = new StringBuilder();
    private final PrettyPrintConfig config;
    private int pendingBlanks = 0;
    private int lineCount = 1;

    public StringOutputSink() {
        this(new PrettyPrintConfig());
    }

    public StringOutputSink(PrettyPrintConfig config) {
        this.config = config;
    }

    @Override
    public void text(String text) {
        if (text.isEmpty()) return;
        flushBlanks();
        output.append(text);
    }

    @Override
    public void blanks(int count) {
        pendingBlanks += Math.max(count, 0);
    }

    @Override
    public void newline(int indent) {
        pendingBlanks = 0;
        output.append(config.getLineSeparator());
        output.append(config.getIndentString(Math.max(indent, 0)));
        lineCount++;
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    public int getLineCount() {
        return lineCount;
    }

    /**
     * 获取当前行的字符数（按码点，不含尚未写出的空白）
     */
    public int getCurrentLineLength() {
        int lastNewline = output.lastIndexOf(config.getLineSeparator());
        int start = lastNewline < 0 ? 0 : lastNewline + config.getLineSeparator().length();
        return output.codePointCount(start, output.length());
    }

    private void flushBlanks() {
        for (int i = 0; i < pendingBlanks; i++) {
            output.append(' ');
        }
        pendingBlanks = 0;
    }
}
