package com.lineweave.core;

import com.lineweave.core.token.BreakMode;
import com.lineweave.core.token.Token;

/**
 * 排版配置
 */
public class PrettyPrintConfig {
    /** 扫描缓冲区容量 = 行宽 × 该系数 */
    public static final int BUFFER_FACTOR = 3;

    private int lineWidth = 80;
    private int indentSize = 4;
    private boolean useTabs = false;
    private int tabSize = 4;
    private String lineSeparator = "\n";
    private BreakMode bracketMode = BreakMode.INCONSISTENT;

    public PrettyPrintConfig() {
    }

    public int getLineWidth() {
        return lineWidth;
    }

    public void setLineWidth(int lineWidth) {
        this.lineWidth = lineWidth;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseTabs() {
        return useTabs;
    }

    public void setUseTabs(boolean useTabs) {
        this.useTabs = useTabs;
    }

    public int getTabSize() {
        return tabSize;
    }

    public void setTabSize(int tabSize) {
        this.tabSize = tabSize;
    }

    public String getLineSeparator() {
        return lineSeparator;
    }

    public void setLineSeparator(String lineSeparator) {
        this.lineSeparator = lineSeparator;
    }

    public BreakMode getBracketMode() {
        return bracketMode;
    }

    public void setBracketMode(BreakMode bracketMode) {
        this.bracketMode = bracketMode;
    }

    /** 扫描缓冲区容量 */
    public int getBufferCapacity() {
        return BUFFER_FACTOR * lineWidth;
    }

    /**
     * 获取 {@code columns} 列缩进对应的字符串
     */
    public String getIndentString(int columns) {
        StringBuilder sb = new StringBuilder();
        int spaces = columns;
        if (useTabs) {
            for (int i = 0; i < columns / tabSize; i++) {
                sb.append('\t');
            }
            spaces = columns % tabSize;
        }
        for (int i = 0; i < spaces; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }

    /**
     * 校验配置
     *
     * @throws PrettyPrintException 配置非法
     */
    public PrettyPrintConfig validate() {
        if (lineWidth < 1 || lineWidth >= Token.SIZE_INFINITY) {
            throw new PrettyPrintException("lineWidth must be in [1, " + Token.SIZE_INFINITY + "): " + lineWidth);
        }
        if (indentSize < 0) {
            throw new PrettyPrintException("indentSize must not be negative: " + indentSize);
        }
        if (tabSize < 1) {
            throw new PrettyPrintException("tabSize must be positive: " + tabSize);
        }
        if (lineSeparator == null || lineSeparator.isEmpty()) {
            throw new PrettyPrintException("lineSeparator must not be empty");
        }
        if (bracketMode == null) {
            throw new PrettyPrintException("bracketMode must not be null");
        }
        return this;
    }

    public PrettyPrintConfig copy() {
        PrettyPrintConfig c = new PrettyPrintConfig();
        c.lineWidth = lineWidth;
        c.indentSize = indentSize;
        c.useTabs = useTabs;
        c.tabSize = tabSize;
        c.lineSeparator = lineSeparator;
        c.bracketMode = bracketMode;
        return c;
    }
}
