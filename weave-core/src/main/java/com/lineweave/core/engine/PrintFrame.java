package com.lineweave.core.engine;

/**
 * 打印栈帧：一个已打开的分组
 */
public final class PrintFrame {
    private final int baseline;
    private final PrintMode mode;

    public PrintFrame(int baseline, PrintMode mode) {
        this.baseline = baseline;
        this.mode = mode;
    }

    /** 组内换行后剩余宽度的基准 */
    public int getBaseline() {
        return baseline;
    }

    public PrintMode getMode() {
        return mode;
    }

    @Override
    public String toString() {
        return "PrintFrame(" + baseline + ", " + mode + ")";
    }
}
