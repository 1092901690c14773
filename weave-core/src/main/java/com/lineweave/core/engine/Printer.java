package com.lineweave.core.engine;

import com.lineweave.core.sink.OutputSink;
import com.lineweave.core.token.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 打印阶段：把已知宽度的 token 变成具体的换行和缩进
 *
 * <p>每个打开的分组对应一个 {@link PrintFrame}。分组的排版方式在其 BEGIN
 * 出队时一次性确定：整组宽度不超过当前行剩余宽度则为 {@link PrintMode#FITS}，
 * 否则采用分组请求的方式。</p>
 */
public class Printer {
    private static final Logger LOG = Logger.getLogger(Printer.class.getName());

    private final int margin;
    private final OutputSink sink;
    private final Deque<PrintFrame> printStack = new ArrayDeque<>();
    /** 不在任何分组内的换行点按整页处理 */
    private final PrintFrame rootFrame;

    private int space;
    private int overflowCount = 0;

    public Printer(int margin, OutputSink sink) {
        this.margin = margin;
        this.sink = sink;
        this.space = margin;
        this.rootFrame = new PrintFrame(margin, PrintMode.INCONSISTENT);
    }

    /**
     * 打印一个 token
     *
     * @param token 非 EOF 的 token
     * @param size  扫描阶段确定的宽度
     */
    public void print(Token token, long size) {
        switch (token.getKind()) {
            case BEGIN:
                if (size <= space) {
                    printStack.push(new PrintFrame(0, PrintMode.FITS));
                } else {
                    printStack.push(new PrintFrame(space - token.getOffset(), PrintMode.of(token.getMode())));
                }
                break;

            case END:
                if (printStack.isEmpty()) {
                    LOG.warning("打印栈为空，忽略 END");
                } else {
                    printStack.pop();
                }
                break;

            case BREAK:
                printBreak(token, size);
                break;

            case STRING:
                if (size > space) {
                    overflowCount++;
                    if (LOG.isLoggable(Level.FINE)) {
                        LOG.fine("文本超出行宽: \"" + token.getText() + "\" (" + size + " > " + space + ")");
                    }
                }
                space -= (int) size;
                sink.text(token.getText());
                break;

            default:
                throw new IllegalStateException("unexpected token at print time: " + token);
        }
    }

    private void printBreak(Token token, long size) {
        PrintFrame frame = printStack.isEmpty() ? rootFrame : printStack.peek();
        switch (frame.getMode()) {
            case FITS:
                inline(token);
                break;
            case CONSISTENT:
                newline(frame, token);
                break;
            case INCONSISTENT:
                if (size > space) {
                    newline(frame, token);
                } else {
                    inline(token);
                }
                break;
            default:
                throw new IllegalStateException("unknown print mode: " + frame.getMode());
        }
    }

    private void inline(Token token) {
        space -= token.getBlankSpace();
        sink.blanks(token.getBlankSpace());
    }

    /** 缩进不小于 0：剩余宽度不超过行宽 */
    private void newline(PrintFrame frame, Token token) {
        space = Math.min(frame.getBaseline() - token.getOffset(), margin);
        sink.newline(margin - space);
    }

    /** 当前行剩余宽度 */
    public int space() {
        return space;
    }

    /** 当前打开的分组数 */
    public int depth() {
        return printStack.size();
    }

    /** 超出行宽的文本个数 */
    public int overflowCount() {
        return overflowCount;
    }
}
