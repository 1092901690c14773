package com.lineweave.core.engine;

import com.lineweave.core.PrettyPrintException;
import com.lineweave.core.buffer.LongRingBuffer;
import com.lineweave.core.buffer.RingBuffer;
import com.lineweave.core.token.Token;
import com.lineweave.core.token.TokenKind;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 扫描阶段：单遍计算每个分组和换行点的宽度
 *
 * <p>{@code tokens} 与 {@code sizes} 是两个同容量、同步增删的环形缓冲区，
 * 同一槽位分别保存 token 和它的宽度。宽度为负表示尚未确定，
 * 此时该槽位一定在扫描栈里；宽度确定后立即交给 {@link Printer}。</p>
 *
 * <p>窗口宽度 {@code rightTotal - leftTotal} 超过当前行剩余宽度时，
 * 最早的未决项被强制为无穷大，因此缓冲区永远不超过行宽的固定倍数。</p>
 */
public class Scanner {
    private static final Logger LOG = Logger.getLogger(Scanner.class.getName());

    /** 强制换行时写入的宽度 */
    static final long SIZE_FORCED = Long.MAX_VALUE;

    private final Printer printer;
    private final RingBuffer<Token> tokens;
    private final LongRingBuffer sizes;
    /** 未决项的槽位，栈底最早 */
    private final RingBuffer<Integer> scanStack;

    private long leftTotal = 1;
    private long rightTotal = 1;
    private int depth = 0;
    private boolean finished = false;

    public Scanner(Printer printer, int capacity) {
        this.printer = printer;
        this.tokens = new RingBuffer<>(capacity);
        this.sizes = new LongRingBuffer(capacity);
        this.scanStack = new RingBuffer<>(capacity);
    }

    /**
     * 输入下一个 token。最后一个必须是 EOF。
     *
     * @throws PrettyPrintException EOF 之后继续输入
     */
    public void feed(Token token) {
        if (finished) {
            throw new PrettyPrintException("token stream already ended with EOF: " + token);
        }
        switch (token.getKind()) {
            case BEGIN:
                if (scanStack.isEmpty()) {
                    resetWindow();
                }
                scanStack.append(enqueue(token, -rightTotal));
                depth++;
                break;

            case END:
                if (depth == 0) {
                    recoverUnmatchedEnd();
                    break;
                }
                depth--;
                if (scanStack.isEmpty()) {
                    printer.print(token, 0);
                } else {
                    scanStack.append(enqueue(token, -1));
                }
                break;

            case BREAK:
                if (scanStack.isEmpty()) {
                    resetWindow();
                } else {
                    resolvePending();
                }
                scanStack.append(enqueue(token, -rightTotal));
                rightTotal += token.getBlankSpace();
                forceFit();
                break;

            case STRING:
                if (scanStack.isEmpty()) {
                    printer.print(token, token.width());
                } else {
                    enqueue(token, token.width());
                    rightTotal += token.width();
                    forceFit();
                }
                break;

            case EOF:
                finish();
                break;

            default:
                throw new IllegalStateException("unknown token kind: " + token.getKind());
        }
    }

    private void finish() {
        if (!scanStack.isEmpty()) {
            resolvePending();
            if (!scanStack.isEmpty()) {
                LOG.warning("EOF 时仍有 " + depth + " 个分组未关闭，按已读内容结算");
                resolveAll();
            }
        } else if (depth > 0) {
            LOG.warning("EOF 时仍有 " + depth + " 个分组未关闭");
        }
        advanceLeft();
        finished = true;
    }

    /**
     * 新的顶层窗口。调用时上一个窗口已全部打印。
     */
    private void resetWindow() {
        leftTotal = 1;
        rightTotal = 1;
        tokens.clear();
        sizes.clear();
    }

    private int enqueue(Token token, long size) {
        while (tokens.isFull()) {
            // 只有连续的零宽 token 才会走到这里
            LOG.fine("扫描缓冲区已满，强制输出队首");
            forceOnce();
        }
        int slot = tokens.append(token);
        if (sizes.append(size) != slot) {
            throw new IllegalStateException("token and size buffers out of step at slot " + slot);
        }
        return slot;
    }

    /**
     * 从栈顶向下结算已能确定宽度的项：遇到同层的 BEGIN 停止，
     * 或在嵌套计数为 0 时结算完一个 BREAK 后停止。
     */
    private void resolvePending() {
        int k = 0;
        while (!scanStack.isEmpty()) {
            int slot = scanStack.peekLast();
            switch (tokens.getSlot(slot).getKind()) {
                case BEGIN:
                    if (k == 0) {
                        return;
                    }
                    scanStack.removeLast();
                    sizes.addSlot(slot, rightTotal);
                    k--;
                    break;
                case END:
                    scanStack.removeLast();
                    sizes.addSlot(slot, 1);
                    k++;
                    break;
                default:
                    scanStack.removeLast();
                    sizes.addSlot(slot, rightTotal);
                    if (k == 0) {
                        return;
                    }
                    break;
            }
        }
    }

    /** 结算扫描栈里的所有项，未关闭的分组按当前已读宽度计算 */
    private void resolveAll() {
        while (!scanStack.isEmpty()) {
            int slot = scanStack.removeLast();
            if (tokens.getSlot(slot).getKind() == TokenKind.END) {
                sizes.addSlot(slot, 1);
            } else {
                sizes.addSlot(slot, rightTotal);
            }
        }
    }

    private void recoverUnmatchedEnd() {
        LOG.warning("忽略不匹配的 END，已缓冲内容按一个分组输出");
        resolveAll();
        advanceLeft();
    }

    private void forceFit() {
        while (rightTotal - leftTotal > printer.space() && !tokens.isEmpty()) {
            forceOnce();
        }
    }

    /**
     * 队首若是最早的未决项则强制其宽度为无穷大，再输出队首所有已定项。
     */
    private void forceOnce() {
        if (!scanStack.isEmpty() && scanStack.peekFirst() == tokens.firstSlot()) {
            int slot = scanStack.removeFirst();
            sizes.setSlot(slot, SIZE_FORCED);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("窗口宽度 " + windowWidth() + " 超出剩余宽度 " + printer.space()
                        + "，强制换行: " + tokens.getSlot(slot));
            }
        }
        advanceLeft();
    }

    private void advanceLeft() {
        while (!tokens.isEmpty() && sizes.peekFirst() >= 0) {
            Token token = tokens.removeFirst();
            long size = sizes.removeFirst();
            printer.print(token, size);
            leftTotal += token.width();
        }
    }

    /** 已缓冲、尚未打印部分的宽度 */
    public long windowWidth() {
        return rightTotal - leftTotal;
    }

    /** 已缓冲的 token 数 */
    public int bufferedCount() {
        return tokens.size();
    }

    public int capacity() {
        return tokens.capacity();
    }

    /** 当前未关闭的分组数 */
    public int depth() {
        return depth;
    }

    public boolean isFinished() {
        return finished;
    }
}
