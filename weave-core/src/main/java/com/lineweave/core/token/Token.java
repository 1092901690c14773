package com.lineweave.core.token;

import java.util.Objects;

/**
 * 排版词法单元
 *
 * <p>不可变值对象。各字段仅对相应类型有意义：</p>
 * <ul>
 *   <li>{@code STRING}: {@link #getText()}</li>
 *   <li>{@code BREAK}: {@link #getBlankSpace()}, {@link #getOffset()}</li>
 *   <li>{@code BEGIN}: {@link #getOffset()}, {@link #getMode()}</li>
 * </ul>
 */
public final class Token {

    /**
     * 强制换行的空白宽度。行宽必须小于该值，因此带此宽度的换行点永远放不进一行。
     */
    public static final int SIZE_INFINITY = 0xffff;

    private static final Token END = new Token(TokenKind.END, null, 0, 0, null);
    private static final Token EOF = new Token(TokenKind.EOF, null, 0, 0, null);

    private final TokenKind kind;
    private final String text;
    private final int blankSpace;
    private final int offset;
    private final BreakMode mode;

    private Token(TokenKind kind, String text, int blankSpace, int offset, BreakMode mode) {
        this.kind = kind;
        this.text = text;
        this.blankSpace = blankSpace;
        this.offset = offset;
        this.mode = mode;
    }

    public static Token string(String text) {
        Objects.requireNonNull(text, "text");
        return new Token(TokenKind.STRING, text, 0, 0, null);
    }

    /**
     * @param blankSpace 不换行时输出的空格数
     * @param offset     换行时相对所在分组的额外缩进
     */
    public static Token breakToken(int blankSpace, int offset) {
        if (blankSpace < 0) {
            throw new IllegalArgumentException("blankSpace must not be negative: " + blankSpace);
        }
        return new Token(TokenKind.BREAK, null, blankSpace, offset, null);
    }

    /** 必须换行的换行点 */
    public static Token lineBreak(int offset) {
        return breakToken(SIZE_INFINITY, offset);
    }

    /**
     * @param offset 分组内部换行的缩进基准
     * @param mode   放不下时的换行方式
     */
    public static Token begin(int offset, BreakMode mode) {
        Objects.requireNonNull(mode, "mode");
        return new Token(TokenKind.BEGIN, null, 0, offset, mode);
    }

    public static Token end() {
        return END;
    }

    public static Token eof() {
        return EOF;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getBlankSpace() {
        return blankSpace;
    }

    public int getOffset() {
        return offset;
    }

    public BreakMode getMode() {
        return mode;
    }

    public boolean is(TokenKind kind) {
        return this.kind == kind;
    }

    /** 是否为强制换行 */
    public boolean isLineBreak() {
        return kind == TokenKind.BREAK && blankSpace >= SIZE_INFINITY;
    }

    /** 该 token 在不换行时占用的宽度，文本按码点计数 */
    public int width() {
        switch (kind) {
            case STRING: return text.codePointCount(0, text.length());
            case BREAK:  return blankSpace;
            default:     return 0;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return kind == other.kind
                && blankSpace == other.blankSpace
                && offset == other.offset
                && mode == other.mode
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, blankSpace, offset, mode);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING:
                return "STRING(\"" + text + "\")";
            case BREAK:
                return isLineBreak()
                        ? String.format("LINEBREAK(%d)", offset)
                        : String.format("BREAK(%d, %d)", blankSpace, offset);
            case BEGIN:
                return String.format("BEGIN(%d, %s)", offset, mode);
            default:
                return kind.name();
        }
    }
}
