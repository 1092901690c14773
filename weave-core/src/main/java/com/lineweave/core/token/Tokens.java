package com.lineweave.core.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * token 序列构建器
 *
 * <pre>
 * List&lt;Token&gt; tokens = new Tokens()
 *         .cbox(2).text("foo(").brk(0, 0).text("a,").space().text("b").end().text(")")
 *         .eof()
 *         .build();
 * </pre>
 */
public class Tokens {
    private final List<Token> tokens = new ArrayList<>();

    public Tokens text(String text) {
        tokens.add(Token.string(text));
        return this;
    }

    /** 单个空格的换行点 */
    public Tokens space() {
        return brk(1, 0);
    }

    public Tokens brk(int blankSpace, int offset) {
        tokens.add(Token.breakToken(blankSpace, offset));
        return this;
    }

    public Tokens lineBreak() {
        tokens.add(Token.lineBreak(0));
        return this;
    }

    public Tokens begin(int offset, BreakMode mode) {
        tokens.add(Token.begin(offset, mode));
        return this;
    }

    /** consistent 分组 */
    public Tokens cbox(int offset) {
        return begin(offset, BreakMode.CONSISTENT);
    }

    /** inconsistent 分组 */
    public Tokens ibox(int offset) {
        return begin(offset, BreakMode.INCONSISTENT);
    }

    public Tokens end() {
        tokens.add(Token.end());
        return this;
    }

    public Tokens eof() {
        tokens.add(Token.eof());
        return this;
    }

    public Tokens add(Token token) {
        tokens.add(token);
        return this;
    }

    public List<Token> build() {
        return Collections.unmodifiableList(new ArrayList<>(tokens));
    }
}
