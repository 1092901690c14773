package com.lineweave.text;

import com.lineweave.core.PrettyPrintConfig;
import com.lineweave.core.token.BreakMode;
import com.lineweave.core.token.Token;
import com.lineweave.core.token.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 字符级分词器：把任意文本转换为排版 token 流
 *
 * <p>不理解任何语法，只识别三类字符：</p>
 * <ul>
 *   <li>空白：分隔单词，两个单词之间的一串空白变成一个 {@code BREAK(1, 0)}</li>
 *   <li>左括号 {@code ( [ {}：连同前面的单词开启一个分组</li>
 *   <li>右括号 {@code ) ] }}：关闭分组，括号本身成为下一个单词的开头</li>
 * </ul>
 * <p>以引号开头的单词读到配对的引号为止（支持反斜杠转义），中间不拆分；
 * 单词中间的引号是普通字符。整篇文本包在一个 inconsistent 分组里。</p>
 */
public class TextTokenizer {
    private final PrettyPrintConfig config;

    private String source;
    private int current;
    private int line;
    private int column;

    private List<Token> tokens;
    private final StringBuilder word = new StringBuilder();
    private boolean pendingBreak;
    /** 上一个单词以左括号结尾 */
    private boolean groupJustOpened;

    public TextTokenizer(PrettyPrintConfig config) {
        this.config = config;
    }

    public TextTokenizer() {
        this(new PrettyPrintConfig());
    }

    /**
     * 执行分词，返回以 EOF 结尾的 token 列表
     *
     * @throws TokenizeException 引号未闭合
     */
    public List<Token> tokenize(String source) {
        this.source = source;
        this.current = 0;
        this.line = 1;
        this.column = 1;
        this.tokens = new ArrayList<>();
        this.word.setLength(0);
        this.pendingBreak = false;
        this.groupJustOpened = false;

        tokens.add(Token.begin(0, BreakMode.INCONSISTENT));
        while (!isAtEnd()) {
            scanChar();
        }
        flushWord();
        tokens.add(Token.end());
        tokens.add(Token.eof());

        List<Token> result = tokens;
        this.tokens = null;
        this.source = null;
        return result;
    }

    private void scanChar() {
        char c = advance();
        switch (c) {
            case '(':
            case '[':
            case '{':
                emitPendingBreak();
                tokens.add(Token.begin(config.getIndentSize(), config.getBracketMode()));
                word.append(c);
                flushWord();
                groupJustOpened = true;
                break;

            case ')':
            case ']':
            case '}':
                flushWord();
                pendingBreak = false;
                tokens.add(Token.end());
                word.append(c);
                break;

            case '"':
            case '\'':
                if (word.length() == 0) {
                    quoted(c);
                } else {
                    // 词中的引号（如 don't）按普通字符处理
                    word.append(c);
                }
                break;

            default:
                if (isBlank(c)) {
                    flushWord();
                    if (lastKind() == TokenKind.STRING && !groupJustOpened) {
                        pendingBreak = true;
                    }
                } else {
                    word.append(c);
                }
                break;
        }
    }

    /** 从单词开头的引号读到配对的引号，不跨行 */
    private void quoted(char quote) {
        int startLine = line;
        int startColumn = column - 1;
        word.append(quote);
        while (!isAtEnd() && peek() != '\n') {
            char c = advance();
            word.append(c);
            if (c == '\\' && !isAtEnd() && peek() != '\n') {
                word.append(advance());
            } else if (c == quote) {
                return;
            }
        }
        throw new TokenizeException("Unterminated quote " + quote, startLine, startColumn);
    }

    private void flushWord() {
        if (word.length() == 0) return;
        emitPendingBreak();
        groupJustOpened = false;
        tokens.add(Token.string(word.toString()));
        word.setLength(0);
    }

    private void emitPendingBreak() {
        if (pendingBreak) {
            tokens.add(Token.breakToken(1, 0));
            pendingBreak = false;
        }
    }

    private TokenKind lastKind() {
        return tokens.get(tokens.size() - 1).getKind();
    }

    static boolean isBlank(char c) {
        switch (c) {
            case ' ':
            case '\t':
            case '\u000B':
            case '\f':
            case '\0':
            case '\n':
            case '\r':
                return true;
            default:
                return false;
        }
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return source.charAt(current);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }
}
