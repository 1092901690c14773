package com.lineweave.text;

import com.lineweave.core.PrettyPrintConfig;
import com.lineweave.core.token.BreakMode;
import com.lineweave.core.token.Token;
import com.lineweave.core.token.TokenKind;
import com.lineweave.core.token.Tokens;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TextTokenizer 单元测试
 */
class TextTokenizerTest {

    /** 分词，返回完整 token 列表（含外层分组和 EOF） */
    private List<Token> scan(String source) {
        return new TextTokenizer().tokenize(source);
    }

    /** 只保留文本 */
    private List<String> words(String source) {
        return scan(source).stream()
                .filter(t -> t.is(TokenKind.STRING))
                .map(Token::getText)
                .collect(Collectors.toList());
    }

    /** 文档外层分组 + 内容 + EOF */
    private static Tokens document() {
        return new Tokens().ibox(0);
    }

    // ================================================================
    // 空白
    // ================================================================

    @Nested
    @DisplayName("空白")
    class BlankTests {

        @Test
        @DisplayName("单词之间的空白变成一个换行点")
        void testSimpleWords() {
            assertEquals(document().text("a").space().text("b").end().eof().build(), scan("a b"));
        }

        @Test
        @DisplayName("首尾空白和连续空白被合并")
        void testWhitespaceRuns() {
            assertEquals(scan("a b"), scan("  a \n\t\r b  \n"));
        }

        @Test
        @DisplayName("空输入只有外层分组")
        void testEmpty() {
            assertEquals(document().end().eof().build(), scan(""));
        }

        @Test
        @DisplayName("各种空白字符")
        void testBlankChars() {
            assertTrue(TextTokenizer.isBlank('\u000B'));
            assertTrue(TextTokenizer.isBlank('\f'));
            assertTrue(TextTokenizer.isBlank('\0'));
            assertFalse(TextTokenizer.isBlank('x'));
        }
    }

    // ================================================================
    // 括号
    // ================================================================

    @Nested
    @DisplayName("括号分组")
    class BracketTests {

        @Test
        @DisplayName("左括号连同前面的单词开启分组")
        void testCall() {
            List<Token> expected = document()
                    .ibox(4).text("foo(").text("a,").space().text("b").end()
                    .text(")")
                    .end().eof().build();
            assertEquals(expected, scan("foo(a, b)"));
        }

        @Test
        @DisplayName("括号内侧的空白不产生换行点")
        void testInnerWhitespace() {
            List<Token> expected = document()
                    .text("x").space().text("=").space()
                    .ibox(4).text("[").text("1,").space().text("2").end()
                    .text("]")
                    .end().eof().build();
            assertEquals(expected, scan("x = [ 1, 2 ]"));
        }

        @Test
        @DisplayName("嵌套括号")
        void testNested() {
            assertEquals(List.of("f(", "g(", "x", ")", ")"), words("f(g(x))"));
            long begins = scan("f(g(x))").stream().filter(t -> t.is(TokenKind.BEGIN)).count();
            long ends = scan("f(g(x))").stream().filter(t -> t.is(TokenKind.END)).count();
            assertEquals(3, begins);
            assertEquals(3, ends);
        }

        @Test
        @DisplayName("分组方式和缩进来自配置")
        void testConfig() {
            PrettyPrintConfig config = new PrettyPrintConfig();
            config.setIndentSize(2);
            config.setBracketMode(BreakMode.CONSISTENT);
            List<Token> tokens = new TextTokenizer(config).tokenize("{a}");
            assertEquals(Token.begin(2, BreakMode.CONSISTENT), tokens.get(1));
        }

        @Test
        @DisplayName("不配对的右括号原样传递")
        void testUnbalanced() {
            List<Token> expected = document().text("a").end().text(")").end().eof().build();
            assertEquals(expected, scan("a)"));
        }
    }

    // ================================================================
    // 引号
    // ================================================================

    @Nested
    @DisplayName("引号")
    class QuoteTests {

        @Test
        @DisplayName("引号内的空白和括号不拆分")
        void testQuotedWord() {
            assertEquals(List.of("say", "\"hello (world)\"", "x"), words("say \"hello (world)\" x"));
        }

        @Test
        @DisplayName("转义的引号")
        void testEscapedQuote() {
            assertEquals(List.of("'it\\'s'"), words("'it\\'s'"));
        }

        @Test
        @DisplayName("引号串与后面的字符组成一个单词")
        void testQuoteThenSuffix() {
            assertEquals(List.of("x", "\"a b\";"), words("x \"a b\";"));
        }

        @Test
        @DisplayName("单词中间的引号是普通字符")
        void testQuoteInsideWord() {
            assertEquals(List.of("name=\"a", "b\";"), words("name=\"a b\";"));
        }

        @Test
        @DisplayName("英文缩写中的撇号不开启引号")
        void testApostrophe() {
            assertEquals(List.of("don't", "stop"), words("don't stop"));
            assertEquals(List.of("don't", "stop", "it's", "fine"), words("don't stop\nit's fine"));
        }

        @Test
        @DisplayName("未闭合的引号报告位置")
        void testUnterminated() {
            TokenizeException e = assertThrows(TokenizeException.class, () -> scan("ok\na \"bc\nd"));
            assertEquals(2, e.getLine());
            assertEquals(3, e.getColumn());
            assertTrue(e.getMessage().contains("line 2"));
        }
    }
}
