package com.lineweave.core.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Token 测试")
class TokenTest {

    @Test
    @DisplayName("各类 token 的宽度")
    void testWidth() {
        assertThat(Token.string("hello").width()).isEqualTo(5);
        assertThat(Token.breakToken(2, 4).width()).isEqualTo(2);
        assertThat(Token.begin(2, BreakMode.CONSISTENT).width()).isZero();
        assertThat(Token.end().width()).isZero();
    }

    @Test
    @DisplayName("补充平面字符按一个字符计宽")
    void testSupplementaryWidth() {
        String smiles = "\uD83D\uDE00\uD83D\uDE00\uD83D\uDE00";
        assertThat(smiles.length()).isEqualTo(6);
        assertThat(Token.string(smiles).width()).isEqualTo(3);
        assertThat(Token.string("中文").width()).isEqualTo(2);
    }

    @Test
    @DisplayName("强制换行")
    void testLineBreak() {
        Token lb = Token.lineBreak(2);
        assertThat(lb.is(TokenKind.BREAK)).isTrue();
        assertThat(lb.isLineBreak()).isTrue();
        assertThat(lb.getBlankSpace()).isEqualTo(Token.SIZE_INFINITY);
        assertThat(Token.breakToken(1, 0).isLineBreak()).isFalse();
        assertThat(lb.toString()).isEqualTo("LINEBREAK(2)");
    }

    @Test
    @DisplayName("值相等")
    void testEquality() {
        assertThat(Token.string("a")).isEqualTo(Token.string("a"));
        assertThat(Token.begin(2, BreakMode.CONSISTENT)).isNotEqualTo(Token.begin(2, BreakMode.INCONSISTENT));
        assertThat(Token.breakToken(1, 0)).hasSameHashCodeAs(Token.breakToken(1, 0));
    }

    @Test
    @DisplayName("非法参数")
    void testInvalid() {
        assertThatThrownBy(() -> Token.breakToken(-1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Token.string(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("构建器按顺序生成 token")
    void testBuilder() {
        List<Token> tokens = new Tokens().cbox(2).text("a").space().text("b").end().eof().build();
        assertThat(tokens).containsExactly(
                Token.begin(2, BreakMode.CONSISTENT),
                Token.string("a"),
                Token.breakToken(1, 0),
                Token.string("b"),
                Token.end(),
                Token.eof());
        assertThatThrownBy(() -> tokens.add(Token.eof())).isInstanceOf(UnsupportedOperationException.class);
    }
}
