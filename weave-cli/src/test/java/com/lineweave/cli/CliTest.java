package com.lineweave.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * weave 命令行测试
 */
@DisplayName("命令行")
class CliTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path file(String name, String content) throws IOException {
        Path path = tempDir.resolve(name);
        Files.createDirectories(path.getParent());
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    private static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("未指定子命令时输出用法")
    void testUsage() {
        assertThat(run()).isEqualTo(0);
        assertThat(out.toString()).contains("weave").contains("fmt");
    }

    @Test
    @DisplayName("入口命令行注册全部子命令")
    void testEntryCommandLine() {
        assertThat(Main.consoleCharset()).isNotNull();
        CommandLine cmd = Main.newCommandLine(StandardCharsets.UTF_8);
        assertThat(cmd.getSubcommands()).containsKeys("fmt", "render", "tokens");
    }

    @Nested
    @DisplayName("fmt")
    class Fmt {

        @Test
        @DisplayName("默认输出到标准输出")
        void testStdout() throws IOException {
            Path src = file("a.txt", "foo(a, b)");
            assertThat(run("fmt", "--width", "6", src.toString())).isEqualTo(0);
            assertThat(out.toString().trim()).isEqualTo("foo(a,\n    b)");
            assertThat(read(src)).isEqualTo("foo(a, b)");
        }

        @Test
        @DisplayName("--write 改写原文件")
        void testWrite() throws IOException {
            Path src = file("a.txt", "foo(  a,\n b )");
            assertThat(run("fmt", "--write", src.toString())).isEqualTo(0);
            assertThat(read(src)).isEqualTo("foo(a, b)");
            assertThat(out.toString()).contains("已格式化");
        }

        @Test
        @DisplayName("--use-tabs 用 Tab 缩进")
        void testTabs() throws IOException {
            Path src = file("a.txt", "foo(a, b)");
            assertThat(run("fmt", "-w", "6", "--use-tabs", src.toString())).isEqualTo(0);
            assertThat(out.toString().trim()).isEqualTo("foo(a,\n\tb)");
        }

        @Test
        @DisplayName("目录按扩展名递归处理")
        void testDirectory() throws IOException {
            Path a = file("a.txt", "x   y");
            Path c = file("sub/c.txt", "p\n\nq");
            Path md = file("b.md", "m   n");
            assertThat(run("fmt", "--write", tempDir.toString())).isEqualTo(0);
            assertThat(read(a)).isEqualTo("x y");
            assertThat(read(c)).isEqualTo("p q");
            assertThat(read(md)).isEqualTo("m   n");

            assertThat(run("fmt", "--write", "--ext", "md", tempDir.toString())).isEqualTo(0);
            assertThat(read(md)).isEqualTo("m n");
        }

        @Test
        @DisplayName("多个文件输出到标准输出时带文件头")
        void testHeaders() throws IOException {
            Path a = file("a.txt", "one");
            Path b = file("b.txt", "two");
            assertThat(run("fmt", a.toString(), b.toString())).isEqualTo(0);
            assertThat(out.toString())
                    .contains("==> " + a + " <==")
                    .contains("==> " + b + " <==")
                    .contains("one")
                    .contains("two");
        }

        @Test
        @DisplayName("文件不存在时返回 1 并继续处理其余文件")
        void testMissingFile() throws IOException {
            Path ok = file("ok.txt", "a   b");
            int code = run("fmt", "--write", tempDir.resolve("missing.txt").toString(), ok.toString());
            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).contains("文件不存在");
            assertThat(read(ok)).isEqualTo("a b");
        }

        @Test
        @DisplayName("普通英文文本中的撇号")
        void testApostrophe() throws IOException {
            Path src = file("notes.txt", "don't   stop,\nit's fine");
            assertThat(run("fmt", "--write", tempDir.toString())).isEqualTo(0);
            assertThat(read(src)).isEqualTo("don't stop, it's fine");
            assertThat(err.toString()).isEmpty();
        }

        @Test
        @DisplayName("未闭合的引号报告行列")
        void testTokenizeError() throws IOException {
            Path src = file("bad.txt", "ok\nx \"open");
            assertThat(run("fmt", src.toString())).isEqualTo(1);
            assertThat(err.toString()).contains("格式化错误").contains("line 2");
        }

        @Test
        @DisplayName("非法行宽")
        void testInvalidWidth() throws IOException {
            Path src = file("a.txt", "x");
            assertThat(run("fmt", "--width", "0", src.toString())).isEqualTo(1);
            assertThat(err.toString()).contains("错误");
        }
    }

    @Nested
    @DisplayName("render")
    class Render {

        private static final String TOKENS = "[{\"type\":\"begin\",\"offset\":2,\"mode\":\"consistent\"},"
                + "{\"type\":\"string\",\"text\":\"aaa\"},{\"type\":\"break\"},"
                + "{\"type\":\"string\",\"text\":\"bbb\"},{\"type\":\"end\"}]";

        @Test
        @DisplayName("行宽足够时不换行")
        void testFits() throws IOException {
            Path json = file("t.json", TOKENS);
            assertThat(run("render", json.toString())).isEqualTo(0);
            assertThat(out.toString().trim()).isEqualTo("aaa bbb");
        }

        @Test
        @DisplayName("放不下时按偏移换行")
        void testBreaks() throws IOException {
            Path json = file("t.json", TOKENS);
            assertThat(run("render", "--width", "5", json.toString())).isEqualTo(0);
            assertThat(out.toString().trim()).isEqualTo("aaa\n  bbb");
        }

        @Test
        @DisplayName("非法 JSON 返回 1")
        void testMalformed() throws IOException {
            Path json = file("t.json", "{\"type\":\"end\"}");
            assertThat(run("render", json.toString())).isEqualTo(1);
            assertThat(err.toString()).contains("排版错误");
        }
    }

    @Nested
    @DisplayName("tokens")
    class Tokens {

        @Test
        @DisplayName("以 JSON 输出分词结果")
        void testDump() throws IOException {
            Path src = file("a.txt", "f(x)");
            assertThat(run("tokens", src.toString())).isEqualTo(0);
            assertThat(out.toString())
                    .contains("\"type\": \"begin\"")
                    .contains("\"text\": \"f(\"")
                    .contains("\"type\": \"eof\"");
        }

        @Test
        @DisplayName("输出可被 render 读回")
        void testRoundTrip() throws IOException {
            Path src = file("a.txt", "foo(a, b)");
            assertThat(run("tokens", src.toString())).isEqualTo(0);
            Path json = file("t.json", out.toString());
            out.getBuffer().setLength(0);
            assertThat(run("render", "-w", "6", json.toString())).isEqualTo(0);
            assertThat(out.toString().trim()).isEqualTo("foo(a,\n    b)");
        }
    }
}
