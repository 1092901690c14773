package com.lineweave.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.Console;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lineweave CLI 入口点（picocli）
 */
@Command(name = "weave", version = "Lineweave v0.1.0",
         mixinStandardHelpOptions = true,
         description = "按行宽重排文本",
         subcommands = {FmtCommand.class, RenderCommand.class, TokensCommand.class})
public class Main implements Runnable {

    static final String LOGGER_ROOT = "com.lineweave";

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "输出排版诊断日志")
    void setVerbose(boolean verbose) {
        if (verbose) {
            enableVerboseLogging();
        }
    }

    @Override
    public void run() {
        // 未指定子命令
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    static void enableVerboseLogging() {
        Logger root = Logger.getLogger(LOGGER_ROOT);
        root.setLevel(Level.FINE);
        for (Handler h : root.getHandlers()) {
            if (h instanceof ConsoleHandler) {
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        root.addHandler(handler);
    }

    public static void main(String[] args) {
        System.exit(newCommandLine(consoleCharset()).execute(args));
    }

    /**
     * 创建输出按指定编码写到标准输出/标准错误的命令行
     */
    static CommandLine newCommandLine(Charset charset) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(new OutputStreamWriter(System.out, charset), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(System.err, charset), true));
        return cmd;
    }

    /** 终端编码，不在终端中运行时取 native.encoding，都没有则用 UTF-8 */
    static Charset consoleCharset() {
        Console console = System.console();
        if (console != null) {
            return console.charset();
        }
        String nativeEncoding = System.getProperty("native.encoding");
        if (nativeEncoding != null && Charset.isSupported(nativeEncoding)) {
            return Charset.forName(nativeEncoding);
        }
        return StandardCharsets.UTF_8;
    }
}
