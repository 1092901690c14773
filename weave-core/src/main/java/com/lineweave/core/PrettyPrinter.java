package com.lineweave.core;

import com.lineweave.core.engine.Printer;
import com.lineweave.core.engine.Scanner;
import com.lineweave.core.sink.OutputSink;
import com.lineweave.core.sink.StringOutputSink;
import com.lineweave.core.token.Token;
import com.lineweave.core.token.TokenKind;

import java.util.List;

/**
 * 排版引擎入口
 *
 * <p>一个实例只处理一条以 EOF 结尾的 token 流，用完即弃。
 * 不同文档可在不同线程中各用一个实例并行排版。</p>
 *
 * <pre>
 * StringOutputSink sink = new StringOutputSink(config);
 * PrettyPrinter pp = new PrettyPrinter(config, sink);
 * pp.feedAll(tokens);
 * String text = sink.getOutput();
 * </pre>
 */
public class PrettyPrinter {
    private final Scanner scanner;
    private final Printer printer;

    public PrettyPrinter(PrettyPrintConfig config, OutputSink sink) {
        config.validate();
        this.printer = new Printer(config.getLineWidth(), sink);
        this.scanner = new Scanner(printer, config.getBufferCapacity());
    }

    public PrettyPrinter(int lineWidth, OutputSink sink) {
        this(widthConfig(lineWidth), sink);
    }

    public void feed(Token token) {
        scanner.feed(token);
    }

    public void feedAll(Iterable<Token> tokens) {
        for (Token token : tokens) {
            scanner.feed(token);
        }
    }

    public boolean isFinished() {
        return scanner.isFinished();
    }

    /** 超出行宽的文本个数 */
    public int overflowCount() {
        return printer.overflowCount();
    }

    /** 已缓冲、尚未打印部分的宽度 */
    public long windowWidth() {
        return scanner.windowWidth();
    }

    /**
     * 排版整条 token 流并写入 sink，缺少结尾 EOF 时自动补上
     *
     * @return 超出行宽的文本个数
     */
    public static int format(List<Token> tokens, PrettyPrintConfig config, OutputSink sink) {
        PrettyPrinter pp = new PrettyPrinter(config, sink);
        pp.feedAll(tokens);
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            pp.feed(Token.eof());
        }
        return pp.overflowCount();
    }

    public static String format(List<Token> tokens, PrettyPrintConfig config) {
        StringOutputSink sink = new StringOutputSink(config);
        format(tokens, config, sink);
        return sink.getOutput();
    }

    public static String format(List<Token> tokens, int lineWidth) {
        return format(tokens, widthConfig(lineWidth));
    }

    private static PrettyPrintConfig widthConfig(int lineWidth) {
        PrettyPrintConfig config = new PrettyPrintConfig();
        config.setLineWidth(lineWidth);
        return config;
    }
}
