package com.lineweave.cli;

import com.lineweave.core.PrettyPrintConfig;
import com.lineweave.core.PrettyPrintException;
import com.lineweave.core.PrettyPrinter;
import com.lineweave.core.sink.WriterOutputSink;
import com.lineweave.core.token.Token;
import com.lineweave.text.TextTokenizer;
import com.lineweave.text.TokenizeException;
import com.lineweave.text.json.JsonTokenReader;
import com.lineweave.text.json.JsonTokenWriter;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 子命令的执行逻辑
 *
 * <p>所有方法返回进程退出码：0 成功，1 至少一个输入出错。
 * 出错的文件不会中断其余文件的处理。</p>
 */
public class FormatRunner {

    private static final Logger LOG = Logger.getLogger(FormatRunner.class.getName());

    private final PrettyPrintConfig config;
    private final PrintWriter out;
    private final PrintWriter err;

    public FormatRunner(PrettyPrintConfig config, PrintWriter out, PrintWriter err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /**
     * 格式化文件或目录
     *
     * @param paths      文件或目录
     * @param extensions 遍历目录时保留的扩展名（不含点号）
     * @param write      true 时改写原文件，否则输出到 out
     */
    public int formatPaths(List<Path> paths, Set<String> extensions, boolean write) {
        try {
            config.validate();
        } catch (PrettyPrintException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }

        int status = 0;
        List<Path> files = new ArrayList<>();
        for (Path path : paths) {
            if (!Files.exists(path)) {
                err.println("错误: 文件不存在 - " + path);
                status = 1;
            } else if (Files.isDirectory(path)) {
                try {
                    files.addAll(collectFiles(path, extensions));
                } catch (IOException e) {
                    err.println("错误: 无法遍历目录 - " + path + ": " + e.getMessage());
                    status = 1;
                }
            } else {
                files.add(path);
            }
        }

        boolean showHeader = !write && files.size() > 1;
        for (Path file : files) {
            try {
                String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
                List<Token> tokens = new TextTokenizer(config).tokenize(source);
                if (write) {
                    Files.write(file, PrettyPrinter.format(tokens, config).getBytes(StandardCharsets.UTF_8));
                    out.println("已格式化: " + file);
                } else {
                    if (showHeader) {
                        out.println("==> " + file + " <==");
                    }
                    printTokens(tokens);
                }
            } catch (TokenizeException | PrettyPrintException e) {
                err.println("格式化错误: " + file + ": " + e.getMessage());
                status = 1;
            } catch (IOException e) {
                err.println("错误: 无法读写文件 - " + file + ": " + e.getMessage());
                status = 1;
            }
        }
        out.flush();
        err.flush();
        return status;
    }

    /**
     * 排版 JSON token 流文件
     */
    public int render(Path jsonFile) {
        if (!Files.exists(jsonFile)) {
            err.println("错误: 文件不存在 - " + jsonFile);
            err.flush();
            return 1;
        }
        try {
            String json = new String(Files.readAllBytes(jsonFile), StandardCharsets.UTF_8);
            printTokens(new JsonTokenReader().read(json));
            return 0;
        } catch (TokenizeException | PrettyPrintException e) {
            err.println("排版错误: " + jsonFile + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + jsonFile + ": " + e.getMessage());
            return 1;
        } finally {
            out.flush();
            err.flush();
        }
    }

    /**
     * 输出文本文件的分词结果
     */
    public int dumpTokens(Path file) {
        if (!Files.exists(file)) {
            err.println("错误: 文件不存在 - " + file);
            err.flush();
            return 1;
        }
        try {
            String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            List<Token> tokens = new TextTokenizer(config).tokenize(source);
            out.println(new JsonTokenWriter().write(tokens));
            return 0;
        } catch (TokenizeException e) {
            err.println("分词错误: " + file + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + file + ": " + e.getMessage());
            return 1;
        } finally {
            out.flush();
            err.flush();
        }
    }

    /** 边排版边写到 out */
    private void printTokens(List<Token> tokens) {
        WriterOutputSink sink = new WriterOutputSink(out, config);
        int overflow = PrettyPrinter.format(tokens, config, sink);
        sink.flush();
        out.println();
        LOG.log(Level.FINE, "排版完成: {0} 个 token，{1} 处超出行宽",
                new Object[]{tokens.size(), overflow});
    }

    static List<Path> collectFiles(Path dir, Set<String> extensions) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> files = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> hasExtension(p, extensions))
                    .sorted()
                    .collect(Collectors.toList());
            return files;
        }
    }

    static boolean hasExtension(Path file, Set<String> extensions) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (String wanted : extensions) {
            String normalized = wanted.startsWith(".") ? wanted.substring(1) : wanted;
            if (normalized.toLowerCase(Locale.ROOT).equals(ext)) {
                return true;
            }
        }
        return false;
    }
}
