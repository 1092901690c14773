package com.lineweave.cli;

import com.lineweave.core.PrettyPrintConfig;
import com.lineweave.core.token.BreakMode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli fmt 子命令：按行宽重排文本文件
 */
@Command(name = "fmt", description = "按行宽重排文本文件或目录")
public class FmtCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", description = "文件或目录路径")
    List<Path> paths;

    @Option(names = {"-w", "--width"}, defaultValue = "80", description = "最大行宽（默认 80）")
    int width;

    @Option(names = "--indent-size", defaultValue = "4", description = "括号分组缩进（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = "--consistent", description = "括号分组放不下时全部换行")
    boolean consistent;

    @Option(names = "--ext", defaultValue = "txt", description = "遍历目录时处理的扩展名（可重复，默认 txt）")
    List<String> extensions;

    @Option(names = {"-i", "--write"}, description = "直接改写文件，而不是输出到标准输出")
    boolean write;

    @Override
    public Integer call() {
        PrettyPrintConfig config = new PrettyPrintConfig();
        config.setLineWidth(width);
        config.setIndentSize(indentSize);
        config.setUseTabs(useTabs);
        config.setBracketMode(consistent ? BreakMode.CONSISTENT : BreakMode.INCONSISTENT);

        FormatRunner runner = new FormatRunner(config,
                spec.commandLine().getOut(), spec.commandLine().getErr());
        return runner.formatPaths(paths, new LinkedHashSet<>(extensions), write);
    }
}
