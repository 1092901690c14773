package com.lineweave.cli;

import com.lineweave.core.PrettyPrintConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli tokens 子命令：以 JSON 输出文本的分词结果
 */
@Command(name = "tokens", description = "以 JSON 输出文本文件的分词结果")
public class TokensCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "文本文件")
    Path file;

    @Option(names = "--indent-size", defaultValue = "4", description = "括号分组缩进（默认 4）")
    int indentSize;

    @Override
    public Integer call() {
        PrettyPrintConfig config = new PrettyPrintConfig();
        config.setIndentSize(indentSize);
        return new FormatRunner(config, spec.commandLine().getOut(), spec.commandLine().getErr())
                .dumpTokens(file);
    }
}
