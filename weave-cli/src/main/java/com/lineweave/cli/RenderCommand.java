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
 * picocli render 子命令：排版 JSON 格式的 token 流
 */
@Command(name = "render", description = "排版 JSON 格式的 token 流")
public class RenderCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "token 流 JSON 文件")
    Path file;

    @Option(names = {"-w", "--width"}, defaultValue = "80", description = "最大行宽（默认 80）")
    int width;

    @Override
    public Integer call() {
        PrettyPrintConfig config = new PrettyPrintConfig();
        config.setLineWidth(width);
        return new FormatRunner(config, spec.commandLine().getOut(), spec.commandLine().getErr())
                .render(file);
    }
}
