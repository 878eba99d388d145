package io.friendlyclp.cli;

import io.friendlyclp.cli.config.ShellConfig;
import io.friendlyclp.cli.config.ShellConfigPaths;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "friendlyclp", mixinStandardHelpOptions = true, description = "Friendly command line processor shell")
public final class ShellCommand implements Callable<Integer> {
    private final ShellContext context;

    @Option(names = "--config", description = "Shell config file (default: ~/.friendlyclp/shell.json)")
    String config;

    @Option(names = {"-e", "--execute"}, description = "Process a single line and exit")
    String execute;

    @Option(names = "--quiet", description = "Do not print the welcome message")
    boolean quiet;

    public ShellCommand(ShellContext context) {
        this.context = context;
    }

    Path configPath() {
        return config == null ? context.configPath() : ShellConfigPaths.resolve(config);
    }

    @Override
    public Integer call() {
        try {
            if (execute != null) {
                System.out.println(context.processor().processLine(execute));
                return 0;
            }

            ShellConfig shellConfig = context.configService().load(configPath());
            BufferedReader in = new BufferedReader(new InputStreamReader(context.input(), StandardCharsets.UTF_8));
            new ConsoleShell(context.processor(), shellConfig).run(in, System.out, !quiet);
            return 0;
        } catch (Exception e) {
            System.err.println("Shell failed: " + e.getMessage());
            return 1;
        }
    }
}
