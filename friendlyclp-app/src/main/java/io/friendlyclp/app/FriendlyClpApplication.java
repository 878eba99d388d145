package io.friendlyclp.app;

import io.friendlyclp.cli.InitCommand;
import io.friendlyclp.cli.ShellCommand;
import io.friendlyclp.cli.ShellContext;
import io.friendlyclp.cli.config.ShellConfigPaths;
import io.friendlyclp.cli.config.ShellConfigService;
import io.friendlyclp.core.CommandProcessor;
import java.time.Clock;
import picocli.CommandLine;

public final class FriendlyClpApplication {

    private FriendlyClpApplication() {
    }

    public static void main(String[] args) {
        CommandProcessor processor = SampleCommandSet.create(Clock.systemDefaultZone());
        ShellContext context = new ShellContext(processor, new ShellConfigService(), ShellConfigPaths.defaultConfigPath());

        CommandLine commandLine = new CommandLine(new ShellCommand(context));
        commandLine.addSubcommand("init", new InitCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
