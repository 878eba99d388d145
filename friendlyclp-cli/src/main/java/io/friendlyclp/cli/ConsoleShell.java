package io.friendlyclp.cli;

import io.friendlyclp.cli.config.ShellConfig;
import io.friendlyclp.core.CommandProcessor;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive loop: reads a line, hands it to the processor and prints the result until
 * end of input or one of the configured exit commands.
 */
public final class ConsoleShell {
    private static final Logger LOG = LoggerFactory.getLogger(ConsoleShell.class);

    private final CommandProcessor processor;
    private final ShellConfig config;

    public ConsoleShell(CommandProcessor processor, ShellConfig config) {
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * @return number of lines handed to the processor
     */
    public int run(BufferedReader in, PrintStream out, boolean showWelcome) throws IOException {
        LOG.debug("Shell started for command set \"{}\"", processor.description());
        if (showWelcome && !config.welcomeMessage().isBlank()) {
            out.println(config.welcomeMessage());
        }

        int processed = 0;
        while (true) {
            out.print(config.prompt());
            out.flush();
            String line = in.readLine();
            if (line == null || config.isExitCommand(line)) {
                break;
            }
            out.println(processor.processLine(line));
            processed++;
        }
        LOG.debug("Shell stopped after {} line(s)", processed);
        return processed;
    }
}
