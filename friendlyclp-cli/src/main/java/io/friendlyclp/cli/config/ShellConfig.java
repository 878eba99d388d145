package io.friendlyclp.cli.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ShellConfig(
    String welcomeMessage,
    String prompt,
    List<String> exitCommands
) {

    public ShellConfig {
        welcomeMessage = welcomeMessage == null ? "" : welcomeMessage;
        prompt = prompt == null ? "" : prompt;
        exitCommands = exitCommands == null ? List.of() : List.copyOf(exitCommands);
    }

    public static ShellConfig defaults() {
        return new ShellConfig(
            "Friendly command line processor test console, type \"help\", to show command list!",
            "> ",
            List.of("exit", "quit")
        );
    }

    public boolean isExitCommand(String line) {
        return line != null && exitCommands.stream().anyMatch(command -> command.equalsIgnoreCase(line.trim()));
    }
}
