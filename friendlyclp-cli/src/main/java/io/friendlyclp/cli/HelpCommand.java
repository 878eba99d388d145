package io.friendlyclp.cli;

import io.friendlyclp.core.CommandProcessor;
import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import io.friendlyclp.core.help.HelpRenderer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Shows the command tree, a group subtree or a single command article. Kept outside the processor
 * so a command set can register its own variant.
 */
public final class HelpCommand implements Command {
    static final String HINT = "In order to get help on a particular command please type "
        + "\"help pathToCommand commandName\" or \"h pathToCommand commandName\".";
    static final String NOTHING_FOUND = "Nothing found. Please type \"help\" or \"h\" with no arguments.";

    private static final Argument<String> PATH = Argument.of(
        ArgumentSpec.of(0, "path", "path to a command or a command group").asMultisegmented().asOptional(""),
        ArgumentTypes.string()
    );

    private final CommandProcessor processor;

    public HelpCommand(CommandProcessor processor) {
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
    }

    @Override
    public List<String> names() {
        return List.of("help", "h");
    }

    @Override
    public String description() {
        return "show help";
    }

    @Override
    public List<Argument<?>> arguments() {
        return List.of(PATH);
    }

    @Override
    public String execute(ParsedArguments arguments) {
        Optional<String> article = processor.getHelp(arguments.get(PATH));
        if (article.isEmpty()) {
            return NOTHING_FOUND;
        }
        if (arguments.isOmitted(PATH)) {
            return article.get() + HelpRenderer.LINE_SEPARATOR + HINT;
        }
        return article.get();
    }
}
