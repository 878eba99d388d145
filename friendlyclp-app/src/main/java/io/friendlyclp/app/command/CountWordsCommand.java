package io.friendlyclp.app.command;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import java.util.List;

public final class CountWordsCommand implements Command {
    private static final Argument<String> TEXT = Argument.of(
        ArgumentSpec.of(0, "text", "text to count words in").asMultisegmented(),
        ArgumentTypes.string()
    );

    @Override
    public List<String> names() {
        return List.of("countwords", "cw");
    }

    @Override
    public String description() {
        return "count words";
    }

    @Override
    public List<Argument<?>> arguments() {
        return List.of(TEXT);
    }

    @Override
    public String execute(ParsedArguments arguments) {
        String text = arguments.get(TEXT).trim();
        return String.valueOf(text.isEmpty() ? 0 : text.split("\\s+").length);
    }
}
