package io.friendlyclp.app.command;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import java.util.List;

public final class CountCharactersCommand implements Command {
    private static final Argument<String> WORD = Argument.of(
        ArgumentSpec.of(0, "word", "word to count characters in"),
        ArgumentTypes.string()
    );

    @Override
    public List<String> names() {
        return List.of("countchars", "cc");
    }

    @Override
    public String description() {
        return "count characters in a word";
    }

    @Override
    public List<Argument<?>> arguments() {
        return List.of(WORD);
    }

    @Override
    public String execute(ParsedArguments arguments) {
        String word = arguments.get(WORD);
        return String.valueOf(word.codePointCount(0, word.length()));
    }
}
