package io.friendlyclp.app.command;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import java.util.List;

public final class RemoveCharacterCommand implements Command {
    private static final Argument<String> WORD = Argument.of(
        ArgumentSpec.of(0, "word", "word to remove character from"),
        ArgumentTypes.string()
    );
    private static final Argument<String> CHAR = Argument.of(
        ArgumentSpec.of(1, "char", "character to be removed").asOptional(),
        ArgumentTypes.character()
    );

    @Override
    public List<String> names() {
        return List.of("removechar", "rc");
    }

    @Override
    public String description() {
        return "remove character in a word";
    }

    @Override
    public List<Argument<?>> arguments() {
        return List.of(WORD, CHAR);
    }

    @Override
    public String execute(ParsedArguments arguments) {
        if (arguments.isOmitted(CHAR)) {
            return arguments.get(WORD);
        }
        return arguments.get(WORD).replace(arguments.get(CHAR), "");
    }
}
