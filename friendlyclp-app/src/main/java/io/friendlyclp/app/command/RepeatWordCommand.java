package io.friendlyclp.app.command;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import java.util.Collections;
import java.util.List;

/**
 * Declares a default that its own type rejects, so omitting {@code times} always ends in a parse error.
 */
public final class RepeatWordCommand implements Command {
    private static final Argument<String> WORD = Argument.of(
        ArgumentSpec.of(0, "word", "word to repeat"),
        ArgumentTypes.string()
    );
    private static final Argument<Integer> TIMES = Argument.of(
        ArgumentSpec.of(1, "times", "number of times to repeat").asOptional("one"),
        ArgumentTypes.nonNegativeInteger()
            .withValidation(value -> value <= RepeatPhraseCommand.MAX_TIMES, RepeatPhraseCommand.TOO_MANY_TIMES)
    );

    @Override
    public List<String> names() {
        return List.of("repeatword", "repw");
    }

    @Override
    public String description() {
        return "repeat word X number of times";
    }

    @Override
    public List<Argument<?>> arguments() {
        return List.of(WORD, TIMES);
    }

    @Override
    public String execute(ParsedArguments arguments) {
        return String.join(" ", Collections.nCopies(arguments.get(TIMES), arguments.get(WORD)));
    }
}
