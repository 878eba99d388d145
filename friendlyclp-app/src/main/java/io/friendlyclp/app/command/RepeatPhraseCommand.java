package io.friendlyclp.app.command;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import java.util.Collections;
import java.util.List;

public final class RepeatPhraseCommand implements Command {
    static final int MAX_TIMES = 1000;
    static final String TOO_MANY_TIMES = "Error validating argument \"%s\". At most " + MAX_TIMES + " repetitions allowed.";

    private static final Argument<Integer> TIMES = Argument.of(
        ArgumentSpec.of(0, "times", "number of times to repeat"),
        ArgumentTypes.nonNegativeInteger().withValidation(value -> value <= MAX_TIMES, TOO_MANY_TIMES)
    );
    private static final Argument<String> PHRASE = Argument.of(
        ArgumentSpec.of(1, "phrase", "phrase to repeat").asMultisegmented(),
        ArgumentTypes.string()
    );

    @Override
    public List<String> names() {
        return List.of("repeatphrase", "repp");
    }

    @Override
    public String description() {
        return "repeat phrase X number of times";
    }

    @Override
    public List<Argument<?>> arguments() {
        return List.of(TIMES, PHRASE);
    }

    @Override
    public String execute(ParsedArguments arguments) {
        return String.join(" ", Collections.nCopies(arguments.get(TIMES), arguments.get(PHRASE).trim()));
    }
}
