package io.friendlyclp.app.command;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import java.util.List;

public final class AddNumbersCommand implements Command {
    private static final Argument<List<Integer>> VALUES = Argument.of(
        ArgumentSpec.of(0, "values", "array of values, split by spaces").asMultisegmented().asOptional(""),
        ArgumentTypes.integerArray()
    );

    @Override
    public List<String> names() {
        return List.of("add");
    }

    @Override
    public String description() {
        return "add arbitrary number of values";
    }

    @Override
    public List<Argument<?>> arguments() {
        return List.of(VALUES);
    }

    @Override
    public String execute(ParsedArguments arguments) {
        int sum = 0;
        try {
            for (int value : arguments.get(VALUES)) {
                sum = Math.addExact(sum, value);
            }
        } catch (ArithmeticException e) {
            return "Can not compute, sum is too big.";
        }
        return String.valueOf(sum);
    }
}
