package io.friendlyclp.app.command;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

public final class DivideCommand implements Command {
    private static final Argument<Integer> DIVIDEND = Argument.of(
        ArgumentSpec.of(0, "dvd", "dividend"),
        ArgumentTypes.integer()
    );
    private static final Argument<Integer> DIVISOR = Argument.of(
        ArgumentSpec.of(1, "dvs", "divisor"),
        ArgumentTypes.integer().withValidation(value -> value != 0, "Divisor \"%s\" can not be zero!")
    );

    @Override
    public List<String> names() {
        return List.of("divide", "div");
    }

    @Override
    public String description() {
        return "divide two integer values";
    }

    @Override
    public List<Argument<?>> arguments() {
        return List.of(DIVIDEND, DIVISOR);
    }

    @Override
    public String execute(ParsedArguments arguments) {
        BigDecimal quotient = BigDecimal.valueOf(arguments.get(DIVIDEND))
            .divide(BigDecimal.valueOf(arguments.get(DIVISOR)), MathContext.DECIMAL64);
        return quotient.stripTrailingZeros().toPlainString();
    }
}
