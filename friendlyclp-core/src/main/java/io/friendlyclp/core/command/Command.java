package io.friendlyclp.core.command;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ParsedArguments;
import java.util.List;

public interface Command {
    /** Lowercase alphanumeric aliases the command is typed by, the first one being its main name. */
    List<String> names();

    String description();

    default List<Argument<?>> arguments() {
        return List.of();
    }

    /**
     * Runs only after every argument has been converted and validated.
     *
     * @return text shown to the user
     */
    String execute(ParsedArguments arguments);
}
