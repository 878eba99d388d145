package io.friendlyclp.app.command;

import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import java.util.List;

public final class DisplaySampleTextCommand implements Command {
    static final String SAMPLE_TEXT =
        "Lorem ipsum dolor sit amet, consectetur adipiscing elit, sed do eiusmod tempor incididunt ut ...";

    @Override
    public List<String> names() {
        return List.of("displaysampletext", "dst");
    }

    @Override
    public String description() {
        return "display sample text";
    }

    @Override
    public String execute(ParsedArguments arguments) {
        return SAMPLE_TEXT;
    }
}
