package io.friendlyclp.app;

import io.friendlyclp.app.command.AddNumbersCommand;
import io.friendlyclp.app.command.CountCharactersCommand;
import io.friendlyclp.app.command.CountWordsCommand;
import io.friendlyclp.app.command.DisplaySampleTextCommand;
import io.friendlyclp.app.command.DivideCommand;
import io.friendlyclp.app.command.RemoveCharacterCommand;
import io.friendlyclp.app.command.RepeatPhraseCommand;
import io.friendlyclp.app.command.RepeatWordCommand;
import io.friendlyclp.app.command.ShowDateTimeCommand;
import io.friendlyclp.cli.HelpCommand;
import io.friendlyclp.core.CommandProcessor;
import io.friendlyclp.core.tree.CommandGroup;
import java.time.Clock;
import java.util.List;

/**
 * Demo command set shipped with the shell.
 */
public final class SampleCommandSet {

    private SampleCommandSet() {
    }

    public static CommandProcessor create(Clock clock) {
        CommandProcessor processor = new CommandProcessor("Test command set");
        DisplaySampleTextCommand sampleText = new DisplaySampleTextCommand();
        CountCharactersCommand countCharacters = new CountCharactersCommand();

        processor
            .addGroup("", List.of("textutils", "tu"), "some useful text utils")
            .addGroup("tu", List.of("metrics", "metr", "mt"), "calculate various string metrics")
            .addGroup("", List.of("fr"), "frequently used commands")
            // groups may be addressed through any of their aliases
            .addCommand("tu", sampleText)
            .addCommand("textutils", new RemoveCharacterCommand())
            .addCommand("tu mt", countCharacters)
            .addCommand("textutils mt", new CountWordsCommand())
            .addCommand("textutils", new RepeatWordCommand())
            .addCommand("tu", new RepeatPhraseCommand())
            .addCommand("fr", sampleText)
            .addCommand("fr", countCharacters)
            .addCommand("", new ShowDateTimeCommand(clock))
            .addCommand("", new HelpCommand(processor));

        // Registered through a handle, so renaming the group does not touch any path.
        CommandGroup calc = processor.addGroup(List.of("calc"), "do some calculus");
        calc.addCommand(new AddNumbersCommand()).addCommand(new DivideCommand());
        return processor;
    }
}
