package io.friendlyclp.core;

import io.friendlyclp.core.command.Command;
import io.friendlyclp.core.help.HelpRenderer;
import io.friendlyclp.core.tree.CommandGroup;
import io.friendlyclp.core.tree.CommandTree;
import io.friendlyclp.core.tree.SearchOutcome;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of a command set: registration, dispatch of user lines and help lookup.
 *
 * <p>Register every group and command before the processor is shared; after that,
 * {@link #processLine(String)} and {@link #getHelp(String)} may be called from any thread.
 */
public final class CommandProcessor implements CommandGroup {
    private final CommandTree tree;

    public CommandProcessor(String description) {
        this.tree = new CommandTree(description);
    }

    public String description() {
        return tree.root().description();
    }

    public CommandTree tree() {
        return tree;
    }

    /**
     * @return the command result on success, otherwise a message describing the first problem found
     */
    public String processLine(String line) {
        if (line == null || line.isBlank()) {
            return "Please enter a command!";
        }
        SearchOutcome outcome = tree.search(line);
        return switch (outcome.kind()) {
            case COMMAND_FOUND -> outcome.command().parseArgsAndExecute(outcome.remainder());
            case GROUP_FOUND -> "Please specify a command within a \"" + outcome.group().names() + "\" group!";
            case NOTHING_FOUND -> "Command not found!";
        };
    }

    /**
     * Looks up the help article of the element a path points to. An empty path denotes the root group.
     */
    public Optional<String> getHelp(String path) {
        SearchOutcome outcome = tree.search(path);
        return switch (outcome.kind()) {
            case GROUP_FOUND -> Optional.of(HelpRenderer.groupArticle(tree, outcome.group()));
            case COMMAND_FOUND -> outcome.remainder().isBlank()
                ? Optional.of(outcome.command().helpArticle())
                : Optional.empty();
            case NOTHING_FOUND -> Optional.empty();
        };
    }

    public CommandProcessor addGroup(String path, List<String> aliases, String description) {
        tree.addGroup(path, aliases, description);
        return this;
    }

    public CommandProcessor addCommand(String path, Command command) {
        tree.addCommand(path, command);
        return this;
    }

    @Override
    public CommandGroup addGroup(List<String> aliases, String description) {
        return tree.handle(tree.addGroup(CommandTree.ROOT, aliases, description));
    }

    @Override
    public CommandProcessor addCommand(Command command) {
        tree.addCommand(CommandTree.ROOT, command);
        return this;
    }
}
