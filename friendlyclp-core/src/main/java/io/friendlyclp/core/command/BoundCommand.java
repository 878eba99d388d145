package io.friendlyclp.core.command;

import io.friendlyclp.core.Aliases;
import io.friendlyclp.core.ConfigurationException;
import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentParser;
import io.friendlyclp.core.argument.ParseResult;
import io.friendlyclp.core.help.HelpRenderer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A command whose shape has been checked once at registration. Instances are immutable apart from
 * the memoized help article, so one instance can serve concurrent invocations.
 */
public final class BoundCommand {
    private static final Logger LOG = LoggerFactory.getLogger(BoundCommand.class);
    static final String INTERNAL_ERROR = "Internal error!";

    private final List<String> aliases;
    private final String names;
    private final String description;
    private final Command command;
    private final ArgumentParser parser;

    private volatile String helpArticle;

    private BoundCommand(List<String> aliases, String description, Command command, List<Argument<?>> arguments) {
        this.aliases = aliases;
        this.names = Aliases.join(aliases);
        this.description = description;
        this.command = command;
        this.parser = new ArgumentParser(arguments);
    }

    public static BoundCommand bind(Command command) {
        if (command == null) {
            throw new ConfigurationException("Command must not be null.");
        }
        List<String> aliases = Aliases.validate(command.names(), "command");
        String names = Aliases.join(aliases);

        String description = command.description();
        if (description == null || description.isBlank()) {
            throw new ConfigurationException("\"" + names + "\" command description is invalid (empty).");
        }

        List<Argument<?>> declared = command.arguments();
        if (declared == null) {
            throw new ConfigurationException("Command \"" + names + "\" returned no argument list.");
        }

        TreeMap<Integer, Argument<?>> byPosition = new TreeMap<>();
        Map<String, Argument<?>> byName = new HashMap<>();
        Set<Argument<?>> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Argument<?> special = null;

        for (int i = 0; i < declared.size(); i++) {
            Argument<?> argument = declared.get(i);
            if (argument == null) {
                throw new ConfigurationException("Command \"" + names + "\" declares a null argument at index " + i + ".");
            }
            if (!seen.add(argument)) {
                throw new ConfigurationException(
                    "Argument \"" + argument.name() + "\" in command \"" + names + "\" is declared twice."
                );
            }

            Argument<?> positionClash = byPosition.putIfAbsent(argument.position(), argument);
            if (positionClash != null) {
                throw new ConfigurationException(
                    "Argument \"" + argument.name() + "\" in command \"" + names
                        + "\" has the same position as \"" + positionClash.name() + "\" argument."
                );
            }

            Argument<?> nameClash = byName.putIfAbsent(argument.name(), argument);
            if (nameClash != null) {
                throw new ConfigurationException(
                    "Argument \"" + argument.name() + "\" in command \"" + names
                        + "\" has the same name as the argument at position " + nameClash.position() + "."
                );
            }

            if (argument.spec().special()) {
                if (special != null) {
                    throw new ConfigurationException(
                        "Command \"" + names + "\" has two special arguments: \""
                            + special.name() + "\" and \"" + argument.name() + "\"."
                    );
                }
                special = argument;
            }
        }

        if (special != null && byPosition.lastEntry().getValue() != special) {
            throw new ConfigurationException(
                "Argument \"" + special.name() + "\" in command \"" + names
                    + "\" is optional or multisegmented and should be the last!"
            );
        }

        LOG.debug("Bound command {} with {} argument(s)", names, byPosition.size());
        return new BoundCommand(aliases, description, command, new ArrayList<>(byPosition.values()));
    }

    public List<String> aliases() {
        return aliases;
    }

    /** Aliases joined with {@code |}, as shown in help text. */
    public String names() {
        return names;
    }

    public String description() {
        return description;
    }

    public List<Argument<?>> arguments() {
        return parser.arguments();
    }

    /**
     * Parses the argument part of a line and runs the command when every argument is valid.
     *
     * @return the command result, or the first parsing or validation error
     */
    public String parseArgsAndExecute(String line) {
        ParseResult result = parser.parse(line);
        if (!result.succeeded()) {
            return result.error();
        }

        try {
            String output = command.execute(result.arguments());
            return output == null ? "" : output;
        } catch (Exception e) {
            LOG.warn("Command {} failed", names, e);
            return INTERNAL_ERROR;
        }
    }

    public String helpArticle() {
        String article = helpArticle;
        if (article == null) {
            article = HelpRenderer.commandArticle(names, description, parser.arguments());
            helpArticle = article;
        }
        return article;
    }

    @Override
    public String toString() {
        return "BoundCommand[" + names + "]";
    }
}
