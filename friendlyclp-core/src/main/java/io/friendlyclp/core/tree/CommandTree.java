package io.friendlyclp.core.tree;

import io.friendlyclp.core.Aliases;
import io.friendlyclp.core.ConfigurationException;
import io.friendlyclp.core.command.BoundCommand;
import io.friendlyclp.core.command.Command;
import io.friendlyclp.core.text.Tokens;
import io.friendlyclp.core.text.Tokens.TokenSplit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Namespace of groups and bound commands. Groups and commands live in two arenas and are
 * addressed by their index there; alias maps of a group point at those handles, so the same
 * command can be reached through several aliases without being stored twice.
 *
 * <p>Registration is not thread-safe. Once it is complete the tree is only read.
 */
public final class CommandTree {
    public static final int ROOT = 0;
    private static final Logger LOG = LoggerFactory.getLogger(CommandTree.class);

    private final List<GroupNode> groups = new ArrayList<>();
    private final List<BoundCommand> commands = new ArrayList<>();

    public CommandTree(String rootDescription) {
        if (rootDescription == null || rootDescription.isBlank()) {
            throw new ConfigurationException("Root command group description is invalid (empty).");
        }
        groups.add(new GroupNode(ROOT, List.of(), rootDescription));
    }

    public GroupNode root() {
        return groups.get(ROOT);
    }

    public GroupNode group(int handle) {
        return groups.get(handle);
    }

    public BoundCommand command(int handle) {
        return commands.get(handle);
    }

    public CommandGroup handle(int groupHandle) {
        return new GroupHandle(this, group(groupHandle).handle());
    }

    public int addGroup(String path, List<String> aliases, String description) {
        return addGroup(resolveGroup(path, "group \"" + joinedOrRaw(aliases) + "\""), aliases, description);
    }

    public int addGroup(int parentHandle, List<String> aliases, String description) {
        GroupNode parent = group(parentHandle);
        List<String> validAliases = Aliases.validate(aliases, "command group");
        String names = Aliases.join(validAliases);
        if (description == null || description.isBlank()) {
            throw new ConfigurationException("\"" + names + "\" command group description is invalid (empty).");
        }
        ensureFree(parent, validAliases, "group");

        int handle = groups.size();
        groups.add(new GroupNode(handle, validAliases, description));
        for (String alias : validAliases) {
            parent.attachGroup(alias, handle);
        }
        LOG.debug("Added group {} to {}", names, parent);
        return handle;
    }

    public int addCommand(String path, Command command) {
        BoundCommand bound = BoundCommand.bind(command);
        return attach(resolveGroup(path, "command \"" + bound.names() + "\""), bound);
    }

    public int addCommand(int parentHandle, Command command) {
        GroupNode parent = group(parentHandle);
        return attach(parent.handle(), BoundCommand.bind(command));
    }

    /**
     * Walks leading tokens of {@code line} down the group hierarchy. Tokens are matched in lower case.
     */
    public SearchOutcome search(String line) {
        GroupNode current = root();
        String remainder = line == null ? "" : line;

        while (!Tokens.isBlank(remainder)) {
            TokenSplit split = Tokens.split(remainder);
            String alias = split.token().toLowerCase(Locale.ROOT);
            remainder = split.remainder();

            Optional<Integer> childGroup = current.childGroup(alias);
            if (childGroup.isPresent()) {
                current = group(childGroup.get());
                continue;
            }
            Optional<Integer> childCommand = current.childCommand(alias);
            if (childCommand.isPresent()) {
                return SearchOutcome.commandFound(command(childCommand.get()), remainder);
            }
            return SearchOutcome.nothingFound();
        }
        return SearchOutcome.groupFound(current);
    }

    private int attach(int parentHandle, BoundCommand bound) {
        GroupNode parent = group(parentHandle);
        ensureFree(parent, bound.aliases(), "command");

        int handle = commands.size();
        commands.add(bound);
        for (String alias : bound.aliases()) {
            parent.attachCommand(alias, handle);
        }
        LOG.debug("Added command {} to {}", bound.names(), parent);
        return handle;
    }

    private int resolveGroup(String path, String subject) {
        SearchOutcome outcome = search(path);
        return switch (outcome.kind()) {
            case GROUP_FOUND -> outcome.group().handle();
            case COMMAND_FOUND -> throw new ConfigurationException(
                "Can not add " + subject + " at a given path \"" + path + "\". "
                    + "Path points to an existing command, but should point to an existing group."
            );
            case NOTHING_FOUND -> throw new ConfigurationException(
                "Can not add " + subject + " at a given path \"" + path + "\". Path is invalid."
            );
        };
    }

    private static void ensureFree(GroupNode parent, List<String> aliases, String kind) {
        for (String alias : aliases) {
            if (parent.hasChild(alias)) {
                String owner = parent.isRoot() ? "root" : "\"" + parent.names() + "\"";
                throw new ConfigurationException(
                    "Can not add " + kind + ". Child element named \"" + alias + "\" already exists in " + owner + " group."
                );
            }
        }
    }

    private static String joinedOrRaw(List<String> aliases) {
        return aliases == null ? "" : String.join(Aliases.SEPARATOR, aliases);
    }

    private record GroupHandle(CommandTree tree, int handle) implements CommandGroup {
        @Override
        public CommandGroup addGroup(List<String> aliases, String description) {
            return new GroupHandle(tree, tree.addGroup(handle, aliases, description));
        }

        @Override
        public CommandGroup addCommand(Command command) {
            tree.addCommand(handle, command);
            return this;
        }
    }
}
