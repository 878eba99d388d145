package io.friendlyclp.core.help;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.command.BoundCommand;
import io.friendlyclp.core.tree.CommandTree;
import io.friendlyclp.core.tree.GroupNode;
import java.util.ArrayList;
import java.util.List;

public final class HelpRenderer {
    public static final String LINE_SEPARATOR = "\n";
    private static final String INDENTATION = "   ";
    private static final String BRANCH = "├──";
    private static final String ELBOW = "└──";
    private static final String PIPE = "│  ";
    private static final String BLANK = "   ";

    private HelpRenderer() {
    }

    public static String commandArticle(String names, String description, List<Argument<?>> arguments) {
        StringBuilder result = new StringBuilder();
        result.append("Command: ").append(names).append(LINE_SEPARATOR);
        result.append("Description: ").append(description).append(LINE_SEPARATOR);
        result.append("Usage: ").append(names);
        for (Argument<?> argument : arguments) {
            result.append(' ');
            if (argument.spec().optional()) {
                result.append('[').append(argument.name()).append(']');
            } else {
                result.append(argument.name());
            }
        }

        if (!arguments.isEmpty()) {
            result.append(LINE_SEPARATOR).append(INDENTATION).append("Arguments:");
            for (Argument<?> argument : arguments) {
                ArgumentSpec spec = argument.spec();
                result.append(LINE_SEPARATOR)
                    .append(INDENTATION).append(INDENTATION)
                    .append(spec.name()).append(": ").append(spec.description());
                if (spec.optional()) {
                    result.append(" (optional");
                    if (spec.defaultValue() != null) {
                        result.append(", default: \"").append(spec.defaultValue()).append('"');
                    }
                    result.append(')');
                }
            }
        }
        return result.toString();
    }

    public static String groupArticle(CommandTree tree, GroupNode group) {
        return String.join(LINE_SEPARATOR, renderTree(tree, group));
    }

    /**
     * Pseudo-graphic dump of {@code group} and everything below it, one line per element.
     * Groups come before commands; an element reachable through several aliases is listed once.
     */
    public static List<String> renderTree(CommandTree tree, GroupNode group) {
        List<String> lines = new ArrayList<>();
        lines.add(group.isRoot() ? group.description() : "<" + group.names() + ": " + group.description() + ">");

        List<Integer> childGroups = group.childGroupHandles();
        List<Integer> childCommands = group.childCommandHandles();

        for (int i = 0; i < childGroups.size(); i++) {
            boolean last = i == childGroups.size() - 1 && childCommands.isEmpty();
            List<String> subtree = renderTree(tree, tree.group(childGroups.get(i)));
            for (int j = 0; j < subtree.size(); j++) {
                String prefix = j == 0 ? (last ? ELBOW : BRANCH) : (last ? BLANK : PIPE);
                lines.add(prefix + subtree.get(j));
            }
        }

        for (int i = 0; i < childCommands.size(); i++) {
            boolean last = i == childCommands.size() - 1;
            BoundCommand command = tree.command(childCommands.get(i));
            lines.add((last ? ELBOW : BRANCH) + "\"" + command.names() + "\" - " + command.description());
        }
        return lines;
    }
}
