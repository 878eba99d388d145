package io.friendlyclp.core.tree;

import io.friendlyclp.core.Aliases;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One group of the command namespace. Children are stored as arena handles of the owning
 * {@link CommandTree}, keyed by alias in registration order.
 */
public final class GroupNode {
    private final int handle;
    private final List<String> aliases;
    private final String description;
    private final Map<String, Integer> groups = new LinkedHashMap<>();
    private final Map<String, Integer> commands = new LinkedHashMap<>();

    GroupNode(int handle, List<String> aliases, String description) {
        this.handle = handle;
        this.aliases = List.copyOf(aliases);
        this.description = description;
    }

    public int handle() {
        return handle;
    }

    public boolean isRoot() {
        return aliases.isEmpty();
    }

    public List<String> aliases() {
        return aliases;
    }

    /** Aliases joined with {@code |}; empty for the root. */
    public String names() {
        return Aliases.join(aliases);
    }

    public String description() {
        return description;
    }

    public Optional<Integer> childGroup(String alias) {
        return Optional.ofNullable(groups.get(alias));
    }

    public Optional<Integer> childCommand(String alias) {
        return Optional.ofNullable(commands.get(alias));
    }

    public boolean hasChild(String alias) {
        return groups.containsKey(alias) || commands.containsKey(alias);
    }

    /** Distinct child group handles in registration order. */
    public List<Integer> childGroupHandles() {
        return new ArrayList<>(new LinkedHashSet<>(groups.values()));
    }

    /** Distinct child command handles in registration order. */
    public List<Integer> childCommandHandles() {
        return new ArrayList<>(new LinkedHashSet<>(commands.values()));
    }

    void attachGroup(String alias, int child) {
        groups.put(alias, child);
    }

    void attachCommand(String alias, int child) {
        commands.put(alias, child);
    }

    @Override
    public String toString() {
        return isRoot() ? "GroupNode[root]" : "GroupNode[" + names() + "]";
    }
}
