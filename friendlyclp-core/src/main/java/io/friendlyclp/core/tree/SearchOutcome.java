package io.friendlyclp.core.tree;

import io.friendlyclp.core.command.BoundCommand;

public record SearchOutcome(Kind kind, GroupNode group, BoundCommand command, String remainder) {

    public enum Kind { GROUP_FOUND, COMMAND_FOUND, NOTHING_FOUND }

    private static final SearchOutcome NOTHING = new SearchOutcome(Kind.NOTHING_FOUND, null, null, "");

    public static SearchOutcome groupFound(GroupNode group) {
        return new SearchOutcome(Kind.GROUP_FOUND, group, null, "");
    }

    public static SearchOutcome commandFound(BoundCommand command, String remainder) {
        return new SearchOutcome(Kind.COMMAND_FOUND, null, command, remainder == null ? "" : remainder);
    }

    public static SearchOutcome nothingFound() {
        return NOTHING;
    }
}
