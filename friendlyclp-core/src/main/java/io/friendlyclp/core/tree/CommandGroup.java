package io.friendlyclp.core.tree;

import io.friendlyclp.core.command.Command;
import java.util.List;

/**
 * Registers children directly on a group, without spelling out its path again.
 */
public interface CommandGroup {

    /**
     * @return the newly created child group
     */
    CommandGroup addGroup(List<String> aliases, String description);

    /**
     * @return this group, for chaining
     */
    CommandGroup addCommand(Command command);
}
