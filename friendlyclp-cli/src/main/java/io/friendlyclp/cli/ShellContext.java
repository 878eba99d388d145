package io.friendlyclp.cli;

import io.friendlyclp.cli.config.ShellConfigService;
import io.friendlyclp.core.CommandProcessor;
import java.io.InputStream;
import java.nio.file.Path;

public record ShellContext(
    CommandProcessor processor,
    ShellConfigService configService,
    Path configPath,
    InputStream input
) {
    public ShellContext(CommandProcessor processor, ShellConfigService configService, Path configPath) {
        this(processor, configService, configPath, System.in);
    }
}
