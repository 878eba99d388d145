package io.friendlyclp.app.command;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import io.friendlyclp.core.argument.ParsedArguments;
import io.friendlyclp.core.command.Command;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class ShowDateTimeCommand implements Command {
    private static final Argument<DisplayFormat> FORMAT = Argument.of(
        ArgumentSpec.of(0, "format", "date time format: date/time/full or d/t/f").asOptional("full"),
        ArgumentTypes.oneOf("display format", keywords())
    );

    private final Clock clock;

    public ShowDateTimeCommand(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<String> names() {
        return List.of("showdatetime", "sdt");
    }

    @Override
    public String description() {
        return "show current date and time";
    }

    @Override
    public List<Argument<?>> arguments() {
        return List.of(FORMAT);
    }

    @Override
    public String execute(ParsedArguments arguments) {
        return LocalDateTime.now(clock).format(arguments.get(FORMAT).formatter);
    }

    private static Map<String, DisplayFormat> keywords() {
        Map<String, DisplayFormat> keywords = new LinkedHashMap<>();
        keywords.put("date", DisplayFormat.DATE);
        keywords.put("d", DisplayFormat.DATE);
        keywords.put("time", DisplayFormat.TIME);
        keywords.put("t", DisplayFormat.TIME);
        keywords.put("full", DisplayFormat.FULL);
        keywords.put("f", DisplayFormat.FULL);
        return keywords;
    }

    private enum DisplayFormat {
        DATE(DateTimeFormatter.ISO_LOCAL_DATE),
        TIME(DateTimeFormatter.ofPattern("HH:mm")),
        FULL(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));

        private final DateTimeFormatter formatter;

        DisplayFormat(DateTimeFormatter formatter) {
            this.formatter = formatter;
        }
    }
}
