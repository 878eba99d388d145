package io.friendlyclp.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.friendlyclp.core.argument.Argument;
import io.friendlyclp.core.argument.ArgumentSpec;
import io.friendlyclp.core.argument.ArgumentTypes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CommandProcessorTest {

    private static final Argument<String> TEXT = Argument.of(
        ArgumentSpec.of(0, "text", "text to analyze").asMultisegmented(),
        ArgumentTypes.string()
    );
    private static final Argument<String> WORD = Argument.of(
        ArgumentSpec.of(0, "word", "a word"),
        ArgumentTypes.string()
    );
    private static final Argument<String> CHAR = Argument.of(
        ArgumentSpec.of(1, "char", "character to remove").asOptional(),
        ArgumentTypes.character()
    );
    private static final Argument<Integer> TIMES = Argument.of(
        ArgumentSpec.of(1, "times", "how many times").asOptional("2"),
        ArgumentTypes.nonNegativeInteger()
    );
    private static final Argument<Integer> DIVIDEND = Argument.of(
        ArgumentSpec.of(0, "dvd", "dividend"),
        ArgumentTypes.integer()
    );
    private static final Argument<Integer> DIVISOR = Argument.of(
        ArgumentSpec.of(1, "dvs", "divisor"),
        ArgumentTypes.integer().withValidation(value -> value != 0, "Divisor \"%s\" can not be zero!")
    );
    private static final Argument<String> REST = Argument.of(
        ArgumentSpec.of(1, "rest", "rest of the line").asOptional().asMultisegmented(),
        ArgumentTypes.string()
    );

    @Test
    void shouldCountWordsThroughNestedGroup() {
        assertThat(processor().processLine("tu cw the bird is the word")).isEqualTo("5");
        assertThat(processor().processLine("TextUtils  CountWords   the bird ")).isEqualTo("2");
    }

    @Test
    void shouldReturnValidationErrorNamingDivisor() {
        assertThat(processor().processLine("div 10 0")).isEqualTo("Divisor \"dvs\" can not be zero!");
        assertThat(processor().processLine("div 10 4")).isEqualTo("2");
    }

    @Test
    void shouldLeaveWordUnchangedWhenOptionalCharIsOmitted() {
        CommandProcessor processor = processor();

        assertThat(processor.processLine("tu rc abracadabra")).isEqualTo("abracadabra");
        assertThat(processor.processLine("tu rc abracadabra a")).isEqualTo("brcdbr");
        assertThat(processor.processLine("tu rc abracadabra ab")).isEqualTo(
            "Error parsing argument \"char\". Single character expected."
        );
    }

    @Test
    void shouldReportUnknownCommand() {
        assertThat(processor().processLine("xyz")).isEqualTo("Command not found!");
    }

    @Test
    void shouldAskForCommandWhenLineStopsAtGroup() {
        CommandProcessor processor = processor();

        assertThat(processor.processLine("tu")).isEqualTo("Please specify a command within a \"textutils|tu\" group!");
        assertThat(processor.processLine("tu xyz")).isEqualTo("Command not found!");
        assertThat(processor.getHelp("tu xyz")).isEmpty();
        assertThat(processor.getHelp("tu")).hasValueSatisfying(help -> assertThat(help).startsWith("<textutils|tu: text utils>"));
    }

    @Test
    void shouldAskForCommandOnBlankLine() {
        assertThat(processor().processLine("   ")).isEqualTo("Please enter a command!");
        assertThat(processor().processLine(null)).isEqualTo("Please enter a command!");
    }

    @Test
    void shouldTreatOmittedArgumentLikeItsDefault() {
        CommandProcessor processor = processor();

        assertThat(processor.processLine("tu rep ab")).isEqualTo(processor.processLine("tu rep ab 2"));
        assertThat(processor.processLine("tu rep ab")).isEqualTo("abab");
    }

    @Test
    void shouldParseLiteralUsageExample() {
        CommandProcessor processor = processor();
        String article = processor.getHelp("echo").orElseThrow();
        String usage = article.lines()
            .filter(line -> line.startsWith("Usage: "))
            .findFirst()
            .orElseThrow()
            .substring("Usage: echo".length())
            .replace("[", "")
            .replace("]", "");

        assertThat(processor.processLine("echo" + usage)).isEqualTo("word rest");
    }

    @Test
    void shouldRenderWholeTreeForEmptyPath() {
        assertThat(processor().getHelp("")).hasValue(String.join("\n",
            "Test command set",
            "├──<textutils|tu: text utils>",
            "│  ├──\"countwords|cw\" - count words",
            "│  ├──\"removechar|rc\" - remove a character",
            "│  └──\"repeat|rep\" - repeat a word",
            "├──\"divide|div\" - integer division",
            "└──\"echo\" - echo arguments"
        ));
    }

    @Test
    void shouldReturnNoHelpWhenTextFollowsCommand() {
        CommandProcessor processor = processor();

        assertThat(processor.getHelp("div")).hasValueSatisfying(help -> assertThat(help).startsWith("Command: divide|div"));
        assertThat(processor.getHelp("div 10")).isEmpty();
    }

    @Test
    void shouldServeConcurrentLinesFromOneProcessor() throws Exception {
        CommandProcessor processor = processor();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int n = i;
                tasks.add(() -> processor.processLine("div " + (n * 3) + " 3").equals(String.valueOf(n))
                    && processor.processLine("tu cw a b c").equals("3")
                    && processor.processLine("div 1 0").equals("Divisor \"dvs\" can not be zero!"));
            }
            for (Future<Boolean> result : executor.invokeAll(tasks)) {
                assertThat(result.get()).isTrue();
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    private static CommandProcessor processor() {
        CommandProcessor processor = new CommandProcessor("Test command set");
        processor.addGroup(List.of("textutils", "tu"), "text utils")
            .addCommand(StubCommand.of("countwords|cw", "count words", List.of(TEXT),
                arguments -> String.valueOf(arguments.get(TEXT).trim().split("\\s+").length)))
            .addCommand(StubCommand.of("removechar|rc", "remove a character", List.of(WORD, CHAR),
                arguments -> arguments.isOmitted(CHAR)
                    ? arguments.get(WORD)
                    : arguments.get(WORD).replace(arguments.get(CHAR), "")))
            .addCommand(StubCommand.of("repeat|rep", "repeat a word", List.of(WORD, TIMES),
                arguments -> arguments.get(WORD).repeat(arguments.get(TIMES))));
        processor.addCommand("", StubCommand.of("divide|div", "integer division", List.of(DIVIDEND, DIVISOR),
            arguments -> String.valueOf(arguments.get(DIVIDEND) / arguments.get(DIVISOR))));
        processor.addCommand(StubCommand.of("echo", "echo arguments", List.of(WORD, REST),
            arguments -> arguments.get(WORD) + " " + arguments.getOrDefault(REST, "")));
        return processor;
    }
}
