package io.friendlyclp.core.argument;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.friendlyclp.core.ConfigurationException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArgumentTypesTest {

    @Test
    void shouldConvertNumericFamily() throws Exception {
        assertThat(ArgumentTypes.integer().convert("-42", "n")).isEqualTo(-42);
        assertThat(ArgumentTypes.longInteger().convert("9000000000", "n")).isEqualTo(9_000_000_000L);
        assertThat(ArgumentTypes.doubleFloating().convert("2.5", "n")).isEqualTo(2.5d);
        assertThat(ArgumentTypes.floating().convert("0.5", "n")).isEqualTo(0.5f);
        assertThat(ArgumentTypes.decimal().convert("10.25", "n")).isEqualByComparingTo(new BigDecimal("10.25"));
    }

    @Test
    void shouldReportSingleNumericMessage() {
        assertThatThrownBy(() -> ArgumentTypes.integer().convert("12abc", "count"))
            .isInstanceOf(ArgumentException.class)
            .hasMessage("Error parsing argument \"count\". Numeric value expected.");
        assertThatThrownBy(() -> ArgumentTypes.decimal().convert("ten", "amount"))
            .hasMessage("Error parsing argument \"amount\". Numeric value expected.");
    }

    @Test
    void shouldRejectNegativeValueForNonNegativeInteger() throws Exception {
        ArgumentType<Integer> type = ArgumentTypes.nonNegativeInteger();

        type.validate(type.convert("0", "n"), "n");
        assertThatThrownBy(() -> type.validate(type.convert("-1", "n"), "n"))
            .hasMessage("Error validating argument \"n\". Non-negative value expected.");
    }

    @Test
    void shouldParseIntegerArrayAndAnnotateFirstBadElement() throws Exception {
        ArgumentType<List<Integer>> type = ArgumentTypes.integerArray();

        assertThat(type.convert(" 1  2\t3 ", "values")).containsExactly(1, 2, 3);
        assertThat(type.convert("", "values")).isEmpty();
        assertThatThrownBy(() -> type.convert("1 x 3 y", "values"))
            .hasMessage("Error parsing argument \"values\". Integer value expected at element #2.");
    }

    @Test
    void shouldRequireIntegerArrayToBeMultisegmented() {
        assertThatThrownBy(() -> Argument.of(ArgumentSpec.of(0, "values", "numbers"), ArgumentTypes.integerArray()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("should always be multisegmented");
    }

    @Test
    void shouldAcceptExactlyOneCodePointForCharacter() throws Exception {
        ArgumentType<String> type = ArgumentTypes.character();

        assertThat(type.convert("a", "char")).isEqualTo("a");
        assertThat(type.convert("😀", "char")).isEqualTo("😀");
        assertThatThrownBy(() -> type.convert("ab", "char"))
            .hasMessage("Error parsing argument \"char\". Single character expected.");
    }

    @Test
    void shouldParseSupportedDateTimeLayouts() throws Exception {
        ArgumentType<LocalDateTime> type = ArgumentTypes.dateTime();

        assertThat(type.convert("2026-02-20T10:15:30", "when")).isEqualTo(LocalDateTime.of(2026, 2, 20, 10, 15, 30));
        assertThat(type.convert("2026-02-20 10:15", "when")).isEqualTo(LocalDateTime.of(2026, 2, 20, 10, 15));
        assertThat(type.convert("2026-02-20", "when")).isEqualTo(LocalDateTime.of(2026, 2, 20, 0, 0));
        assertThatThrownBy(() -> type.convert("tomorrow", "when"))
            .hasMessage("Error parsing argument \"when\". Wrong date/time format.");
    }

    @Test
    void shouldDistinguishBooleanFamiliesBySynonyms() throws Exception {
        assertThat(ArgumentTypes.bool(BooleanSynonyms.TRUE_FALSE).convert("T", "flag")).isTrue();
        assertThat(ArgumentTypes.bool(BooleanSynonyms.YES_NO).convert("no", "flag")).isFalse();
        assertThat(ArgumentTypes.bool(BooleanSynonyms.ALLOWED_FORBIDDEN).convert("a", "flag")).isTrue();
        assertThat(ArgumentTypes.bool(BooleanSynonyms.ALLOWED_FORBIDDEN).convert("Forbidden", "flag")).isFalse();
        assertThatThrownBy(() -> ArgumentTypes.bool(BooleanSynonyms.YES_NO).convert("true", "flag"))
            .hasMessage("Error parsing argument \"flag\". Permissible values are: yes, y; or: no, n.");
    }

    @Test
    void shouldMatchKeywordsCaseInsensitively() throws Exception {
        Map<String, Integer> keywords = new LinkedHashMap<>();
        keywords.put("low", 1);
        keywords.put("High", 2);
        ArgumentType<Integer> type = ArgumentTypes.oneOf("level", keywords);

        assertThat(type.convert("LOW", "level")).isEqualTo(1);
        assertThat(type.convert("high", "level")).isEqualTo(2);
        assertThatThrownBy(() -> type.convert("mid", "level"))
            .hasMessage("Error parsing argument \"level\". Permissible values are: low, high.");
    }

    @Test
    void shouldChainValidationsInDeclarationOrder() throws Exception {
        ArgumentType<Integer> percent = ArgumentTypes.integer()
            .withValidation(value -> value >= 0, "\"%s\" must not be negative.")
            .withValidation(value -> value <= 100, "\"%s\" must not exceed 100.");

        percent.validate(100, "pct");
        assertThatThrownBy(() -> percent.validate(-5, "pct")).hasMessage("\"pct\" must not be negative.");
        assertThatThrownBy(() -> percent.validate(101, "pct")).hasMessage("\"pct\" must not exceed 100.");
    }

    @Test
    void shouldReportValidationTemplateWhenCheckThrows() {
        ArgumentType<Integer> ratio = ArgumentTypes.integer()
            .withValidation(value -> 100 / value > 1, "Error validating argument \"%s\". Ratio too small.");

        assertThatThrownBy(() -> ratio.validate(0, "v"))
            .isInstanceOf(ArgumentException.class)
            .hasMessage("Error validating argument \"v\". Ratio too small.");
    }

    @Test
    void shouldPassStringsThroughUnchanged() throws Exception {
        assertThat(ArgumentTypes.string().convert("Mixed Case  text", "s")).isEqualTo("Mixed Case  text");
    }
}
