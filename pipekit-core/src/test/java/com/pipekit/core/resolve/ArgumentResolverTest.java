package com.pipekit.core.resolve;

import com.pipekit.core.component.StageArguments;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link ArgumentResolver}.
 */
class ArgumentResolverTest {

    @Test
    void fillArgs_contextAndConfig_resolvesInDeclaredOrder() {
        List<Object> values = ArgumentResolver.fillArgs(List.of("a", "b"), Map.of("a", 1), Map.of("b", 2));

        assertThat(values).containsExactly(1, 2);
    }

    @Test
    void fillArgs_nameInBoth_contextWins() {
        List<Object> values = ArgumentResolver.fillArgs(
            List.of("language"), Map.of("language", "de"), Map.of("language", "en"));

        assertThat(values).containsExactly("de");
    }

    @Test
    void fillArgs_nullValueInContext_countsAsPresent() {
        Map<String, Object> context = new HashMap<>();
        context.put("intent", null);

        List<Object> values = ArgumentResolver.fillArgs(List.of("intent"), context, Map.of("intent", "greet"));

        assertThat(values).containsExactly((Object) null);
    }

    @Test
    void fillArgs_nothingAvailable_namesEveryMissingArgument() {
        MissingArgumentException error = catchThrowableOfType(
            () -> ArgumentResolver.fillArgs(List.of("a", "b"), Map.of(), Map.of()),
            MissingArgumentException.class);

        assertThat(error.missingNames()).containsExactly("a", "b");
        assertThat(error.getMessage()).contains("a").contains("b");
    }

    @Test
    void fillArgs_partiallySatisfiable_namesOnlyTheMissingArgument() {
        MissingArgumentException error = catchThrowableOfType(
            () -> ArgumentResolver.fillArgs(List.of("good", "bad"), Map.of("good", 1), Map.of()),
            MissingArgumentException.class);

        assertThat(error.missingNames()).containsExactly("bad");
        assertThat(error.getMessage())
            .as("Satisfiable names never appear in the error")
            .contains("bad")
            .doesNotContain("good");
    }

    @Test
    void fillArgs_duplicateMissingName_reportedOnce() {
        assertThatThrownBy(() -> ArgumentResolver.fillArgs(List.of("x", "x"), Map.of(), Map.of()))
            .isInstanceOf(MissingArgumentException.class)
            .extracting(e -> ((MissingArgumentException) e).missingNames())
            .isEqualTo(List.of("x"));
    }

    @Test
    void fillArgs_sameInputs_sameResult() {
        Map<String, Object> context = Map.of("text", "hello");
        Map<String, Object> config = Map.of("language", "en");

        List<Object> first = ArgumentResolver.fillArgs(List.of("text", "language"), context, config);
        List<Object> second = ArgumentResolver.fillArgs(List.of("text", "language"), context, config);

        assertThat(first).isEqualTo(second).containsExactly("hello", "en");
    }

    @Test
    void fillArgs_doesNotMutateInputs() {
        Map<String, Object> context = new HashMap<>(Map.of("a", 1));
        Map<String, Object> config = new HashMap<>(Map.of("b", 2));

        ArgumentResolver.fillArgs(List.of("a", "b"), context, config);

        assertThat(context).containsExactly(Map.entry("a", 1));
        assertThat(config).containsExactly(Map.entry("b", 2));
    }

    @Test
    void fillArgs_noRequiredNames_returnsEmpty() {
        assertThat(ArgumentResolver.fillArgs(List.of(), null, null)).isEmpty();
    }

    @Test
    void bind_pairsNamesWithValues() {
        StageArguments args = ArgumentResolver.bind(List.of("text", "language"),
            Map.of("text", "hi"), Map.of("language", "en"));

        assertThat(args.size()).isEqualTo(2);
        assertThat(args.get("text")).isEqualTo("hi");
        assertThat(args.get(1)).isEqualTo("en");
        assertThatThrownBy(() -> args.get("tokens"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("tokens");
    }
}
