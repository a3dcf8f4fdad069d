package org.javai.runner.capability;

import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CapabilityTest {

    @Test
    void render_substitutesKnownPlaceholders() {
        Capability review = Capability.of("code-review", "Review this diff:\n{{diff}}\nFocus: {{ focus }}");

        String prompt = review.render(Map.of("diff", "+ added line", "focus", "security"));

        assertThat(prompt).isEqualTo("Review this diff:\n+ added line\nFocus: security");
    }

    @Test
    void render_leavesUnknownPlaceholdersUntouched() {
        Capability review = Capability.of("code-review", "{{diff}} and {{missing}}");

        assertThat(review.render(Map.of("diff", "d"))).isEqualTo("d and {{missing}}");
    }

    @Test
    void render_valuesWithRegexSpecialCharactersAreLiteral() {
        Capability review = Capability.of("code-review", "cost: {{price}}");

        assertThat(review.render(Map.of("price", "$5 \\ each"))).isEqualTo("cost: $5 \\ each");
    }

    @Test
    void provider_loadsKnownAndRejectsUnknown() throws RunnerException {
        CapabilityProvider provider = CapabilityProvider.of(
                Capability.of("code-review", "review"),
                Capability.of("test-gen", "tests"));

        assertThat(provider.discover()).containsExactly("code-review", "test-gen");
        assertThat(provider.load("test-gen").prompt()).isEqualTo("tests");
        assertThatThrownBy(() -> provider.load("nope"))
                .isInstanceOfSatisfying(RunnerException.class, e -> {
                    assertThat(e.error()).isEqualTo(RunnerError.CAPABILITY_NOT_FOUND);
                    assertThat(e).hasMessage("capability not found: nope");
                });
    }
}
