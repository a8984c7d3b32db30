package io.flowc.core.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleTemplateResolverTest {

    private final TemplateResolver resolver = new SimpleTemplateResolver();

    @Test
    void shouldReplaceKnownPlaceholders() {
        String result =
                resolver.resolve(
                        "Write about {topic} in {style} style",
                        Map.of("topic", "rivers", "style", "haiku"));

        assertThat(result).isEqualTo("Write about rivers in haiku style");
    }

    @Test
    void shouldKeepUnknownPlaceholdersUntouched() {
        String result = resolver.resolve("Hello {name}, see {missing}", Map.of("name", "Ada"));

        assertThat(result).isEqualTo("Hello Ada, see {missing}");
    }

    @Test
    void shouldLeaveDoubledBracesAlone() {
        String result = resolver.resolve("{{topic}} and {topic}", Map.of("topic", "rivers"));

        assertThat(result).isEqualTo("{{topic}} and rivers");
    }

    @Test
    void shouldIgnoreMalformedPlaceholders() {
        String template = "{1x} { topic } {topic-name} {}";

        assertThat(resolver.resolve(template, Map.of("topic", "x", "1x", "y")))
                .isEqualTo(template);
    }

    @Test
    void shouldInsertValuesLiterally() {
        String result = resolver.resolve("cost: {price}", Map.of("price", "$5 \\ item"));

        assertThat(result).isEqualTo("cost: $5 \\ item");
    }

    @Test
    void shouldPassThroughNullTemplate() {
        assertThat(resolver.resolve(null, Map.of("a", "b"))).isNull();
    }

    @Test
    void shouldReturnTemplateWhenNoValues() {
        assertThat(resolver.resolve("{topic}", Map.of())).isEqualTo("{topic}");
    }
}
