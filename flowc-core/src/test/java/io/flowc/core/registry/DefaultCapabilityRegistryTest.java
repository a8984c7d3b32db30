package io.flowc.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultCapabilityRegistryTest {

    private DefaultCapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultCapabilityRegistry();
    }

    @Nested
    class Registration {

        @Test
        void shouldRegisterCapability() {
            CapabilityDefinition tool = CapabilityDefinition.tool("search", "Search tool");

            registry.register(tool);

            assertThat(registry.contains(CapabilityKind.TOOL, "search")).isTrue();
            assertThat(registry.find(CapabilityKind.TOOL, "search")).hasValue(tool);
        }

        @Test
        void shouldKeepKindsApart() {
            registry.register(CapabilityDefinition.tool("audit", "Tool"));

            assertThat(registry.contains(CapabilityKind.CALLBACK, "audit")).isFalse();
        }

        @Test
        void shouldReplaceExistingDefinition() {
            registry.register(CapabilityDefinition.tool("search", "Original"));
            registry.register(CapabilityDefinition.tool("search", "Replacement"));

            assertThat(registry.find(CapabilityKind.TOOL, "search"))
                    .hasValueSatisfying(
                            d -> assertThat(d.description()).isEqualTo("Replacement"));
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        void shouldRemoveDefinition() {
            registry.register(CapabilityDefinition.callback("guard", "Guard"));

            assertThat(registry.remove(CapabilityKind.CALLBACK, "guard")).isTrue();
            assertThat(registry.remove(CapabilityKind.CALLBACK, "guard")).isFalse();
        }

        @Test
        void shouldThrowWhenDefinitionIsNull() {
            assertThatThrownBy(() -> registry.register(null))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        void shouldRejectBlankId() {
            assertThatThrownBy(() -> CapabilityDefinition.tool(" ", "Blank"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Retrieval {

        @Test
        void shouldReturnDefinitionsSortedById() {
            registry.register(CapabilityDefinition.tool("zeta", ""));
            registry.register(CapabilityDefinition.tool("alpha", ""));

            assertThat(registry.all(CapabilityKind.TOOL))
                    .extracting(CapabilityDefinition::id)
                    .containsExactly("alpha", "zeta");
        }

        @Test
        void shouldExposeSchemaClassName() {
            registry.register(CapabilityDefinition.schema("Report", "com.acme.Report"));

            assertThat(registry.find(CapabilityKind.SCHEMA, "Report"))
                    .hasValueSatisfying(
                            d -> assertThat(d.attributes())
                                    .containsEntry(CapabilityDefinition.CLASS_NAME, "com.acme.Report"));
        }

        @Test
        void shouldStartEmpty() {
            CapabilityRegistry empty = CapabilityRegistry.empty();

            assertThat(empty.all(CapabilityKind.TOOL)).isEmpty();
            assertThat(empty.contains(CapabilityKind.SCHEMA, "any")).isFalse();
        }
    }

    @Nested
    class Layers {

        @Test
        void shouldPreferEarlierLayer() {
            // Given
            DefaultCapabilityRegistry project =
                    new DefaultCapabilityRegistry(
                            List.of(CapabilityDefinition.tool("search", "Project search")));
            DefaultCapabilityRegistry global =
                    new DefaultCapabilityRegistry(
                            List.of(
                                    CapabilityDefinition.tool("search", "Global search"),
                                    CapabilityDefinition.tool("fetch", "Global fetch")));

            // When
            LayeredCapabilityRegistry layered =
                    new LayeredCapabilityRegistry(List.of(project, global));

            // Then
            assertThat(layered.find(CapabilityKind.TOOL, "search"))
                    .hasValueSatisfying(
                            d -> assertThat(d.description()).isEqualTo("Project search"));
            assertThat(layered.contains(CapabilityKind.TOOL, "fetch")).isTrue();
            assertThat(layered.all(CapabilityKind.TOOL))
                    .extracting(CapabilityDefinition::description)
                    .containsExactly("Project search", "Global fetch");
        }

        @Test
        void shouldFindNothingWithoutLayers() {
            LayeredCapabilityRegistry layered = new LayeredCapabilityRegistry(List.of());

            assertThat(layered.find(CapabilityKind.TOOL, "search")).isEmpty();
        }
    }
}
