package io.flowc.core.hook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.flowc.core.exception.CompilationException;
import io.flowc.core.ir.WorkflowIR;
import io.flowc.core.ir.WorkflowMetadata;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HookRegistryTest {

    @Mock private CompileHook failing;

    @Mock private CompileHook later;

    private static WorkflowIR workflow(String name) {
        return WorkflowIR.builder().metadata(new WorkflowMetadata(name, "1.0")).build();
    }

    @Test
    void shouldDispatchByPriorityThenName() throws Exception {
        // Given
        List<String> calls = new ArrayList<>();
        HookRegistry hooks =
                HookRegistry.builder()
                        .register("low", 0, ir -> record(calls, "low", ir))
                        .register("b-high", 10, ir -> record(calls, "b-high", ir))
                        .register("a-high", 10, ir -> record(calls, "a-high", ir))
                        .build();

        // When
        hooks.dispatch(workflow("demo"));

        // Then
        assertThat(calls).containsExactly("a-high", "b-high", "low");
        assertThat(hooks.registrations())
                .extracting(HookRegistration::name)
                .containsExactly("a-high", "b-high", "low");
    }

    @Test
    void shouldThreadWorkflowThroughHooks() throws Exception {
        // Given
        WorkflowIR replaced = workflow("replaced");
        HookRegistry hooks =
                HookRegistry.builder()
                        .register("replace", 1, ir -> replaced)
                        .register("keep", 0, ir -> ir)
                        .build();

        // When
        WorkflowIR result = hooks.dispatch(workflow("original"));

        // Then
        assertThat(result).isSameAs(replaced);
    }

    @Test
    void shouldReturnInputWithoutHooks() throws Exception {
        WorkflowIR input = workflow("demo");

        assertThat(HookRegistry.empty().dispatch(input)).isSameAs(input);
    }

    @Test
    void shouldStopAtFailingHook() throws Exception {
        // Given
        when(failing.afterCompile(any())).thenThrow(new CompilationException("rejected"));
        HookRegistry hooks =
                HookRegistry.builder().register("first", 1, failing).register("second", 0, later).build();

        // When / Then
        assertThatThrownBy(() -> hooks.dispatch(workflow("demo")))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("rejected");
        verify(later, never()).afterCompile(any());
    }

    @Test
    void shouldRejectHookReturningNull() {
        HookRegistry hooks = HookRegistry.builder().register("broken", 0, ir -> null).build();

        assertThatThrownBy(() -> hooks.dispatch(workflow("demo")))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Compile hook 'broken' returned no workflow");
    }

    @Test
    void shouldRejectDuplicateNames() {
        HookRegistry.Builder builder = HookRegistry.builder().register("audit", 0, ir -> ir);

        assertThatThrownBy(() -> builder.register("audit", 5, ir -> ir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Hook already registered: audit");
    }

    private static WorkflowIR record(List<String> calls, String name, WorkflowIR workflow) {
        calls.add(name);
        return workflow;
    }
}
