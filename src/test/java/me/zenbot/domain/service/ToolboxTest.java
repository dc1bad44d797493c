package me.zenbot.domain.service;

import me.zenbot.domain.component.ToolComponent;
import me.zenbot.domain.model.ToolDefinition;
import me.zenbot.domain.model.ToolResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ToolboxTest {

    private ToolComponent echoTool;
    private Toolbox toolbox;

    @BeforeEach
    void setUp() {
        echoTool = mock(ToolComponent.class);
        when(echoTool.getToolName()).thenReturn("echo");
        when(echoTool.getDefinition()).thenReturn(ToolDefinition.builder()
                .name("echo")
                .description("Echo text")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of("text", Map.of("type", "string", "minLength", 1)),
                        "required", List.of("text")))
                .build());
        toolbox = new Toolbox(List.of(echoTool));
    }

    @Test
    void shouldReturnErrorForUnknownTool() {
        Map<String, Object> result = toolbox.runTool("missing", Map.of());

        assertEquals("Tool not found: missing", result.get(ToolResults.ERROR));
    }

    @Test
    void shouldRejectInvalidArgumentsWithoutCallingTool() {
        Map<String, Object> result = toolbox.runTool("echo", Map.of());

        assertEquals("Invalid arguments", result.get(ToolResults.ERROR));
        assertEquals(List.of("text: field required"), result.get(ToolResults.DETAILS));
        verify(echoTool, never()).execute(any());
    }

    @Test
    void shouldPassOnlyDeclaredArguments() {
        Map<String, Object> ok = ToolResults.success();
        when(echoTool.execute(Map.of("text", "hi"))).thenReturn(ok);

        Map<String, Object> result = toolbox.runTool("echo", Map.of("text", "hi", "extra", 1));

        assertSame(ok, result);
    }

    @Test
    void shouldConvertToolExceptionToError() {
        when(echoTool.execute(any())).thenThrow(new IllegalArgumentException("bad input"));

        Map<String, Object> result = toolbox.runTool("echo", Map.of("text", "hi"));

        assertEquals("bad input", result.get(ToolResults.ERROR));
    }

    @Test
    void shouldUseExceptionTypeWhenMessageMissing() {
        when(echoTool.execute(any())).thenThrow(new NullPointerException());

        Map<String, Object> result = toolbox.runTool("echo", Map.of("text", "hi"));

        assertEquals("NullPointerException", result.get(ToolResults.ERROR));
    }

    @Test
    void shouldReportNullResult() {
        when(echoTool.execute(any())).thenReturn(null);

        Map<String, Object> result = toolbox.runTool("echo", Map.of("text", "hi"));

        assertEquals("Tool returned no result: echo", result.get(ToolResults.ERROR));
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        assertThrows(IllegalStateException.class, () -> toolbox.register(echoTool));
    }

    @Test
    void shouldExposeDefinitionsInRegistrationOrder() {
        ToolComponent second = mock(ToolComponent.class);
        when(second.getToolName()).thenReturn("second");
        when(second.getDefinition()).thenReturn(ToolDefinition.simple("second", "Second"));
        toolbox.register(second);

        List<ToolDefinition> definitions = toolbox.getDefinitions();

        assertEquals(2, definitions.size());
        assertEquals("echo", definitions.get(0).getName());
        assertEquals("second", definitions.get(1).getName());
        assertSame(second, toolbox.getTool("second"));
    }
}
