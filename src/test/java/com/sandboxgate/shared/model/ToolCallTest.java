package com.sandboxgate.shared.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ToolCallTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void unknownToolsAreHighRisk() {
        var call = new ToolCall("LaunchMissiles", Map.of());
        assertEquals(ToolType.UNKNOWN, call.toolType());
        assertTrue(call.isHighRisk());
        assertTrue(call.toolType().requiresSandbox());
        assertFalse(call.toolType().isSandboxExecutable());
    }

    @Test
    void riskClassesFollowToolTable() {
        assertEquals(ToolRiskClass.READ_ONLY, ToolType.fromName("Grep").riskClass());
        assertEquals(ToolRiskClass.STANDARD, ToolType.fromName("WebFetch").riskClass());
        assertEquals(ToolRiskClass.HIGH, ToolType.fromName("NotebookEdit").riskClass());
        assertFalse(ToolType.fromName("Read").requiresSandbox());
        assertTrue(ToolType.fromName("Read").isSandboxExecutable());
        assertEquals(ToolType.UNKNOWN, ToolType.fromName("bash"));
    }

    @Test
    void argumentsAreImmutableAndMayHoldNulls() {
        var args = new HashMap<String, Object>();
        args.put("command", "ls");
        args.put("timeout", null);
        var call = new ToolCall("Bash", args);
        args.put("command", "rm -rf /");

        assertEquals("ls", call.stringArg("", "command"));
        assertNull(call.intArg("timeout"));
        assertThrows(UnsupportedOperationException.class, () -> call.arguments().put("x", 1));
    }

    @Test
    void pathAcceptsBothAliases() {
        assertEquals("a.txt", new ToolCall("Read", Map.of("path", "a.txt")).path());
        assertEquals("b.txt", new ToolCall("Read", Map.of("file_path", "b.txt")).path());
        assertEquals("", new ToolCall("Read", Map.of()).path());
    }

    @Test
    void intArgParsesStringsAndRejectsGarbage() {
        assertEquals(30, new ToolCall("Bash", Map.of("timeout", "30")).intArg("timeout"));
        assertEquals(5, new ToolCall("Bash", Map.of("timeout", 5.0)).intArg("timeout"));
        assertThrows(IllegalArgumentException.class,
                () -> new ToolCall("Bash", Map.of("timeout", "soon")).intArg("timeout"));
    }

    @Test
    void fromJsonKeepsArgumentOrder() throws Exception {
        var node = objectMapper.readTree("{\"file_path\":\"x.py\",\"old_string\":\"a\",\"new_string\":\"b\",\"replace_all\":true}");
        var call = ToolCall.fromJson("Edit", node, "call-1");

        assertEquals("call-1", call.callId());
        assertThat(call.arguments().keySet()).containsExactly("file_path", "old_string", "new_string", "replace_all");
        assertTrue(call.boolArg("replace_all"));
    }

    @Test
    void fromJsonRejectsNonObjects() throws Exception {
        var node = objectMapper.readTree("[1,2]");
        assertThrows(IllegalArgumentException.class, () -> ToolCall.fromJson("Bash", node, null));
    }
}
