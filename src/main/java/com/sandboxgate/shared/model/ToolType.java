package com.sandboxgate.shared.model;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tool names understood by the agent runtime. Anything else maps to {@link #UNKNOWN},
 * which is classified as high risk.
 */
public enum ToolType {

    READ("Read", ToolRiskClass.READ_ONLY),
    WRITE("Write", ToolRiskClass.HIGH),
    EDIT("Edit", ToolRiskClass.HIGH),
    BASH("Bash", ToolRiskClass.HIGH),
    GLOB("Glob", ToolRiskClass.READ_ONLY),
    GREP("Grep", ToolRiskClass.READ_ONLY),
    TASK("Task", ToolRiskClass.HIGH),
    TASK_OUTPUT("TaskOutput", ToolRiskClass.STANDARD),
    WEB_FETCH("WebFetch", ToolRiskClass.STANDARD),
    WEB_SEARCH("WebSearch", ToolRiskClass.STANDARD),
    NOTEBOOK_EDIT("NotebookEdit", ToolRiskClass.HIGH),
    TODO_WRITE("TodoWrite", ToolRiskClass.STANDARD),
    ASK_USER_QUESTION("AskUserQuestion", ToolRiskClass.STANDARD),
    SKILL("Skill", ToolRiskClass.STANDARD),
    SLASH_COMMAND("SlashCommand", ToolRiskClass.STANDARD),
    ENTER_PLAN_MODE("EnterPlanMode", ToolRiskClass.STANDARD),
    EXIT_PLAN_MODE("ExitPlanMode", ToolRiskClass.STANDARD),
    KILL_SHELL("KillShell", ToolRiskClass.STANDARD),
    UNKNOWN(null, ToolRiskClass.HIGH);

    private static final Map<String, ToolType> BY_NAME = Stream.of(values())
            .filter(t -> t.toolName != null)
            .collect(Collectors.toUnmodifiableMap(t -> t.toolName, Function.identity()));

    private final String toolName;
    private final ToolRiskClass riskClass;

    ToolType(String toolName, ToolRiskClass riskClass) {
        this.toolName = toolName;
        this.riskClass = riskClass;
    }

    public static ToolType fromName(String name) {
        if (name == null) return UNKNOWN;
        return BY_NAME.getOrDefault(name, UNKNOWN);
    }

    /** Wire name, or {@code null} for {@link #UNKNOWN}. */
    public String toolName() { return toolName; }

    public ToolRiskClass riskClass() { return riskClass; }

    public boolean requiresSandbox() {
        return riskClass == ToolRiskClass.HIGH;
    }

    public boolean isFileOperation() {
        return this == READ || this == WRITE || this == EDIT || this == GLOB || this == GREP;
    }

    public boolean isReadOnly() {
        return riskClass == ToolRiskClass.READ_ONLY;
    }

    /** Whether {@code Sandbox.executeTool} has a handler for this tool. */
    public boolean isSandboxExecutable() {
        return this == BASH || isFileOperation();
    }
}
