package com.sandboxgate.sandbox;

import com.sandboxgate.shared.model.ExecutionResult;
import com.sandboxgate.shared.model.ToolCall;

/**
 * Capability contract of an execution backend. One implementation per provider.
 *
 * <p>Operations report in-band failures (non-zero exit, missing file) as unsuccessful
 * {@link ExecutionResult}s and throw {@link SandboxException} only when the backend
 * itself cannot be reached. A connected sandbox is used by one caller at a time.
 */
public interface Sandbox extends AutoCloseable {

    /** Backend identifier, or {@code null} before the first {@link #connect()}. */
    String sandboxId();

    SandboxState state();

    default boolean isConnected() {
        return state() == SandboxState.CONNECTED;
    }

    void connect();

    /** Releases backend resources. Safe to call when already disconnected. */
    void disconnect();

    /**
     * Runs a shell command in the working directory.
     * @param timeoutSeconds per-command timeout, or {@code null} for the configured default
     */
    ExecutionResult executeBash(String command, Integer timeoutSeconds);

    ExecutionResult readFile(String path);

    ExecutionResult writeFile(String path, String content);

    /** Lists entries under {@code path}, optionally filtered by a glob {@code pattern}. */
    ExecutionResult listFiles(String path, String pattern);

    /** Regex search of file contents under {@code path}, optionally restricted by a file glob. */
    ExecutionResult searchFiles(String pattern, String path, String filePattern);

    /**
     * Dispatches a tool call to the matching operation.
     * @throws UnsupportedToolException for tools without a handler
     */
    default ExecutionResult executeTool(ToolCall call) {
        switch (call.toolType()) {
            case BASH:
                return executeBash(call.stringArg("", "command"), call.intArg("timeout"));
            case READ:
                return readFile(call.path());
            case WRITE:
                return writeFile(call.path(), call.stringArg("", "content", "file_content"));
            case GLOB:
                return listFiles(call.stringArg(".", "path"), call.stringArg(null, "pattern"));
            case GREP:
                return searchFiles(call.stringArg("", "pattern"), call.stringArg(".", "path"),
                        call.stringArg(null, "include"));
            case EDIT:
                return editFile(call.path(),
                        call.stringArg("", "old_string", "old_text"),
                        call.stringArg("", "new_string", "new_text"),
                        call.boolArg("replace_all"));
            default:
                throw new UnsupportedToolException(call.toolName());
        }
    }

    /**
     * Read-modify-write edit. An unreadable file counts as empty and an empty
     * {@code oldText} overwrites the whole file. Otherwise {@code oldText} must occur
     * exactly once, or at least once with {@code replaceAll}.
     */
    default ExecutionResult editFile(String path, String oldText, String newText, boolean replaceAll) {
        var current = readFile(path);
        var original = current.success() ? current.output() : "";
        var replacement = newText == null ? "" : newText;

        String updated;
        if (oldText == null || oldText.isEmpty()) {
            updated = replacement;
        } else {
            int occurrences = countOccurrences(original, oldText);
            if (occurrences == 0) {
                return ExecutionResult.failure("Text to replace not found in " + path + ": " + preview(oldText));
            }
            if (occurrences > 1 && !replaceAll) {
                return ExecutionResult.failure("Text to replace occurs " + occurrences + " times in " + path
                        + "; provide more context or set replace_all");
            }
            updated = replaceAll ? original.replace(oldText, replacement) : replaceFirst(original, oldText, replacement);
        }

        var written = writeFile(path, updated);
        if (!written.success()) return written;
        return ExecutionResult.ok("Edited " + path).withFileChanges(written.filesCreated(), written.filesModified());
    }

    @Override
    default void close() {
        disconnect();
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }

    private static String replaceFirst(String text, String needle, String replacement) {
        int at = text.indexOf(needle);
        return text.substring(0, at) + replacement + text.substring(at + needle.length());
    }

    private static String preview(String s) {
        return s.length() <= 100 ? s : s.substring(0, 100) + "...";
    }
}
