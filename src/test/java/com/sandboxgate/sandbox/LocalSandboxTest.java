package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.ResourceLimits;
import com.sandboxgate.shared.config.SandboxConfig;
import com.sandboxgate.shared.config.SandboxType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LocalSandboxTest {

    @TempDir
    Path root;

    private LocalSandbox sandbox;

    @BeforeEach
    void setUp() {
        var config = SandboxConfig.builder()
                .sandboxType(SandboxType.LOCAL)
                .resourceLimits(new ResourceLimits(1, 256, 1024, 10, 20))
                .build();
        sandbox = new LocalSandbox(config, root);
        sandbox.connect();
    }

    @AfterEach
    void tearDown() {
        sandbox.close();
    }

    @Test
    void connectPreparesWorkingDirectory() {
        assertTrue(sandbox.isConnected());
        assertThat(sandbox.sandboxId()).startsWith("local-");
        assertTrue(Files.isDirectory(root.resolve("workspace")));
    }

    @Test
    void writeThenReadReturnsSameBytes() {
        var content = "héllo\n\tworld ✓\n";
        var written = sandbox.writeFile("notes/today.md", content);

        assertTrue(written.success(), written.error());
        assertEquals(List.of("/workspace/notes/today.md"), written.filesCreated());
        assertEquals(content, sandbox.readFile("/workspace/notes/today.md").output());
        assertEquals(List.of("/workspace/notes/today.md"), sandbox.writeFile("notes/today.md", "v2").filesModified());
    }

    @Test
    void pathsCannotEscapeTheRoot() {
        sandbox.writeFile("../../../../outside.txt", "x");
        assertTrue(Files.exists(root.resolve("outside.txt")));
        assertEquals(root.resolve("etc/hosts"), sandbox.hostPath("/etc/hosts"));
    }

    @Test
    void missingFileIsAnUnsuccessfulResult() {
        var result = sandbox.readFile("nope.txt");
        assertFalse(result.success());
        assertEquals("File not found: /workspace/nope.txt", result.error());
    }

    @Test
    void listsWithAndWithoutGlob() {
        sandbox.writeFile("a.py", "");
        sandbox.writeFile("src/b.py", "");
        sandbox.writeFile("src/c.txt", "");

        assertEquals("a.py\nsrc", sandbox.listFiles(".", null).output());
        assertEquals("a.py\nsrc/b.py", sandbox.listFiles(".", "*.py").output());
        assertFalse(sandbox.listFiles("missing", null).success());
    }

    @Test
    void searchReportsFileAndLine() {
        sandbox.writeFile("src/App.java", "class App {\n  // TODO fix\n}\n");
        sandbox.writeFile("README.md", "TODO docs\n");

        assertEquals("/workspace/src/App.java:2:  // TODO fix",
                sandbox.searchFiles("TODO", "src", "*.java").output());
        assertThat(sandbox.searchFiles("TODO", ".", null).output().split("\n")).hasSize(2);
        assertFalse(sandbox.searchFiles("([", ".", null).success());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void runsCommandsInWorkingDirectory() {
        sandbox.writeFile("data.txt", "42");

        var result = sandbox.executeBash("cat data.txt && echo oops >&2", null);
        assertTrue(result.success());
        assertEquals("42", result.output());
        assertEquals(sandbox.sandboxId(), result.sandboxId());

        var failed = sandbox.executeBash("exit 3", null);
        assertFalse(failed.success());
        assertEquals(3, failed.exitCode());
        assertEquals("Command exited with code 3", failed.error());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void commandTimeoutIsAFailure() {
        var result = sandbox.executeBash("sleep 5", 1);
        assertFalse(result.success());
        assertEquals(-1, result.exitCode());
        assertThat(result.error()).contains("timed out after 1s");
    }

    @Test
    void operationsFailWhenDisconnected() {
        sandbox.disconnect();
        assertEquals(SandboxState.DISCONNECTED, sandbox.state());
        assertFalse(sandbox.readFile("a").success());
        assertEquals("Sandbox is not connected", sandbox.executeBash("ls", null).error());
    }
}
