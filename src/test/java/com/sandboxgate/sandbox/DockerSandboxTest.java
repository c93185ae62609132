package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.NetworkConfig;
import com.sandboxgate.shared.config.ResourceLimits;
import com.sandboxgate.shared.config.SandboxConfig;
import com.sandboxgate.shared.config.SecurityConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DockerSandboxTest {

    private static SandboxConfig.Builder config() {
        return SandboxConfig.builder()
                .dockerImage("python:3.12-slim")
                .resourceLimits(new ResourceLimits(2, 512, 1024, 60, 64));
    }

    @Test
    void runAppliesResourceLimitsAndDisablesNetwork() {
        var args = new DockerSandbox(config().build(), "sbx-test").runArgs();

        assertThat(args).startsWith("docker", "run", "-d", "--name", "sbx-test");
        assertThat(args).contains("--memory=512m", "--cpus=2", "--pids-limit=64", "--network=none", "--rm");
        assertThat(args).endsWith("python:3.12-slim", "sleep", "infinity");
    }

    @Test
    void networkStaysOnWhenEnabled() {
        var cfg = config().network(NetworkConfig.allowing(List.of("pypi.org"))).build();
        assertThat(new DockerSandbox(cfg, "sbx").runArgs()).doesNotContain("--network=none");
    }

    @Test
    void domainAllowListIsReportedAsUnenforced() {
        var allowing = config().network(NetworkConfig.allowing(List.of("pypi.org", "github.com"))).build();
        assertEquals(List.of("pypi.org", "github.com"), new DockerSandbox(allowing, "sbx").unenforcedDomains());
        assertThat(new DockerSandbox(allowing, "sbx").runArgs()).noneMatch(a -> a.contains("pypi.org"));

        var offline = config().network(new NetworkConfig(false, List.of("pypi.org"), false)).build();
        assertTrue(new DockerSandbox(offline, "sbx").unenforcedDomains().isEmpty());
        assertTrue(new DockerSandbox(config().build(), "sbx").unenforcedDomains().isEmpty());
    }

    @Test
    void persistentFilesKeepTheContainer() {
        var cfg = config().persistFiles(true).build();
        assertThat(new DockerSandbox(cfg, "sbx").runArgs()).doesNotContain("--rm");
    }

    @Test
    void execRunsAsSandboxUserUnlessRootAllowed() {
        var sandbox = new DockerSandbox(config().build(), "sbx");
        assertEquals(List.of("docker", "exec", "--user", DockerSandbox.SANDBOX_USER, "-w", "/workspace", "sbx", "ls"),
                sandbox.execArgs(List.of("ls"), false));

        var root = new DockerSandbox(config().security(SecurityConfig.defaults().withAllowRoot(true)).build(), "sbx");
        assertEquals(List.of("docker", "exec", "-i", "-w", "/workspace", "sbx", "cat"),
                root.execArgs(List.of("cat"), true));
    }

    @Test
    void operationsRequireConnection() {
        var sandbox = new DockerSandbox(config().build(), "sbx");
        assertNull(sandbox.sandboxId());
        assertFalse(sandbox.executeBash("ls", null).success());
        assertFalse(sandbox.writeFile("a.txt", "x").success());
    }
}
