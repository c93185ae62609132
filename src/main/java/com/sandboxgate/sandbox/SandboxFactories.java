package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.ConfigurationException;
import com.sandboxgate.shared.config.SandboxConfig;
import com.sandboxgate.shared.config.SandboxType;

import java.nio.file.Path;

/**
 * Factories for the built-in providers. Hosted providers (E2B, Daytona) need a
 * caller-supplied {@link SandboxFactory} wrapping their client SDK.
 */
public final class SandboxFactories {

    private SandboxFactories() {}

    public static SandboxFactory docker() {
        return DockerSandbox::new;
    }

    /** Local sandboxes sharing {@code root}. */
    public static SandboxFactory local(Path root) {
        return config -> new LocalSandbox(config, root);
    }

    public static SandboxFactory forType(SandboxType type) {
        switch (type) {
            case DOCKER:
                return docker();
            case LOCAL:
                return local(Path.of(System.getProperty("java.io.tmpdir"), "sandboxgate"));
            default:
                throw new ConfigurationException("Sandbox type '" + type.id()
                        + "' is hosted externally; supply a SandboxFactory for it");
        }
    }

    public static SandboxFactory forConfig(SandboxConfig config) {
        return forType(config.sandboxType());
    }
}
