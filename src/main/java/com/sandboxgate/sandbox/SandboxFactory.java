package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.SandboxConfig;

/** Creates unconnected sandboxes for a configuration. */
@FunctionalInterface
public interface SandboxFactory {

    Sandbox create(SandboxConfig config);
}
