package com.filter.core.config;

import com.filter.core.error.ValidationException;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Ordered merge of configuration layers.
 *
 * <p>Precedence, highest first: environment override, workspace (story) layer, project layer,
 * global layer. The global layer must define every field except the repository URL.
 */
public final class ConfigMerger {

    private ConfigMerger() {}

    public static EffectiveSettings merge(ConfigLayer global, ConfigLayer project, ConfigLayer workspace,
                                          FilterEnvironment environment) {
        ConfigLayer merged = global.overriddenBy(project).overriddenBy(workspace);
        if (environment != null) {
            merged = merged.overriddenBy(environment.asLayer());
        }
        return resolve(merged);
    }

    static EffectiveSettings resolve(ConfigLayer layer) {
        require(layer.workspaceRoot(), "workspaceRoot");
        require(layer.branchTemplate(), "branchTemplate");
        require(layer.lockTimeoutSeconds(), "lockTimeoutSeconds");
        require(layer.cloneRetryCount(), "cloneRetryCount");
        require(layer.gitTimeoutSeconds(), "gitTimeoutSeconds");
        if (layer.lockTimeoutSeconds() < 0 || layer.cloneRetryCount() < 0 || layer.gitTimeoutSeconds() <= 0) {
            throw new ValidationException("Invalid configuration: timeouts and retry counts must not be negative"
                    + " (lockTimeoutSeconds=" + layer.lockTimeoutSeconds()
                    + ", cloneRetryCount=" + layer.cloneRetryCount()
                    + ", gitTimeoutSeconds=" + layer.gitTimeoutSeconds() + ")");
        }
        return new EffectiveSettings(
                Path.of(layer.workspaceRoot()),
                layer.branchTemplate(),
                Duration.ofSeconds(layer.lockTimeoutSeconds()),
                layer.cloneRetryCount(),
                Duration.ofSeconds(layer.gitTimeoutSeconds()),
                layer.repositoryUrl());
    }

    private static void require(Object value, String field) {
        if (value == null) {
            throw new ValidationException("Missing configuration value '" + field + "' in global configuration");
        }
    }
}
