package com.filter;

import com.filter.core.lock.LockManager;
import com.filter.core.logging.AuditSink;
import com.filter.core.logging.InvocationContext;
import com.filter.core.metrics.FilterMetrics;
import com.filter.core.project.ProjectIndex;
import com.filter.core.project.ProjectLayout;
import com.filter.core.project.ProjectManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared builders for tests that need a project on disk.
 */
public final class TestFixtures {

    public static final List<String> STAGES = List.of("planning", "in-progress", "testing", "pr", "complete");

    private TestFixtures() {}

    /**
     * Collects audit events for assertions.
     */
    public static class RecordingAuditSink implements AuditSink {
        private final List<String> events = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void record(String correlationId, String event, String detail) {
            events.add(event);
        }

        public List<String> events() {
            synchronized (events) {
                return List.copyOf(events);
            }
        }
    }

    public static InvocationContext ctx() {
        return new InvocationContext("test0001", (id, event, detail) -> { }, true);
    }

    public static InvocationContext ctx(AuditSink sink) {
        return new InvocationContext("test0001", sink, true);
    }

    public static FilterMetrics metrics() {
        return new FilterMetrics(new SimpleMeterRegistry());
    }

    public static ProjectManager projectManager(Path home, LockManager locks) {
        return new ProjectManager(new ProjectIndex(home, locks, Duration.ofSeconds(2)), STAGES);
    }

    /**
     * Creates a project with the given prefix under {@code projectDir}.
     */
    public static ProjectLayout newProject(Path projectDir, Path home, String prefix) {
        projectManager(home, new LockManager()).create(ctx(), projectDir,
                new ProjectManager.NewProject(null, prefix, List.of(), List.of()));
        return new ProjectLayout(projectDir);
    }
}
