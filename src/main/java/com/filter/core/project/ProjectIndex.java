package com.filter.core.project;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.filter.core.config.Mappers;
import com.filter.core.error.StorageException;
import com.filter.core.error.ValidationException;
import com.filter.core.lock.LockHandle;
import com.filter.core.lock.LockManager;
import com.filter.core.logging.InvocationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Installation-wide registry of projects in {@code <filter-home>/projects.yml}.
 *
 * <p>Enforces that a story prefix belongs to at most one project. A registering project creates
 * its root while the index lock is held, so an entry without a root belongs to a project removed
 * behind Filter's back; such entries are pruned on the next registration.
 */
public class ProjectIndex {

    private static final Logger log = LoggerFactory.getLogger(ProjectIndex.class);

    public record Entry(
        @JsonProperty("prefix") String prefix,
        @JsonProperty("path") String path,
        @JsonProperty("name") String name
    ) {
    }

    public record IndexFile(@JsonProperty("projects") List<Entry> projects) {
        public IndexFile {
            projects = projects == null ? List.of() : List.copyOf(projects);
        }
    }

    private final Path home;
    private final LockManager lockManager;
    private final Duration lockTimeout;

    public ProjectIndex(Path home, LockManager lockManager, Duration lockTimeout) {
        this.home = home;
        this.lockManager = lockManager;
        this.lockTimeout = lockTimeout;
    }

    public Path indexFile() {
        return home.resolve("projects.yml");
    }

    /**
     * Records {@code projectPath} under {@code prefix}.
     *
     * @param claim runs under the index lock once the prefix is known to be free and before the
     *              entry is written; it must create the project root. Nothing is recorded when it throws.
     * @throws ValidationException when another live project already uses the prefix
     */
    public void register(InvocationContext ctx, String prefix, Path projectPath, String name, Runnable claim) {
        String normalizedPath = projectPath.toAbsolutePath().normalize().toString();
        try (LockHandle ignored = lock(ctx, "register " + prefix)) {
            List<Entry> live = new ArrayList<>();
            for (Entry entry : read().projects()) {
                if (!Files.isDirectory(new ProjectLayout(Path.of(entry.path())).root())) {
                    log.info("Pruning index entry {} for missing project {}", entry.prefix(), entry.path());
                    continue;
                }
                if (entry.path().equals(normalizedPath)) {
                    continue;
                }
                if (entry.prefix().equalsIgnoreCase(prefix)) {
                    throw new ValidationException("Prefix '" + prefix + "' is already used by project "
                            + entry.name() + " at " + entry.path(),
                            "Choose another prefix with --prefix");
                }
                live.add(entry);
            }
            claim.run();
            live.add(new Entry(prefix.toLowerCase(Locale.ROOT), normalizedPath, name));
            write(new IndexFile(live));
            ctx.audit("index.registered", prefix + " " + normalizedPath);
        }
    }

    /**
     * Removes the entry of {@code projectPath}; a missing entry is not an error.
     */
    public void unregister(InvocationContext ctx, Path projectPath) {
        String normalizedPath = projectPath.toAbsolutePath().normalize().toString();
        try (LockHandle ignored = lock(ctx, "unregister")) {
            List<Entry> entries = read().projects();
            List<Entry> kept = entries.stream().filter(e -> !e.path().equals(normalizedPath)).toList();
            if (kept.size() != entries.size()) {
                write(new IndexFile(kept));
                ctx.audit("index.unregistered", normalizedPath);
            }
        }
    }

    public List<Entry> entries() {
        return read().projects();
    }

    public Optional<Entry> findByPrefix(String prefix) {
        return entries().stream().filter(e -> e.prefix().equalsIgnoreCase(prefix)).findFirst();
    }

    private LockHandle lock(InvocationContext ctx, String operation) {
        return lockManager.acquire(home.resolve(".locks").resolve("index.lock"),
                ctx.correlationId() + " " + operation, lockTimeout);
    }

    private IndexFile read() {
        Path file = indexFile();
        if (!Files.exists(file)) {
            return new IndexFile(List.of());
        }
        try {
            IndexFile index = Mappers.YAML.readValue(file.toFile(), IndexFile.class);
            return index != null ? index : new IndexFile(List.of());
        } catch (IOException e) {
            throw new StorageException("Failed to read project index " + file, e);
        }
    }

    private void write(IndexFile index) {
        ProjectConfigStore.writeAtomically(indexFile(), index);
    }
}
