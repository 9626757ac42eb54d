package com.filter.core.project;

import com.filter.TestFixtures;
import com.filter.core.error.ValidationException;
import com.filter.core.lock.LockManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ProjectIndexTest {

    @TempDir
    Path tempDir;

    private ProjectIndex index;

    @BeforeEach
    void setUp() {
        index = new ProjectIndex(tempDir.resolve("home"), new LockManager(), Duration.ofSeconds(2));
    }

    private Path liveProject(String name) throws Exception {
        Path path = tempDir.resolve(name);
        Files.createDirectories(new ProjectLayout(path).root());
        return path;
    }

    @Test
    @DisplayName("register writes projects.yml with a lowercased prefix")
    void register() throws Exception {
        Path path = liveProject("a");
        index.register(TestFixtures.ctx(), "ABC", path, "A", () -> {});

        assertTrue(Files.isRegularFile(index.indexFile()));
        assertEquals(1, index.entries().size());
        assertEquals("abc", index.entries().get(0).prefix());
        assertTrue(index.findByPrefix("Abc").isPresent());
    }

    @Test
    @DisplayName("re-registering the same path replaces its entry")
    void reRegisterSamePath() throws Exception {
        Path path = liveProject("a");
        index.register(TestFixtures.ctx(), "abc", path, "A", () -> {});
        index.register(TestFixtures.ctx(), "abc", path, "A renamed", () -> {});

        assertEquals(1, index.entries().size());
        assertEquals("A renamed", index.entries().get(0).name());
    }

    @Test
    @DisplayName("entries of projects that no longer exist are pruned and their prefix freed")
    void prunesDeadProjects() throws Exception {
        Path dead = liveProject("dead");
        index.register(TestFixtures.ctx(), "abc", dead, "dead", () -> {});
        Files.delete(new ProjectLayout(dead).root());

        index.register(TestFixtures.ctx(), "abc", liveProject("b"), "B", () -> {});

        assertEquals(1, index.entries().size());
        assertTrue(index.entries().get(0).path().endsWith("b"));
    }

    @Test
    @DisplayName("a live prefix collision is rejected")
    void collision() throws Exception {
        index.register(TestFixtures.ctx(), "abc", liveProject("a"), "A", () -> {});
        assertThrows(ValidationException.class,
                () -> index.register(TestFixtures.ctx(), "abc", liveProject("b"), "B", () -> {}));
    }

    @Test
    @DisplayName("a claim that fails records nothing")
    void failedClaim() {
        Path path = tempDir.resolve("a");
        assertThrows(ValidationException.class, () -> index.register(TestFixtures.ctx(), "abc", path, "A",
                () -> { throw new ValidationException("already exists"); }));
        assertTrue(index.entries().isEmpty());
    }

    @Test
    @DisplayName("the claim runs after the prefix check, so a collision never creates anything")
    void claimSkippedOnCollision() throws Exception {
        index.register(TestFixtures.ctx(), "abc", liveProject("a"), "A", () -> {});
        AtomicBoolean claimed = new AtomicBoolean();

        assertThrows(ValidationException.class, () -> index.register(TestFixtures.ctx(), "abc",
                tempDir.resolve("b"), "B", () -> claimed.set(true)));
        assertFalse(claimed.get());
    }

    @Test
    @DisplayName("unregister of an unknown path is a no-op")
    void unregisterUnknown() throws Exception {
        index.register(TestFixtures.ctx(), "abc", liveProject("a"), "A", () -> {});
        index.unregister(TestFixtures.ctx(), tempDir.resolve("other"));
        assertEquals(1, index.entries().size());
    }
}
