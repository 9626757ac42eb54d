package com.filter.core.story;

import com.filter.TestFixtures;
import com.filter.core.error.StoryNotFoundException;
import com.filter.core.error.ValidationException;
import com.filter.core.lock.LockManager;
import com.filter.core.model.RepositoryRef;
import com.filter.core.model.Story;
import com.filter.core.project.ProjectConfigStore;
import com.filter.core.project.ProjectLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class StoryRegistryTest {

    @TempDir
    Path tempDir;

    private ProjectLayout layout;
    private StoryRegistry registry;

    @BeforeEach
    void setUp() {
        layout = TestFixtures.newProject(tempDir.resolve("ibstreams"), tempDir.resolve("home"), "ibstr");
        registry = new StoryRegistry(layout, new LockManager(), Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("Id allocation")
    class Allocation {

        @Test
        @DisplayName("ids are sequential and persisted in config.yml")
        void sequential() {
            assertEquals("ibstr-1", registry.allocateId(TestFixtures.ctx()));
            assertEquals("ibstr-2", registry.allocateId(TestFixtures.ctx()));
            assertEquals(2, ProjectConfigStore.load(layout).lastStoryNumber());
        }

        @Test
        @DisplayName("numbers already present on disk are skipped")
        void skipsExistingFiles() throws Exception {
            Files.writeString(layout.storyFile("ibstr-1"), "# ibstr-1: hand made\n");

            assertEquals("ibstr-2", registry.allocateId(TestFixtures.ctx()));
        }

        @Test
        @DisplayName("concurrent allocations never hand out the same id")
        void concurrentAllocationIsUnique() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<String>> futures = new ArrayList<>();
                for (int i = 0; i < 20; i++) {
                    futures.add(pool.submit(() -> registry.allocateId(TestFixtures.ctx())));
                }
                List<String> ids = Collections.synchronizedList(new ArrayList<>());
                for (Future<String> f : futures) {
                    ids.add(f.get());
                }
                assertEquals(20, new HashSet<>(ids).size());
                assertEquals(20, ProjectConfigStore.load(layout).lastStoryNumber());
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Story files")
    class StoryFiles {

        @Test
        @DisplayName("create writes the markdown file and find reads it back")
        void createAndFind() {
            Story created = registry.create(TestFixtures.ctx(), "ibstr-1", "  First story ", "desc",
                    RepositoryRef.inherit());

            assertEquals("First story", created.title());
            assertTrue(Files.isRegularFile(layout.storyFile("ibstr-1")));
            assertEquals(created, registry.require("ibstr-1"));
        }

        @Test
        @DisplayName("create refuses to overwrite an existing story")
        void noOverwrite() {
            registry.create(TestFixtures.ctx(), "ibstr-1", "One", "", RepositoryRef.inherit());
            assertThrows(ValidationException.class,
                    () -> registry.create(TestFixtures.ctx(), "ibstr-1", "Two", "", RepositoryRef.inherit()));
            assertEquals("One", registry.require("ibstr-1").title());
        }

        @Test
        @DisplayName("blank and multi-line titles are rejected")
        void titleValidation() {
            assertThrows(ValidationException.class,
                    () -> registry.create(TestFixtures.ctx(), "ibstr-1", " ", "", null));
            assertThrows(ValidationException.class,
                    () -> registry.create(TestFixtures.ctx(), "ibstr-1", "a\nb", "", null));
        }

        @Test
        @DisplayName("require throws StoryNotFoundException for unknown ids")
        void requireUnknown() {
            assertThrows(StoryNotFoundException.class, () -> registry.require("ibstr-99"));
            assertTrue(registry.find("ibstr-99").isEmpty());
        }

        @Test
        @DisplayName("listAll orders by number and ignores non-story files")
        void listAllOrdering() throws Exception {
            registry.create(TestFixtures.ctx(), "ibstr-10", "Ten", "", null);
            registry.create(TestFixtures.ctx(), "ibstr-2", "Two", "", null);
            Files.writeString(layout.storiesDir().resolve("notes.md"), "scratch");

            List<String> ids = registry.listAll().stream().map(Story::id).toList();

            assertEquals(List.of("ibstr-2", "ibstr-10"), ids);
        }

        @Test
        @DisplayName("delete removes the file and reports whether anything was deleted")
        void delete() {
            registry.create(TestFixtures.ctx(), "ibstr-1", "One", "", null);

            assertTrue(registry.delete(TestFixtures.ctx(), "ibstr-1"));
            assertFalse(registry.delete(TestFixtures.ctx(), "ibstr-1"));
            assertFalse(registry.exists("ibstr-1"));
        }

        @Test
        @DisplayName("malformed ids are rejected before touching the filesystem")
        void malformedId() {
            assertThrows(ValidationException.class, () -> registry.find("../etc/passwd"));
        }
    }
}
