package com.filter.core.pipeline;

import com.filter.TestFixtures;
import com.filter.core.error.StateConflictException;
import com.filter.core.error.StorageException;
import com.filter.core.error.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandPipelineTest {

    private final TestFixtures.RecordingAuditSink sink = new TestFixtures.RecordingAuditSink();

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Nested
    @DisplayName("Sequencing")
    class Sequencing {

        @Test
        @DisplayName("each step receives the previous step's value")
        void valuesFlowThroughSteps() {
            Result<String> result = CommandPipeline.start(TestFixtures.ctx(sink), "start", () -> 2)
                    .then("double", n -> n * 2)
                    .then("format", n -> "value=" + n)
                    .result();

            assertTrue(result.isSuccess());
            assertEquals("value=4", result.orElseThrow());
        }

        @Test
        @DisplayName("the first failure stops the pipeline and carries its step name")
        void firstFailureShortCircuits() {
            List<String> ran = new ArrayList<>();
            ValidationException boom = new ValidationException("bad input");

            Result<Integer> result = CommandPipeline.start(TestFixtures.ctx(sink), "one", () -> {
                        ran.add("one");
                        return 1;
                    })
                    .then("two", n -> {
                        ran.add("two");
                        throw boom;
                    })
                    .then("three", n -> {
                        ran.add("three");
                        return 3;
                    })
                    .result();

            assertEquals(List.of("one", "two"), ran);
            var failure = assertInstanceOf(Result.Failure.class, result);
            assertEquals("two", failure.step());
            assertSame(boom, failure.error());
            assertEquals(List.of("pipeline.step.failed"), sink.events());
        }

        @Test
        @DisplayName("orElseThrow rethrows the original error")
        void orElseThrowRethrowsOriginal() {
            var conflict = new StateConflictException("two stages", "fix it");
            Result<Object> result = CommandPipeline.of(TestFixtures.ctx(sink), "x")
                    .then("conflict", v -> {
                        throw conflict;
                    })
                    .result();

            var thrown = assertThrows(StateConflictException.class, result::orElseThrow);
            assertSame(conflict, thrown);
        }

        @Test
        @DisplayName("UncheckedIOException becomes a StorageException failure")
        void uncheckedIoBecomesStorage() {
            Result<Object> result = CommandPipeline.of(TestFixtures.ctx(sink), "x")
                    .then("read", v -> {
                        throw new UncheckedIOException(new IOException("disk gone"));
                    })
                    .result();

            var failure = assertInstanceOf(Result.Failure.class, result);
            assertInstanceOf(StorageException.class, failure.error());
        }

        @Test
        @DisplayName("peek passes the value through unchanged")
        void peekPassesThrough() {
            List<String> seen = new ArrayList<>();
            Result<String> result = CommandPipeline.of(TestFixtures.ctx(sink), "abc")
                    .peek("observe", seen::add)
                    .result();

            assertEquals("abc", result.orElseThrow());
            assertEquals(List.of("abc"), seen);
        }

        @Test
        @DisplayName("step name is in the MDC while the step runs and removed after")
        void stepNameInMdc() {
            List<String> steps = new ArrayList<>();
            CommandPipeline.of(TestFixtures.ctx(sink), 1)
                    .then("inspect", v -> {
                        steps.add(MDC.get("step"));
                        return v;
                    })
                    .result();

            assertEquals(List.of("inspect"), steps);
            assertNull(MDC.get("step"));
        }
    }

    @Nested
    @DisplayName("Result")
    class ResultTests {

        @Test
        @DisplayName("map and flatMap apply to successes only")
        void mapAppliesToSuccess() {
            Result<Integer> ok = Result.success(3);
            assertEquals(6, ok.map(n -> n * 2).orElseThrow());
            assertEquals("3", ok.flatMap(n -> Result.success(String.valueOf(n))).orElseThrow());

            Result<Integer> failed = Result.failure("step", new ValidationException("no"));
            Result<Integer> mapped = failed.map(n -> n * 2);
            assertFalse(mapped.isSuccess());
            assertEquals("step", ((Result.Failure<Integer>) mapped).step());
        }

        @Test
        @DisplayName("failure requires a step name and an error")
        void failureValidatesArguments() {
            assertThrows(IllegalArgumentException.class,
                    () -> Result.failure(" ", new ValidationException("x")));
            assertThrows(IllegalArgumentException.class, () -> Result.failure("step", null));
        }
    }
}
