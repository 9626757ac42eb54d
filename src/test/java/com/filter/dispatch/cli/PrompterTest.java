package com.filter.dispatch.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class PrompterTest {

    private boolean answer(String input) {
        var out = new ByteArrayOutputStream();
        var prompter = new Prompter(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8));
        boolean confirmed = prompter.confirm("Proceed?");
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Proceed? [y/N]"));
        return confirmed;
    }

    @Test
    @DisplayName("y and yes confirm, anything else declines")
    void answers() {
        assertTrue(answer("y\n"));
        assertTrue(answer(" YES \n"));
        assertFalse(answer("n\n"));
        assertFalse(answer("\n"));
        assertFalse(answer(""));
    }
}
