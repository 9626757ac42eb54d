package com.filter.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Yes/no questions on the terminal. Anything but an explicit yes, including end of input, is a no.
 */
@Component
public class Prompter {

    private static final Logger log = LoggerFactory.getLogger(Prompter.class);

    private final BufferedReader in;
    private final PrintStream out;

    public Prompter() {
        this(System.in, System.out);
    }

    Prompter(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    public boolean confirm(String question) {
        out.print(question + " [y/N] ");
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                return false;
            }
            String a = answer.strip().toLowerCase(Locale.ROOT);
            return a.equals("y") || a.equals("yes");
        } catch (IOException e) {
            log.debug("Could not read answer, treating as no: {}", e.getMessage());
            return false;
        }
    }
}
