package com.stockledger.shell;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPromptTest {

    private static ShellConsole scripted(String input) {
        return new ShellConsole(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8), false);
    }

    @Test
    void isRequested_looksForFlag() {
        assertTrue(ConnectionPrompt.isRequested(new String[]{"--debug", ConnectionPrompt.FLAG}));
        assertFalse(ConnectionPrompt.isRequested(new String[]{"--debug"}));
    }

    @Test
    void ask_blankAnswersUseDefaults() {
        String[] args = ConnectionPrompt.ask(scripted("\n\n\n\n"), new String[]{ConnectionPrompt.FLAG, "--debug"});

        assertArrayEquals(new String[]{
                "--debug",
                "--spring.datasource.url=jdbc:mysql://localhost/inventory_management?createDatabaseIfNotExist=true",
                "--spring.datasource.username=root",
                "--spring.datasource.password="}, args);
    }

    @Test
    void ask_usesGivenAnswers() {
        String[] args = ConnectionPrompt.ask(scripted("db.internal:3307\nshop\nsecret\nstore_2024\n"), new String[0]);

        assertEquals("--spring.datasource.url=jdbc:mysql://db.internal:3307/store_2024?createDatabaseIfNotExist=true",
                args[0]);
        assertEquals("--spring.datasource.username=shop", args[1]);
        assertEquals("--spring.datasource.password=secret", args[2]);
    }

    @Test
    void ask_rejectsUnsafeDatabaseName() {
        String[] args = ConnectionPrompt.ask(scripted("\n\n\nshop; DROP TABLE x\n"), new String[0]);

        assertEquals("--spring.datasource.url=" + ConnectionPrompt.jdbcUrl("localhost", "inventory_management"),
                args[0]);
    }

    @Test
    void ask_closedInputFallsBackToDefaults() {
        String[] args = ConnectionPrompt.ask(scripted(""), new String[0]);

        assertEquals(3, args.length);
        assertEquals("--spring.datasource.username=root", args[1]);
    }
}
