package com.stockledger.shell;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Asks for MySQL connection settings before the application context starts and
 * turns the answers into Spring command-line properties.
 */
public final class ConnectionPrompt {

    public static final String FLAG = "--prompt-connection";

    static final String DEFAULT_HOST = "localhost";
    static final String DEFAULT_USER = "root";
    static final String DEFAULT_DATABASE = "inventory_management";

    private static final Pattern DATABASE_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private ConnectionPrompt() {
    }

    public static boolean isRequested(String[] args) {
        return Arrays.asList(args).contains(FLAG);
    }

    public static String[] ask(ShellConsole console, String[] args) {
        console.println();
        console.println("=== Database Connection Settings ===");
        console.println("(Press Enter to use defaults)");
        String host = orDefault(console.prompt("MySQL Host [" + DEFAULT_HOST + "]: "), DEFAULT_HOST);
        String user = orDefault(console.prompt("MySQL Username [" + DEFAULT_USER + "]: "), DEFAULT_USER);
        String password = orDefault(console.prompt("MySQL Password: "), "");
        String database = orDefault(console.prompt("Database Name [" + DEFAULT_DATABASE + "]: "), DEFAULT_DATABASE);

        if (!DATABASE_NAME.matcher(database).matches()) {
            console.println("Invalid database name '" + database + "', using " + DEFAULT_DATABASE + ".");
            database = DEFAULT_DATABASE;
        }

        List<String> merged = new ArrayList<>();
        for (String arg : args) {
            if (!FLAG.equals(arg)) {
                merged.add(arg);
            }
        }
        merged.add("--spring.datasource.url=" + jdbcUrl(host, database));
        merged.add("--spring.datasource.username=" + user);
        merged.add("--spring.datasource.password=" + password);
        return merged.toArray(new String[0]);
    }

    static String jdbcUrl(String host, String database) {
        return "jdbc:mysql://" + host + "/" + database + "?createDatabaseIfNotExist=true";
    }

    private static String orDefault(String answer, String fallback) {
        return answer == null || answer.isBlank() ? fallback : answer.strip();
    }
}
