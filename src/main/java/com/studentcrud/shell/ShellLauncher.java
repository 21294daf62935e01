package com.studentcrud.shell;

import com.studentcrud.repository.SchemaInitializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Component;

/**
 * Startup sequence: ensure the schema, then hand the console to the shell.
 * A schema failure is fatal and the shell never starts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShellLauncher {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INIT_FAILED = 1;

    private final SchemaInitializer schemaInitializer;
    private final StudentShell studentShell;
    private final ShellConsole console;

    /**
     * @return the process exit status
     */
    public int run() {
        try {
            schemaInitializer.initialize();
        } catch (RuntimeException e) {
            log.error("Schema initialization failed", e);
            console.log("Initialization error: " + ShellConsole.describe(NestedExceptionUtils.getMostSpecificCause(e)));
            return EXIT_INIT_FAILED;
        }
        console.log("Database initialized");

        studentShell.run();
        return EXIT_OK;
    }
}
