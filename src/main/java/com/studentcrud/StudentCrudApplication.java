package com.studentcrud;

import com.studentcrud.shell.ShellConsole;
import com.studentcrud.shell.ShellLauncher;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.NestedExceptionUtils;

/**
 * Student CRUD console.
 *
 * The context only wires components; the interactive loop is started explicitly
 * so that its exit status becomes the process exit status.
 * A context that fails to start (e.g. malformed PGPORT) exits with status 1.
 */
@SpringBootApplication
public class StudentCrudApplication {

    private static final String SPRING_PACKAGE_PREFIX = "org.springframework.";

    public static void main(String[] args) {
        ConfigurableApplicationContext context;
        try {
            context = SpringApplication.run(StudentCrudApplication.class, args);
        } catch (RuntimeException e) {
            System.exit(reportStartupFailure(e, ShellConsole.system()));
            return;
        }

        int exitCode = context.getBean(ShellLauncher.class).run();
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    /**
     * Print the reason the context could not start and return the exit status for it.
     */
    static int reportStartupFailure(RuntimeException failure, ShellConsole console) {
        console.log(startupFailureMessage(failure));
        return ShellLauncher.EXIT_INIT_FAILED;
    }

    /**
     * The first cause outside the Spring wrappers carries the actionable message
     * (e.g. which PG* setting is malformed); fall back to the innermost cause.
     */
    static String startupFailureMessage(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (!t.getClass().getName().startsWith(SPRING_PACKAGE_PREFIX)) {
                return "Initialization error: " + ShellConsole.describe(t);
            }
        }
        return "Initialization error: " + ShellConsole.describe(NestedExceptionUtils.getMostSpecificCause(failure));
    }
}
