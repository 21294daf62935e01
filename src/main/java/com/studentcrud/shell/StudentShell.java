package com.studentcrud.shell;

import com.studentcrud.model.OperationResult;
import com.studentcrud.model.Student;
import com.studentcrud.service.StudentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Interactive menu loop.
 *
 * MENU:
 * - 1 create, 2 list, 3 update, 4 delete, 5 quit
 * - anything else is reported as an invalid option
 *
 * A failed operation is reported on the console and the loop carries on.
 * End of input ends the loop like option 5.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StudentShell {

    static final String TITLE = "PostgreSQL Student CRUD";
    static final String MENU = "1) Create  2) List  3) Update  4) Delete  5) Quit";

    private final StudentService studentService;
    private final TableFormatter<Student> tableFormatter;
    private final ShellConsole console;

    public void run() {
        while (true) {
            console.log(TITLE);
            console.log(MENU);
            String choice = console.prompt("> ");
            if (choice == null) {
                log.info("Console input closed, leaving shell");
                console.log("Goodbye");
                return;
            }

            switch (choice) {
                case "1" -> handleCreate();
                case "2" -> handleList();
                case "3" -> handleUpdate();
                case "4" -> handleDelete();
                case "5" -> {
                    console.log("Goodbye");
                    return;
                }
                default -> console.log("Invalid option");
            }
        }
    }

    private void handleCreate() {
        String name = console.prompt("Name: ");
        String email = name == null ? null : console.prompt("Email: ");
        if (email == null) {
            log.debug("Console input closed during create, nothing sent");
            return;
        }

        OperationResult<Integer> result = studentService.create(name, email);
        if (result.isFailure()) {
            console.log("Create error: " + result.message());
        } else {
            console.log("Created student with ID=" + result.value());
        }
    }

    private void handleList() {
        OperationResult<List<Student>> result = studentService.list();
        if (result.isFailure()) {
            console.log("List error: " + result.message());
            return;
        }
        tableFormatter.format(result.value()).forEach(console::log);
    }

    private void handleUpdate() {
        Integer id = readId();
        if (id == null) {
            return;
        }
        String rawName = console.prompt("New name (blank to skip): ");
        String rawEmail = rawName == null ? null : console.prompt("New email (blank to skip): ");
        if (rawEmail == null) {
            log.debug("Console input closed during update, nothing sent");
            return;
        }
        String name = blankToNull(rawName);
        String email = blankToNull(rawEmail);

        OperationResult<Integer> result = studentService.update(id, name, email);
        if (result.isFailure()) {
            console.log("Update error: " + result.message());
        } else {
            console.log("Updated " + result.value() + " row(s)");
        }
    }

    private void handleDelete() {
        Integer id = readId();
        if (id == null) {
            return;
        }

        OperationResult<Integer> result = studentService.delete(id);
        if (result.isFailure()) {
            console.log("Delete error: " + result.message());
        } else {
            console.log("Deleted " + result.value() + " row(s)");
        }
    }

    /**
     * @return the parsed id, or null after reporting "Invalid ID"
     */
    private Integer readId() {
        String raw = console.prompt("Student ID: ");
        try {
            return Integer.parseInt(orEmpty(raw));
        } catch (NumberFormatException e) {
            log.debug("Rejected student id input '{}'", raw);
            console.log("Invalid ID");
            return null;
        }
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String blankToNull(String value) {
        return value.isEmpty() ? null : value;
    }
}
