package com.studentcrud.shell;

import com.studentcrud.model.Student;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ShellConfig {

    @Bean
    public ShellConsole shellConsole() {
        return ShellConsole.system();
    }

    @Bean
    public TableFormatter<Student> studentTableFormatter() {
        return TableFormatter.forStudents();
    }
}
