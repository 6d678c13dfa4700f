package com.vidnyan.classlint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * class-lint - finds class methods and properties that cannot be overridden
 * and rewrites them as {@code final class} or {@code static}.
 */
@SpringBootApplication
public class ClassLintApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ClassLintApplication.class, args)));
    }
}
