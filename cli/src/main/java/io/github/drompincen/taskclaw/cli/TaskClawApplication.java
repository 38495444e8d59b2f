package io.github.drompincen.taskclaw.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.taskclaw")
public class TaskClawApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TaskClawApplication.class, args)));
    }
}
