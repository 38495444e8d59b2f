package io.github.drompincen.taskclaw.cli.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskclaw.persistence.backup.DocumentRestoreService;
import io.github.drompincen.taskclaw.persistence.repository.SessionRegistryRepository;
import io.github.drompincen.taskclaw.persistence.repository.TaskStoreRepository;
import io.github.drompincen.taskclaw.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskclaw.protocol.api.TaskPriority;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.runtime.config.TaskClawProperties;
import io.github.drompincen.taskclaw.runtime.session.SessionLifecycleService;
import io.github.drompincen.taskclaw.runtime.task.TaskService;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Root of the {@code taskclaw} command tree. Holds the collaborators the subcommands reach
 * through {@code @ParentCommand}; every result is printed to stdout as JSON.
 */
@Command(
        name = "taskclaw",
        mixinStandardHelpOptions = true,
        description = "File-based task store with concurrent scoped sessions",
        subcommands = {
                HelpCommand.class,
                TaskClawCommand.InitCommand.class,
                TaskClawCommand.AddCommand.class,
                TaskClawCommand.ListCommand.class,
                SessionCommand.class,
                BackupCommand.class
        }
)
public final class TaskClawCommand implements Callable<Integer> {

    final SessionLifecycleService sessions;
    final TaskService tasks;
    final TaskStoreRepository taskStoreRepository;
    final SessionRegistryRepository registryRepository;
    final DocumentRestoreService restoreService;
    final CurrentSessionResolver currentSession;
    final TaskClawProperties properties;
    private final ObjectMapper mapper;
    private final PrintStream out;
    private final PrintStream err;

    @Spec
    CommandSpec spec;

    TaskClawCommand(SessionLifecycleService sessions, TaskService tasks,
                    TaskStoreRepository taskStoreRepository, SessionRegistryRepository registryRepository,
                    DocumentRestoreService restoreService, CurrentSessionResolver currentSession,
                    TaskClawProperties properties, ObjectMapper mapper, PrintStream out, PrintStream err) {
        this.sessions = sessions;
        this.tasks = tasks;
        this.taskStoreRepository = taskStoreRepository;
        this.registryRepository = registryRepository;
        this.restoreService = restoreService;
        this.currentSession = currentSession;
        this.properties = properties;
        this.mapper = mapper;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(err);
        return ErrorCode.INVALID_ARGS.exitCode();
    }

    Integer print(Object value) {
        write(out, value);
        return 0;
    }

    void warn(String message) {
        err.println("warning: " + message);
    }

    int fail(ErrorCode code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", code.name());
        error.put("code", code.exitCode());
        error.put("message", message);
        write(err, error);
        return code.exitCode();
    }

    PrintStream err() {
        return err;
    }

    private void write(PrintStream stream, Object value) {
        try {
            stream.println(mapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render output", e);
        }
    }

    @Command(name = "init", description = "Create todo.json and sessions.json if missing")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TaskClawCommand parent;

        @Option(names = "--project", description = "Project name recorded in both documents")
        String project;

        @Override
        public Integer call() {
            String name = project != null ? project : parent.properties.getProject();
            if (name == null) {
                Path cwd = Path.of("").toAbsolutePath();
                name = cwd.getFileName() != null ? cwd.getFileName().toString() : "taskclaw";
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("todoCreated", parent.taskStoreRepository.initializeIfAbsent(name));
            result.put("sessionsCreated", parent.registryRepository.initializeIfAbsent(name));
            result.put("dataDir", parent.properties.getDataDir());
            return parent.print(result);
        }
    }

    @Command(name = "add", description = "Create a task")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        TaskClawCommand parent;

        @Parameters(index = "0", description = "Task title")
        String title;

        @Option(names = "--parent", description = "Parent task id")
        String parentId;

        @Option(names = "--priority", defaultValue = "medium", description = "low|medium|high|critical")
        TaskPriority priority;

        @Option(names = "--phase", description = "Phase label")
        String phase;

        @Option(names = "--description", description = "Longer description")
        String description;

        @Override
        public Integer call() {
            return parent.print(parent.tasks.create(
                    new CreateTaskRequest(title, description, parentId, priority, phase)));
        }
    }

    @Command(name = "list", description = "Print every task")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        TaskClawCommand parent;

        @Override
        public Integer call() {
            return parent.print(parent.tasks.list());
        }
    }
}
