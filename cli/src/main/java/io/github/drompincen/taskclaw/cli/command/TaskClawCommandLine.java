package io.github.drompincen.taskclaw.cli.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskclaw.persistence.backup.DocumentRestoreService;
import io.github.drompincen.taskclaw.persistence.repository.SessionRegistryRepository;
import io.github.drompincen.taskclaw.persistence.repository.TaskStoreRepository;
import io.github.drompincen.taskclaw.protocol.api.ScopeType;
import io.github.drompincen.taskclaw.protocol.api.SessionFilter;
import io.github.drompincen.taskclaw.protocol.api.TaskPriority;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import io.github.drompincen.taskclaw.runtime.config.TaskClawProperties;
import io.github.drompincen.taskclaw.runtime.session.SessionLifecycleService;
import io.github.drompincen.taskclaw.runtime.task.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Locale;

/**
 * Runs the {@code taskclaw} command tree once per invocation. Results go to stdout as JSON;
 * failures go to stderr as {@code {error, code, message}} and set the process exit code.
 */
@Component
public class TaskClawCommandLine implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(TaskClawCommandLine.class);

    private final SessionLifecycleService sessions;
    private final TaskService tasks;
    private final TaskStoreRepository taskStoreRepository;
    private final SessionRegistryRepository registryRepository;
    private final DocumentRestoreService restoreService;
    private final CurrentSessionResolver currentSession;
    private final TaskClawProperties properties;
    private final ObjectMapper mapper;
    private final PrintStream out;
    private final PrintStream err;
    private int exitCode;

    @Autowired
    public TaskClawCommandLine(SessionLifecycleService sessions, TaskService tasks,
                               TaskStoreRepository taskStoreRepository,
                               SessionRegistryRepository registryRepository,
                               DocumentRestoreService restoreService,
                               CurrentSessionResolver currentSession,
                               TaskClawProperties properties, ObjectMapper mapper) {
        this(sessions, tasks, taskStoreRepository, registryRepository, restoreService, currentSession,
                properties, mapper, System.out, System.err);
    }

    TaskClawCommandLine(SessionLifecycleService sessions, TaskService tasks,
                        TaskStoreRepository taskStoreRepository,
                        SessionRegistryRepository registryRepository,
                        DocumentRestoreService restoreService,
                        CurrentSessionResolver currentSession,
                        TaskClawProperties properties, ObjectMapper mapper,
                        PrintStream out, PrintStream err) {
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
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String... args) {
        return newCommandLine().execute(args);
    }

    CommandLine newCommandLine() {
        TaskClawCommand root = new TaskClawCommand(sessions, tasks, taskStoreRepository, registryRepository,
                restoreService, currentSession, properties, mapper, out, err);
        CommandLine commandLine = new CommandLine(root)
                .registerConverter(ScopeType.class, ScopeType::fromValue)
                .registerConverter(TaskPriority.class, TaskPriority::fromValue)
                .registerConverter(SessionFilter.class, value -> SessionFilter.valueOf(value.toUpperCase(Locale.ROOT)))
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true));
        commandLine.setParameterExceptionHandler((ex, arguments) -> {
            log.debug("Rejected arguments {}", String.join(" ", arguments), ex);
            return root.fail(ErrorCode.INVALID_ARGS, ex.getMessage());
        });
        commandLine.setExecutionExceptionHandler((ex, command, parseResult) -> {
            if (ex instanceof TaskClawException failure) {
                log.debug("Command {} failed", command.getCommandName(), failure);
                return root.fail(failure.getErrorCode(), failure.getMessage());
            }
            if (ex instanceof IllegalArgumentException) {
                return root.fail(ErrorCode.INVALID_ARGS, ex.getMessage());
            }
            throw ex;
        });
        return commandLine;
    }
}
