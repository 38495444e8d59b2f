package io.github.drompincen.taskclaw.cli.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskclaw.persistence.StoreLayout;
import io.github.drompincen.taskclaw.persistence.audit.AuditLog;
import io.github.drompincen.taskclaw.persistence.audit.JsonLinesAuditLog;
import io.github.drompincen.taskclaw.persistence.backup.BackupService;
import io.github.drompincen.taskclaw.persistence.backup.DocumentRestoreService;
import io.github.drompincen.taskclaw.persistence.backup.NumberedBackupService;
import io.github.drompincen.taskclaw.persistence.file.AtomicFileWriter;
import io.github.drompincen.taskclaw.persistence.file.FileLockService;
import io.github.drompincen.taskclaw.persistence.json.TaskClawJson;
import io.github.drompincen.taskclaw.persistence.repository.SessionRegistryRepository;
import io.github.drompincen.taskclaw.persistence.repository.TaskStoreRepository;
import io.github.drompincen.taskclaw.runtime.config.TaskClawProperties;
import io.github.drompincen.taskclaw.runtime.hierarchy.ConfigurableHierarchyPolicy;
import io.github.drompincen.taskclaw.runtime.hierarchy.HierarchyPolicy;
import io.github.drompincen.taskclaw.runtime.retry.RetryExecutor;
import io.github.drompincen.taskclaw.runtime.retry.RetryPolicy;
import io.github.drompincen.taskclaw.runtime.retry.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TaskClawProperties.class)
public class TaskClawConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    ObjectMapper objectMapper() {
        return TaskClawJson.newObjectMapper();
    }

    @Bean
    StoreLayout storeLayout(TaskClawProperties props) {
        return new StoreLayout(Path.of(props.getDataDir()), props.getTodoFile(),
                props.getSessionsFile(), props.getLogFile());
    }

    @Bean
    FileLockService fileLockService() {
        return new FileLockService();
    }

    @Bean
    AuditLog auditLog(StoreLayout layout, FileLockService locks, ObjectMapper mapper,
                      Clock clock, TaskClawProperties props) {
        return new JsonLinesAuditLog(layout.logPath(), locks, props.getLockTimeout(), mapper, clock, props.getActor());
    }

    @Bean
    BackupService backupService(TaskClawProperties props, AuditLog auditLog) {
        return new NumberedBackupService(props.getBackup().getDirectoryName(),
                props.getBackup().getMaxBackups(), auditLog);
    }

    @Bean
    AtomicFileWriter atomicFileWriter(BackupService backupService) {
        return new AtomicFileWriter(backupService);
    }

    @Bean
    TaskStoreRepository taskStoreRepository(StoreLayout layout, ObjectMapper mapper, AtomicFileWriter writer,
                                            FileLockService locks, TaskClawProperties props, Clock clock) {
        return new TaskStoreRepository(layout.todoPath(), mapper, writer, locks, props.getLockTimeout(), clock);
    }

    @Bean
    SessionRegistryRepository sessionRegistryRepository(StoreLayout layout, ObjectMapper mapper,
                                                        AtomicFileWriter writer, FileLockService locks,
                                                        TaskClawProperties props, Clock clock) {
        return new SessionRegistryRepository(layout.sessionsPath(), mapper, writer, locks, props.getLockTimeout(), clock);
    }

    @Bean
    DocumentRestoreService documentRestoreService(BackupService backupService, AuditLog auditLog) {
        return new DocumentRestoreService(backupService, auditLog);
    }

    @Bean
    RetryExecutor retryExecutor(TaskClawProperties props, Clock clock) {
        TaskClawProperties.Retry retry = props.getRetry();
        RetryPolicy policy = new RetryPolicy(retry.getMaxAttempts(), retry.getInitialDelay(),
                retry.getMultiplier(), retry.getMaxElapsed());
        return new RetryExecutor(policy, Sleeper.THREAD, clock);
    }

    @Bean
    HierarchyPolicy hierarchyPolicy(TaskClawProperties props) {
        TaskClawProperties.Hierarchy h = props.getHierarchy();
        return new ConfigurableHierarchyPolicy(h.getMaxDepth(), h.getMaxSiblings(),
                h.isCountDoneInLimit(), h.getMaxActiveSiblings());
    }
}
