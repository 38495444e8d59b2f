package io.github.drompincen.taskclaw.persistence.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskclaw.persistence.document.TaskStoreDocument;
import io.github.drompincen.taskclaw.persistence.file.AtomicFileWriter;
import io.github.drompincen.taskclaw.persistence.file.FileLockService;
import io.github.drompincen.taskclaw.persistence.validation.JsonSyntaxValidator;
import io.github.drompincen.taskclaw.persistence.validation.TaskStoreValidator;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

public class TaskStoreRepository extends JsonDocumentRepository<TaskStoreDocument> {

    public TaskStoreRepository(Path file, ObjectMapper mapper, AtomicFileWriter writer,
                               FileLockService lockService, Duration lockTimeout, Clock clock) {
        super(file, TaskStoreDocument.class, mapper, writer, lockService, lockTimeout,
                new JsonSyntaxValidator(mapper).and(new TaskStoreValidator(mapper)), clock);
    }

    @Override
    protected TaskStoreDocument newDocument(String project) {
        TaskStoreDocument document = new TaskStoreDocument();
        document.setProject(project);
        document.getMeta().setMultiSessionEnabled(true);
        return document;
    }
}
