package io.github.drompincen.taskclaw.persistence.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskclaw.persistence.document.SessionRegistryDocument;
import io.github.drompincen.taskclaw.persistence.file.AtomicFileWriter;
import io.github.drompincen.taskclaw.persistence.file.FileLockService;
import io.github.drompincen.taskclaw.persistence.validation.JsonSyntaxValidator;
import io.github.drompincen.taskclaw.persistence.validation.SessionRegistryValidator;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

public class SessionRegistryRepository extends JsonDocumentRepository<SessionRegistryDocument> {

    public SessionRegistryRepository(Path file, ObjectMapper mapper, AtomicFileWriter writer,
                                     FileLockService lockService, Duration lockTimeout, Clock clock) {
        super(file, SessionRegistryDocument.class, mapper, writer, lockService, lockTimeout,
                new JsonSyntaxValidator(mapper).and(new SessionRegistryValidator(mapper)), clock);
    }

    @Override
    protected SessionRegistryDocument newDocument(String project) {
        SessionRegistryDocument document = new SessionRegistryDocument();
        document.setProject(project);
        return document;
    }
}
