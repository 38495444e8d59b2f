package io.github.drompincen.taskclaw.persistence.file;

public enum WritePhase {
    STAGE, VALIDATE, BACKUP, REPLACE
}
