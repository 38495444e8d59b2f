package io.github.drompincen.taskclaw.cli.command;

import io.github.drompincen.taskclaw.persistence.repository.JsonDocumentRepository;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import io.github.drompincen.taskclaw.protocol.error.TaskClawException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
        name = "backup",
        description = "Inspect and restore numbered backups",
        subcommands = {BackupCommand.ListCommand.class, BackupCommand.RestoreCommand.class}
)
final class BackupCommand implements Callable<Integer> {

    @ParentCommand
    TaskClawCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(root.err());
        return ErrorCode.INVALID_ARGS.exitCode();
    }

    JsonDocumentRepository<?> documentNamed(String name) {
        return switch (name) {
            case "todo" -> root.taskStoreRepository;
            case "sessions" -> root.registryRepository;
            default -> throw new TaskClawException(ErrorCode.INVALID_ARGS, "Unknown document: " + name);
        };
    }

    @Command(name = "list", description = "List the backups of a document")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        BackupCommand backup;

        @Parameters(index = "0", paramLabel = "DOCUMENT", description = "todo|sessions")
        String document;

        @Override
        public Integer call() {
            return backup.root.print(backup.root.restoreService.list(backup.documentNamed(document)));
        }
    }

    @Command(name = "restore", description = "Restore a document from a backup, the newest by default")
    static final class RestoreCommand implements Callable<Integer> {
        @ParentCommand
        BackupCommand backup;

        @Parameters(index = "0", paramLabel = "DOCUMENT", description = "todo|sessions")
        String document;

        @Parameters(index = "1", arity = "0..1", paramLabel = "N", description = "Backup number")
        Integer number;

        @Override
        public Integer call() {
            return backup.root.print(backup.root.restoreService.restore(backup.documentNamed(document), number));
        }
    }
}
