package io.github.drompincen.taskclaw.cli.command;

import io.github.drompincen.taskclaw.protocol.api.ScopeDeclaration;
import io.github.drompincen.taskclaw.protocol.api.ScopeType;
import io.github.drompincen.taskclaw.protocol.api.SessionFilter;
import io.github.drompincen.taskclaw.protocol.api.SessionHistoryDto;
import io.github.drompincen.taskclaw.protocol.api.StartSessionRequest;
import io.github.drompincen.taskclaw.protocol.api.StartSessionResult;
import io.github.drompincen.taskclaw.protocol.error.ErrorCode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * {@code taskclaw session ...}. Commands that take an optional session id fall back to
 * the caller's current session.
 */
@Command(
        name = "session",
        description = "Start, pause and finish scoped work sessions",
        subcommands = {
                SessionCommand.StartCommand.class,
                SessionCommand.SuspendCommand.class,
                SessionCommand.ResumeCommand.class,
                SessionCommand.EndCommand.class,
                SessionCommand.FocusCommand.class,
                SessionCommand.NoteCommand.class,
                SessionCommand.CompleteCommand.class,
                SessionCommand.ListCommand.class,
                SessionCommand.ShowCommand.class,
                SessionCommand.HistoryCommand.class
        }
)
final class SessionCommand implements Callable<Integer> {

    @ParentCommand
    TaskClawCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(root.err());
        return ErrorCode.INVALID_ARGS.exitCode();
    }

    String resolve(String explicitId) {
        return root.currentSession.resolve(explicitId);
    }

    private static List<String> trimmed(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            String v = value.trim();
            if (!v.isEmpty()) {
                result.add(v);
            }
        }
        return result;
    }

    @Command(name = "start", description = "Claim a scope of tasks and focus on one of them")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Option(names = "--scope", required = true, description = "task|taskGroup|subtree|epicPhase|epic|custom")
        ScopeType scope;

        @Option(names = "--root", description = "Root task of the scope")
        String rootTaskId;

        @Option(names = "--phase", description = "Phase for epicPhase scopes")
        String phase;

        @Option(names = "--depth", description = "Maximum depth below the root")
        Integer depth;

        @Option(names = "--exclude", split = ",", description = "Task ids left out of the scope")
        List<String> exclude = new ArrayList<>();

        @Option(names = "--ids", split = ",", description = "Task ids of a custom scope")
        List<String> ids = new ArrayList<>();

        @Option(names = "--focus", description = "Task to focus; inferred when omitted")
        String focus;

        @Option(names = "--name", description = "Session name")
        String name;

        @Option(names = "--agent", description = "Agent id")
        String agent;

        @Override
        public Integer call() {
            ScopeDeclaration declaration = new ScopeDeclaration(scope, rootTaskId, phase, depth,
                    trimmed(exclude), trimmed(ids));
            StartSessionResult result = session.root.sessions.start(
                    new StartSessionRequest(declaration, focus, name, agent));
            session.root.currentSession.remember(result.sessionId());
            result.warnings().forEach(session.root::warn);
            return session.root.print(result);
        }
    }

    @Command(name = "suspend", description = "Pause a session, keeping its claim")
    static final class SuspendCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Parameters(arity = "0..1", paramLabel = "ID", description = "Session id")
        String sessionId;

        @Option(names = "--note", description = "Where the work stands")
        String note;

        @Override
        public Integer call() {
            return session.root.print(session.root.sessions.suspend(session.resolve(sessionId), note));
        }
    }

    @Command(name = "resume", description = "Reactivate a suspended session")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Parameters(arity = "0..1", paramLabel = "ID", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            return session.root.print(session.root.sessions.resume(session.resolve(sessionId)));
        }
    }

    @Command(name = "end", description = "Finish a session and archive it")
    static final class EndCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Parameters(arity = "0..1", paramLabel = "ID", description = "Session id")
        String sessionId;

        @Option(names = "--note", description = "Closing note")
        String note;

        @Override
        public Integer call() {
            String id = session.resolve(sessionId);
            SessionHistoryDto ended = session.root.sessions.end(id, note);
            session.root.currentSession.forget(id);
            return session.root.print(ended);
        }
    }

    @Command(name = "focus", description = "Move the session's focus to another task in scope")
    static final class FocusCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Parameters(arity = "1..2", paramLabel = "[ID] TASK", description = "Optional session id, then the task id")
        List<String> words;

        @Override
        public Integer call() {
            String id = session.resolve(words.size() == 2 ? words.get(0) : null);
            return session.root.print(session.root.sessions.focus(id, words.get(words.size() - 1)));
        }
    }

    @Command(name = "complete", description = "Mark a task in scope as done")
    static final class CompleteCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Parameters(arity = "1..2", paramLabel = "[ID] TASK", description = "Optional session id, then the task id")
        List<String> words;

        @Override
        public Integer call() {
            String id = session.resolve(words.size() == 2 ? words.get(0) : null);
            return session.root.print(session.root.sessions.complete(id, words.get(words.size() - 1)));
        }
    }

    @Command(name = "note", description = "Record a note on a session")
    static final class NoteCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Parameters(arity = "1..*", paramLabel = "[ID] TEXT", description = "Optional session id, then the note")
        List<String> words;

        @Option(names = "--next", description = "Next action")
        String nextAction;

        @Override
        public Integer call() {
            // a leading word is a session id only when it looks like one
            boolean withId = words.size() >= 2 && words.get(0).startsWith("session_");
            String id = session.resolve(withId ? words.get(0) : null);
            String text = String.join(" ", withId ? words.subList(1, words.size()) : words);
            return session.root.print(session.root.sessions.note(id, text, nextAction));
        }
    }

    @Command(name = "list", description = "List live sessions")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Parameters(arity = "0..1", defaultValue = "all", paramLabel = "FILTER", description = "active|suspended|all")
        SessionFilter filter;

        @Override
        public Integer call() {
            return session.root.print(session.root.sessions.list(filter));
        }
    }

    @Command(name = "show", description = "Print one live session")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Parameters(arity = "0..1", paramLabel = "ID", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            return session.root.print(session.root.sessions.get(session.resolve(sessionId)));
        }
    }

    @Command(name = "history", description = "Print ended sessions")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        SessionCommand session;

        @Override
        public Integer call() {
            return session.root.print(session.root.sessions.history());
        }
    }
}
