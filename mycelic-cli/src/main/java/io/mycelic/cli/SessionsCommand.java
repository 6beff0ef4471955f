package io.mycelic.cli;

import io.mycelic.core.MemoryEngine;
import java.util.Map;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "sessions", description = "Sessions with their memory counts, or manage one with a subcommand")
public final class SessionsCommand extends EngineCommand {

    public SessionsCommand(CliContext context) {
        super(context);
    }

    static CommandLine commandLine(CliContext context) {
        return new CommandLine(new SessionsCommand(context))
            .addSubcommand("show", new Show(context))
            .addSubcommand("deactivate", new Deactivate(context));
    }

    @Override
    protected String label() {
        return "Sessions";
    }

    @Override
    protected Object run(MemoryEngine engine) {
        return engine.sessions().stats();
    }

    @Command(name = "show", description = "Show one session")
    static final class Show extends EngineCommand {
        @Parameters(index = "0")
        String sessionId;

        Show(CliContext context) {
            super(context);
        }

        @Override
        protected String label() {
            return "Show session";
        }

        @Override
        protected Object run(MemoryEngine engine) {
            return engine.sessions().get(sessionId);
        }
    }

    @Command(name = "deactivate", description = "Mark a session inactive; its memories stay")
    static final class Deactivate extends EngineCommand {
        @Parameters(index = "0")
        String sessionId;

        Deactivate(CliContext context) {
            super(context);
        }

        @Override
        protected String label() {
            return "Deactivate session";
        }

        @Override
        protected Object run(MemoryEngine engine) {
            engine.sessions().deactivate(sessionId);
            return Map.of("deactivated", sessionId);
        }
    }
}
