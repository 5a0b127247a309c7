package com.quickfs.relay;

import com.quickfs.relay.command.ServeCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point. Without a subcommand, prints usage.
 */
@CommandLine.Command(
        name = "quickfs-relay",
        description = "WebRTC signaling relay for QuickFS browser-to-browser file sharing",
        mixinStandardHelpOptions = true,
        version = "quickfs-relay 0.1.0",
        subcommands = ServeCommand.class
)
public class Main implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    /** Log a failed command once, without picocli's stack trace on stderr. */
    static int reportFailure(Exception e, CommandLine cmd, CommandLine.ParseResult parseResult) {
        log.error("{} failed: {}", cmd.getCommandName(), e.getMessage(), e);
        return cmd.getCommandSpec().exitCodeOnExecutionException();
    }

    static CommandLine commandLine() {
        return new CommandLine(new Main()).setExecutionExceptionHandler(Main::reportFailure);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
