package com.quickfs.relay.command;

import com.quickfs.relay.server.SignalServer;
import com.quickfs.relay.session.SessionRegistry;
import picocli.CommandLine;

import java.time.Duration;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "serve",
        description = "Run the signaling relay",
        mixinStandardHelpOptions = true
)
public class ServeCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"--bind", "-b"}, description = "Bind address (default: 0.0.0.0)", defaultValue = "0.0.0.0")
    private String bind;

    @CommandLine.Option(names = {"--port", "-p"}, description = "HTTP/WebSocket port (default: 3000)", defaultValue = "3000")
    private int port;

    @CommandLine.Option(names = {"--max-frame-size"}, description = "Largest accepted WebSocket message in bytes (default: 65536)", defaultValue = "65536")
    private int maxFrameSize;

    @CommandLine.Option(names = {"--send-timeout-ms"}, description = "Disconnect a peer that takes no data for this long (default: 5000)", defaultValue = "5000")
    private long sendTimeoutMs;

    @Override
    public Integer call() throws Exception {
        if (port < 0 || port > 65535) {
            System.err.println("Error: port out of range: " + port);
            return 2;
        }
        if (maxFrameSize <= 0) {
            System.err.println("Error: --max-frame-size must be positive");
            return 2;
        }
        if (sendTimeoutMs <= 0) {
            System.err.println("Error: --send-timeout-ms must be positive");
            return 2;
        }

        SignalServer server = new SignalServer(bind, port, maxFrameSize,
                Duration.ofMillis(sendTimeoutMs), new SessionRegistry());

        // Shut down cleanly on Ctrl+C
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            server.stop();
        }));

        server.start();
        server.awaitTermination();
        return 0;
    }
}
