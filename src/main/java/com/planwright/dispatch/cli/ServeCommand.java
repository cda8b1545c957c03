package com.planwright.dispatch.cli;

import com.planwright.dispatch.ipc.IpcServer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: planwright serve
 * <p>
 * Starts Planwright as a long-running server exposing the REST API, SSE event
 * streaming and the IPC control port. The web server is enabled by
 * {@link com.planwright.PlanwrightApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The IPC listener is started once
 * Tomcat is ready.
 * <p>
 * Configure the HTTP port via {@code SERVER_PORT=9090 planwright serve}.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Planwright HTTP server and control port")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final IpcServer ipcServer;

    public ServeCommand(IpcServer ipcServer) {
        this.ipcServer = ipcServer;
    }

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port, null);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        var ipcAddress = ipcServer.start().map(a -> a.getHostString() + ":" + a.getPort()).orElse(null);
        printBanner(event.getWebServer().getPort(), ipcAddress);
    }

    private static void printBanner(int port, String ipcAddress) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Planwright server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1/plans");
        if (ipcAddress != null) {
            System.out.println("  Control:  " + ipcAddress + " (NDJSON)");
        }
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
