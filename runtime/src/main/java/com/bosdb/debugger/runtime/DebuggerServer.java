package com.bosdb.debugger.runtime;

import com.bosdb.debugger.DebugEngine;
import com.bosdb.debugger.protocol.ProtocolServer;
import com.bosdb.debugger.protocol.netty.DebugWebSocketServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Standalone debugger server: HTTP API, WebSocket protocol and the session reaper
 * around one {@link DebugEngine}.
 */
public class DebuggerServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DebuggerServer.class);

    private final DebuggerSettings settings;
    private final JdbcRunnerFactory runnerFactory;
    private final DebugEngine engine;
    private final ProtocolServer protocolServer;
    private final DebugHttpServer httpServer;
    private final DebugWebSocketServer webSocketServer;
    private final ScheduledExecutorService reaper;

    public DebuggerServer(DebuggerSettings settings) {
        this.settings = settings;
        this.runnerFactory = new JdbcRunnerFactory(settings);
        this.engine = new DebugEngine(runnerFactory, settings.getMaxSessionsPerUser());
        this.protocolServer = new ProtocolServer(engine);
        this.httpServer = new DebugHttpServer(engine, settings.getHttpPort());
        this.webSocketServer = new DebugWebSocketServer(protocolServer, settings.getWsPort(), settings.getWsPath());
        this.reaper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-reaper");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() throws IOException, InterruptedException {
        httpServer.start();
        webSocketServer.start();

        Duration maxAge = settings.getMaxSessionAge();
        long interval = settings.getReapInterval().toMillis();
        reaper.scheduleAtFixedRate(() -> reap(maxAge), interval, interval, TimeUnit.MILLISECONDS);
        log.info("[DebuggerServer] Reaping stopped sessions older than {} every {}", maxAge, settings.getReapInterval());
    }

    void reap(Duration maxAge) {
        try {
            engine.cleanupInactiveSessions(maxAge);
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.error("[DebuggerServer] Session cleanup failed", e);
        }
    }

    public DebugEngine getEngine() {
        return engine;
    }

    @Override
    public void close() {
        reaper.shutdownNow();
        webSocketServer.stop();
        httpServer.stop();
        protocolServer.close();
        engine.close();
        runnerFactory.close();
    }

    // --- Main ---

    public static void main(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ((args[i].equals("-p") || args[i].equals("--port")) && i + 1 < args.length) {
                System.setProperty(DebuggerSettings.HTTP_PORT, args[++i]);
            } else if (args[i].equals("--ws-port") && i + 1 < args.length) {
                System.setProperty(DebuggerSettings.WS_PORT, args[++i]);
            }
        }

        DebuggerServer server;
        try {
            server = new DebuggerServer(DebuggerSettings.load());
            server.start();
        } catch (IOException | IllegalArgumentException e) {
            log.error("[DebuggerServer] Failed to start", e);
            System.exit(1);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "debugger-shutdown"));
        log.info("[DebuggerServer] Ready");
    }
}
