package com.astrophot.workflow;

import com.astrophot.model.Position;
import com.astrophot.model.SessionReport;
import com.astrophot.model.SessionSettings;
import com.astrophot.model.SessionSnapshot;
import com.astrophot.service.FrameSource;
import com.astrophot.service.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Ejecuta una {@link WorkflowSession} en un hilo propio para que la UI no se bloquee.
 * Todas las órdenes se encolan en ese hilo; el progreso llega por el {@link SessionListener}.
 */
public class SessionWorker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SessionWorker.class);

    private final ExecutorService exec;
    private final WorkflowSession session;

    public SessionWorker(FrameSource source, SessionSettings settings, SessionListener listener) {
        this.exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "astrophot-session");
            t.setDaemon(true);
            return t;
        });
        this.session = new WorkflowSession(source, settings, exec);
        this.session.setListener(listener);
    }

    public CompletableFuture<Void> startSequential(Position anchor) {
        return submit(s -> s.startSequential(anchor));
    }

    public CompletableFuture<Void> startPreSelection(Position anchor) {
        return submit(s -> s.startPreSelection(anchor));
    }

    public CompletableFuture<Void> startBatch() {
        return submit(WorkflowSession::startBatch);
    }

    public CompletableFuture<Void> seedPositions(List<Position> positions) {
        return submit(s -> s.seedPositions(positions));
    }

    public CompletableFuture<Void> resume() {
        return submit(WorkflowSession::resume);
    }

    public CompletableFuture<Void> navigate(int delta) {
        return submit(s -> s.navigate(delta));
    }

    public CompletableFuture<Void> overwritePosition(int frameIndex, Position position) {
        return submit(s -> s.overwritePosition(frameIndex, position));
    }

    public CompletableFuture<SessionReport> finish(ResultSink sink) {
        CompletableFuture<SessionReport> result = new CompletableFuture<>();
        exec.execute(() -> {
            try {
                result.complete(session.finish(sink));
            } catch (Exception e) {
                logger.error("No se pudo cerrar la sesión", e);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /** Seguro desde cualquier hilo. */
    public void requestStop() {
        session.requestStop();
    }

    /** Seguro desde cualquier hilo. */
    public void requestPause() {
        session.requestPause();
    }

    public SessionSnapshot snapshot() {
        return session.snapshot();
    }

    public Optional<PendingDecision> pendingDecision() {
        return session.pendingDecision();
    }

    private CompletableFuture<Void> submit(Consumer<WorkflowSession> command) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        exec.execute(() -> {
            try {
                command.accept(session);
                result.complete(null);
            } catch (RuntimeException e) {
                logger.error("Orden rechazada por la sesión: {}", e.getMessage());
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    @Override
    public void close() {
        session.requestStop();
        exec.shutdownNow();
    }
}
