package com.astrophot.workflow;

import com.astrophot.model.AnchorMissingException;
import com.astrophot.model.ChannelMeasurement;
import com.astrophot.model.FailureKind;
import com.astrophot.model.FrameFailure;
import com.astrophot.model.FrameLoad;
import com.astrophot.model.PhotometryResult;
import com.astrophot.model.Position;
import com.astrophot.model.SessionReport;
import com.astrophot.model.SessionSettings;
import com.astrophot.model.SessionSnapshot;
import com.astrophot.model.TrackResult;
import com.astrophot.model.WorkflowMode;
import com.astrophot.service.AperturePhotometer;
import com.astrophot.service.CentroidTracker;
import com.astrophot.service.FrameSource;
import com.astrophot.service.ResultSink;
import com.astrophot.service.TrackingHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Sesión de seguimiento + fotometría sobre una secuencia de cuadros.
 * <p>
 * Modos:
 * <ul>
 *   <li>SEQUENTIAL_MANUAL: posición del cuadro 0 dada por el usuario, el resto rastreado
 *       (o pedido si el seguimiento automático está apagado); cada cuadro se mide al aceptarlo.</li>
 *   <li>PRE_SELECTING: igual pero sin fotometría; deja las posiciones listas para el lote.</li>
 *   <li>BATCH_AUTOMATIC: mide todas las posiciones guardadas, sin rastrear.</li>
 *   <li>PAUSED: permite navegar y corregir una posición; todo lo posterior se descarta.
 *       Si la pausa venía de un lote, al reanudar los cuadros posteriores se vuelven a rastrear
 *       desde la posición corregida en lugar de medir las posiciones descartadas.</li>
 * </ul>
 * Invariante: los índices de {@code results} son estrictamente crecientes y cada uno tiene
 * una posición no nula en {@code positions}. Al sobrescribir la posición k se descarta
 * todo lo que venga después de k.
 * <p>
 * No es thread-safe: todas las órdenes deben llegar desde un único hilo (ver {@link SessionWorker}).
 * Solo {@link #requestStop()}, {@link #requestPause()} y {@link #snapshot()} pueden llamarse
 * desde otros hilos. Las decisiones pendientes continúan en el {@code executor} de la sesión.
 */
public class WorkflowSession {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowSession.class);

    private final FrameSource source;
    private final SessionSettings settings;
    private final AperturePhotometer photometer;
    private final CentroidTracker tracker;
    private final Executor executor;
    private SessionListener listener = new SessionListener() {};

    private final List<Position> positions = new ArrayList<>();
    private final List<PhotometryResult> results = new ArrayList<>();
    private final List<FrameFailure> failures = new ArrayList<>();

    private volatile WorkflowMode mode = WorkflowMode.IDLE;
    private WorkflowMode pausedFromMode;
    private boolean reacquiring;
    private int currentFrameIndex;
    private int viewedFrameIndex;

    private volatile boolean stopRequested;
    private volatile boolean pauseRequested;
    private volatile PendingDecision pending;
    private FrameLoad pendingLoad;

    private volatile SessionSnapshot snapshot;

    public WorkflowSession(FrameSource source, SessionSettings settings) {
        this(source, settings, Runnable::run);
    }

    public WorkflowSession(FrameSource source, SessionSettings settings, Executor executor) {
        this(source, settings, new AperturePhotometer(),
                CentroidTracker.forPolicy(settings.selectionPolicy, new TrackingHistory(settings.historyCapacity)),
                executor);
    }

    public WorkflowSession(FrameSource source, SessionSettings settings, AperturePhotometer photometer,
                           CentroidTracker tracker, Executor executor) {
        this.source = source;
        this.settings = settings;
        this.photometer = photometer;
        this.tracker = tracker;
        this.executor = executor;
        publish();
    }

    public void setListener(SessionListener listener) {
        this.listener = listener != null ? listener : new SessionListener() {};
    }

    // --- Arranque ---

    public void startSequential(Position anchor) {
        startAcquisition(WorkflowMode.SEQUENTIAL_MANUAL, anchor);
    }

    public void startPreSelection(Position anchor) {
        startAcquisition(WorkflowMode.PRE_SELECTING, anchor);
    }

    /** Mide las posiciones guardadas a partir del cuadro siguiente al último resultado. */
    public void startBatch() {
        requireMode(WorkflowMode.IDLE);
        if (positions.isEmpty() || positions.get(0) == null) {
            anchorMissing(0, "No hay posición para el primer cuadro");
        }
        resetFlags();
        reacquiring = false;
        currentFrameIndex = results.isEmpty() ? 0 : results.get(results.size() - 1).frameIndex + 1;
        setMode(WorkflowMode.BATCH_AUTOMATIC);
        logger.info("Lote: cuadros {}..{} de {}", currentFrameIndex, positions.size() - 1, source.frameCount());
        runBatch();
    }

    /** Carga posiciones de una ejecución anterior (p. ej. desde archivo) para repetir la fotometría. */
    public void seedPositions(List<Position> seeded) {
        requireMode(WorkflowMode.IDLE);
        clearState();
        int n = Math.min(seeded.size(), source.frameCount());
        if (seeded.size() > n) {
            logger.warn("Se ignoran {} posiciones sin cuadro", seeded.size() - n);
        }
        positions.addAll(seeded.subList(0, n));
        publish();
    }

    private void startAcquisition(WorkflowMode target, Position anchor) {
        requireMode(WorkflowMode.IDLE);
        clearState();
        resetFlags();
        if (source.frameCount() == 0) anchorMissing(0, "La secuencia no tiene cuadros");

        FrameLoad load = source.load(0);
        if (!load.isLoaded()) anchorMissing(0, "Primer cuadro ilegible: " + load.failure);
        if (anchor == null) anchorMissing(0, "Sin posición inicial para el primer cuadro");

        setMode(target);
        accept(0, load, refine(load, anchor), target.measures());
        listener.onProgress(publish());
        runAcquisition();
    }

    // --- Control ---

    public void requestStop() {
        stopRequested = true;
        PendingDecision d = pending;
        if (d != null) d.stop();
    }

    public void requestPause() {
        if (!mode.isActive()) throw new IllegalStateException("No hay nada que pausar en modo " + mode);
        pauseRequested = true;
        PendingDecision d = pending;
        if (d != null) d.future().cancel(false);
    }

    public void resume() {
        requireMode(WorkflowMode.PAUSED);
        WorkflowMode target = pausedFromMode;
        pausedFromMode = null;
        resetFlags();
        setMode(target);
        logger.info("Reanudando {} en el cuadro {}", target, currentFrameIndex);
        continueRun();
    }

    /** Mueve solo el cursor de vista; no toca posiciones ni resultados. */
    public int navigate(int delta) {
        requireMode(WorkflowMode.PAUSED);
        int last = Math.max(0, source.frameCount() - 1);
        viewedFrameIndex = Math.max(0, Math.min(last, viewedFrameIndex + delta));
        publish();
        return viewedFrameIndex;
    }

    /**
     * Sustituye la posición del cuadro k. Descarta posiciones, resultados y fallos desde k,
     * limpia el historial del rastreador y, si el modo pausado mide, vuelve a medir k.
     * Solo se admite k hasta el cursor: más allá quedarían cuadros sin procesar en medio.
     */
    public void overwritePosition(int frameIndex, Position position) {
        requireMode(WorkflowMode.PAUSED);
        if (position == null) throw new IllegalArgumentException("Posición nula");
        int limit = Math.min(currentFrameIndex, positions.size());
        if (frameIndex < 0 || frameIndex >= source.frameCount() || frameIndex > limit) {
            throw new IllegalArgumentException("Cuadro fuera de rango: " + frameIndex
                    + " (cursor: " + limit + ")");
        }

        positions.subList(frameIndex, positions.size()).clear();
        results.removeIf(r -> r.frameIndex >= frameIndex);
        failures.removeIf(f -> f.frameIndex >= frameIndex);
        tracker.history().clear();
        if (pausedFromMode == WorkflowMode.BATCH_AUTOMATIC) reacquiring = true;
        logger.info("Posición del cuadro {} sobrescrita con {}; se descartan los cuadros posteriores",
                frameIndex, position);

        FrameLoad load = source.load(frameIndex);
        if (!load.isLoaded()) {
            if (frameIndex == 0) anchorMissing(0, "Primer cuadro ilegible: " + load.failure);
            recordFailure(frameIndex, FailureKind.FRAME_DECODE_FAILED, load.failure);
            positions.add(null);
            currentFrameIndex = frameIndex + 1;
        } else {
            accept(frameIndex, load, refine(load, position), pausedFromMode.measures());
        }
        viewedFrameIndex = frameIndex;
        listener.onProgress(publish());
    }

    /** Congela la sesión y entrega el informe al sink. */
    public SessionReport finish(ResultSink sink) throws IOException {
        if (mode == WorkflowMode.COMPLETED) throw new IllegalStateException("La sesión ya terminó");
        if (mode.isActive()) throw new IllegalStateException("Detén la sesión antes de terminar (" + mode + ")");
        SessionReport report = report();
        if (sink != null) sink.accept(report);
        setMode(WorkflowMode.COMPLETED);
        pausedFromMode = null;
        publish();
        logger.info("Sesión terminada: {} resultados, {} fallos", results.size(), failures.size());
        listener.onCompleted(report);
        return report;
    }

    // --- Decisiones ---

    public Optional<PendingDecision> pendingDecision() {
        return Optional.ofNullable(pending);
    }

    public void supplyPosition(Position p) {
        requirePending().supplyPosition(p);
    }

    public void skip() {
        requirePending().skip();
    }

    public void stop() {
        requirePending().stop();
    }

    private PendingDecision requirePending() {
        PendingDecision d = pending;
        if (d == null) throw new IllegalStateException("No hay decisión pendiente");
        return d;
    }

    private void await(int frameIndex, FrameLoad load, PendingDecision.Reason reason, Position lastKnown) {
        PendingDecision d = new PendingDecision(frameIndex, source.frameName(frameIndex), reason, lastKnown);
        pending = d;
        pendingLoad = load;
        publish();
        logger.info("Esperando decisión: {}", d);
        d.future().whenCompleteAsync((decision, error) -> {
            try {
                onDecision(d, decision, error);
            } catch (RuntimeException ex) {
                logger.error("Error procesando la decisión del cuadro {}", frameIndex, ex);
                endRun();
            }
        }, executor);
        listener.onDecisionRequired(d);
    }

    private void onDecision(PendingDecision d, Decision decision, Throwable error) {
        if (pending != d) return;
        pending = null;
        FrameLoad load = pendingLoad;
        pendingLoad = null;

        if (error != null) {
            // cancelada por requestPause()
            if (pauseRequested) enterPause();
            else endRun();
            return;
        }

        int i = d.frameIndex();
        switch (decision.kind) {
            case POSITION:
                accept(i, load, refine(load, decision.position), mode.measures());
                listener.onProgress(publish());
                continueRun();
                break;
            case SKIP:
                logger.info("Cuadro {} saltado", i);
                positions.add(null);
                currentFrameIndex = i + 1;
                listener.onProgress(publish());
                continueRun();
                break;
            case STOP:
                stopRequested = false;
                logger.info("Detenido por el usuario en el cuadro {}", i);
                endRun();
                break;
        }
    }

    // --- Bucles ---

    private void continueRun() {
        if (mode == WorkflowMode.BATCH_AUTOMATIC && !reacquiring) runBatch();
        else runAcquisition();
    }

    private void runAcquisition() {
        while (currentFrameIndex < source.frameCount()) {
            if (atBoundaryShouldYield()) return;
            int i = currentFrameIndex;

            FrameLoad load = source.load(i);
            if (!load.isLoaded()) {
                recordFailure(i, FailureKind.FRAME_DECODE_FAILED, load.failure);
                positions.add(null);
                currentFrameIndex = i + 1;
                listener.onProgress(publish());
                continue;
            }

            Position last = previousPosition(i);
            if (!settings.autoTracking) {
                await(i, load, PendingDecision.Reason.POSITION_REQUIRED, last);
                return;
            }

            TrackResult track = tracker.locate(load.plane, last, settings.searchRadius);
            if (!track.isFound()) {
                recordFailure(i, FailureKind.TRACKING_LOST,
                        "Estrella perdida cerca de " + last + " (conf " + track.confidence + ")");
                await(i, load, PendingDecision.Reason.TRACKING_LOST, last);
                return;
            }
            logger.debug("Cuadro {}: {}", i, track);
            accept(i, load, track.position, mode.measures());
            listener.onProgress(publish());
        }
        logger.info("{} completado: {} posiciones, {} resultados", mode, countPositions(), results.size());
        endRun();
    }

    private void runBatch() {
        int end = positions.size();
        while (currentFrameIndex < end) {
            if (atBoundaryShouldYield()) return;
            int i = currentFrameIndex;
            Position p = positions.get(i);
            if (p == null) {
                currentFrameIndex = i + 1;
                continue;
            }

            FrameLoad load = source.load(i);
            if (!load.isLoaded()) {
                if (i == 0) anchorMissing(0, "Primer cuadro ilegible: " + load.failure);
                recordFailure(i, FailureKind.FRAME_DECODE_FAILED, load.failure);
                positions.set(i, null);
                currentFrameIndex = i + 1;
                listener.onProgress(publish());
                continue;
            }
            measure(i, load, p);
            currentFrameIndex = i + 1;
            listener.onProgress(publish());
        }
        logger.info("Lote completado: {} resultados", results.size());
        endRun();
    }

    private boolean atBoundaryShouldYield() {
        if (stopRequested) {
            stopRequested = false;
            logger.info("Detenido en el cuadro {}", currentFrameIndex);
            endRun();
            return true;
        }
        if (pauseRequested) {
            enterPause();
            return true;
        }
        return false;
    }

    private void enterPause() {
        pauseRequested = false;
        pausedFromMode = mode;
        setMode(WorkflowMode.PAUSED);
        viewedFrameIndex = Math.max(0, Math.min(currentFrameIndex, source.frameCount() - 1));
        listener.onRunEnded(publish());
    }

    private void endRun() {
        pausedFromMode = null;
        reacquiring = false;
        setMode(WorkflowMode.IDLE);
        listener.onRunEnded(publish());
    }

    // --- Cuadros ---

    private void accept(int i, FrameLoad load, Position p, boolean measure) {
        if (positions.size() == i) positions.add(p);
        else positions.set(i, p);
        if (measure) measure(i, load, p);
        currentFrameIndex = i + 1;
        viewedFrameIndex = i;
    }

    private void measure(int i, FrameLoad load, Position p) {
        Position prev = previousPosition(i);
        double movement = prev == null ? 0.0 : p.distanceTo(prev);
        List<ChannelMeasurement> channels = photometer.measure(load.plane, p, settings.aperture);
        results.add(new PhotometryResult(i, source.frameName(i), settings.starName, p, movement,
                load.plane.isRgb(), channels, settings.aperture, load.metadata));
        logger.debug("Cuadro {} medido en {} (mov {} px)", i, p, String.format("%.2f", movement));
    }

    /** Las posiciones dadas por el usuario se refinan con el rastreador; si falla, se respeta el clic. */
    private Position refine(FrameLoad load, Position p) {
        if (!settings.autoTracking) return p;
        TrackResult r = tracker.locate(load.plane, p, settings.searchRadius);
        if (r.isFound()) {
            logger.debug("Posición {} refinada a {} [{}]", p, r.position, r.method);
            return r.position;
        }
        return p;
    }

    private Position previousPosition(int i) {
        for (int j = Math.min(i, positions.size()) - 1; j >= 0; j--) {
            if (positions.get(j) != null) return positions.get(j);
        }
        return null;
    }

    private void recordFailure(int i, FailureKind kind, String message) {
        FrameFailure f = new FrameFailure(i, kind, message);
        failures.add(f);
        logger.warn("Cuadro {} ({}): {} - {}", i, source.frameName(i), kind, message);
        listener.onFrameFailed(f);
    }

    private void anchorMissing(int i, String message) {
        failures.add(new FrameFailure(i, FailureKind.ANCHOR_MISSING, message));
        pausedFromMode = null;
        reacquiring = false;
        setMode(WorkflowMode.IDLE);
        publish();
        logger.error("Sin ancla: {}", message);
        throw new AnchorMissingException(i, message);
    }

    // --- Estado ---

    private void clearState() {
        positions.clear();
        results.clear();
        failures.clear();
        tracker.history().clear();
        reacquiring = false;
        currentFrameIndex = 0;
        viewedFrameIndex = 0;
    }

    private void resetFlags() {
        stopRequested = false;
        pauseRequested = false;
    }

    private void setMode(WorkflowMode next) {
        if (mode != next) logger.info("Modo: {} -> {}", mode, next);
        mode = next;
    }

    private void requireMode(WorkflowMode expected) {
        if (mode != expected) {
            throw new IllegalStateException("Operación válida solo en " + expected + " (modo actual: " + mode + ")");
        }
    }

    private long countPositions() {
        return positions.stream().filter(p -> p != null).count();
    }

    private SessionSnapshot publish() {
        snapshot = new SessionSnapshot(mode, pausedFromMode, currentFrameIndex, viewedFrameIndex,
                source.frameCount(), positions, results, failures, pending != null);
        return snapshot;
    }

    public SessionSnapshot snapshot() {
        return snapshot;
    }

    public SessionReport report() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < source.frameCount(); i++) names.add(source.frameName(i));
        return new SessionReport(settings, names, positions, results, failures);
    }

    public SessionSettings settings() {
        return settings;
    }

    public WorkflowMode mode() {
        return mode;
    }
}
