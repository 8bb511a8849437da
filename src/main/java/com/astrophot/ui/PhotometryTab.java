package com.astrophot.ui;

import com.astrophot.model.AppConfig;
import com.astrophot.model.ApertureParams;
import com.astrophot.model.FrameFailure;
import com.astrophot.model.FrameLoad;
import com.astrophot.model.PhotometryResult;
import com.astrophot.model.PixelPlane;
import com.astrophot.model.Position;
import com.astrophot.model.SelectionPolicy;
import com.astrophot.model.SessionReport;
import com.astrophot.model.SessionSettings;
import com.astrophot.model.SessionSnapshot;
import com.astrophot.model.WorkflowMode;
import com.astrophot.service.CsvResultSink;
import com.astrophot.service.FitsFrameSource;
import com.astrophot.service.PositionFileService;
import com.astrophot.service.SigmaClippedStats;
import com.astrophot.workflow.PendingDecision;
import com.astrophot.workflow.SessionListener;
import com.astrophot.workflow.SessionWorker;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Group;
import javafx.scene.control.*;
import javafx.scene.image.ImageView;
import javafx.scene.image.PixelWriter;
import javafx.scene.image.WritableImage;
import javafx.scene.input.MouseEvent;
import javafx.scene.layout.*;
import javafx.scene.paint.Color;
import javafx.scene.shape.Circle;
import javafx.stage.DirectoryChooser;
import javafx.stage.FileChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pestaña principal: elegir carpeta, marcar la estrella en el primer cuadro y seguirla.
 * Los clics sobre la imagen sirven de ancla inicial, de respuesta a una estrella perdida
 * o de corrección durante la pausa.
 */
public class PhotometryTab {

    private static final Logger logger = LoggerFactory.getLogger(PhotometryTab.class);

    private final PositionFileService positionService = new PositionFileService();

    private FitsFrameSource source;
    private SessionWorker worker;
    private Position anchor;
    private int shownFrame = -1;
    private PixelPlane shownPlane;

    // UI Controls
    private TextField txtInput, txtStarName;
    private TextField txtInnerRadius, txtInnerAnnulus, txtOuterAnnulus, txtSearchRadius;
    private CheckBox chkAutoTracking;
    private Button btnSequential, btnPreSelect, btnBatch, btnPause, btnResume, btnPrev, btnNext, btnStop;
    private Button btnSaveCsv, btnSavePositions, btnLoadPositions;
    private ImageView imageView;
    private Group overlay;
    private Label lblFrame;
    private TextArea logArea;
    private ProgressBar progressBar;

    public Tab create() {
        Tab tab = new Tab("✨ Fotometría");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(15));

        VBox topContainer = new VBox(10);

        HBox folderBox = new HBox(10);
        folderBox.setAlignment(Pos.CENTER_LEFT);
        txtInput = new TextField(AppConfig.getLastFolder());
        txtInput.setPromptText("Carpeta de imágenes...");
        txtInput.setPrefWidth(350);
        Button btnBrowse = new Button("📂 Seleccionar");
        btnBrowse.setOnAction(e -> browseDir());
        folderBox.getChildren().addAll(new Label("Carpeta FITS:"), txtInput, btnBrowse);

        GridPane params = new GridPane();
        params.setHgap(10); params.setVgap(8);
        params.setStyle("-fx-border-color: #DDD; -fx-padding: 10; -fx-background-radius: 5; -fx-border-radius: 5;");
        txtStarName = new TextField(AppConfig.getStarName()); txtStarName.setPrefWidth(120);
        txtStarName.setPromptText("Nombre estrella");
        txtInnerRadius = new TextField(SettingsTab.fmt(AppConfig.getInnerRadius())); txtInnerRadius.setPrefWidth(50);
        txtInnerAnnulus = new TextField(SettingsTab.fmt(AppConfig.getInnerAnnulus())); txtInnerAnnulus.setPrefWidth(50);
        txtOuterAnnulus = new TextField(SettingsTab.fmt(AppConfig.getOuterAnnulus())); txtOuterAnnulus.setPrefWidth(50);
        txtSearchRadius = new TextField(SettingsTab.fmt(AppConfig.getSearchRadius())); txtSearchRadius.setPrefWidth(50);
        chkAutoTracking = new CheckBox("Seguimiento automático");
        chkAutoTracking.setSelected(AppConfig.isAutoTracking());

        params.add(new Label("⭐ Estrella:"), 0, 0); params.add(txtStarName, 1, 0);
        params.add(new Label("Apertura:"), 2, 0); params.add(txtInnerRadius, 3, 0);
        params.add(new Label("Anillo:"), 4, 0); params.add(new HBox(5, txtInnerAnnulus, txtOuterAnnulus), 5, 0);
        params.add(new Label("Búsqueda:"), 6, 0); params.add(txtSearchRadius, 7, 0);
        params.add(chkAutoTracking, 0, 1, 3, 1);

        btnSequential = new Button("▶ Secuencial");
        btnSequential.setOnAction(e -> startAcquisition(false));
        btnPreSelect = new Button("📍 Preselección");
        btnPreSelect.setOnAction(e -> startAcquisition(true));
        btnBatch = new Button("🚀 Lote");
        btnBatch.setOnAction(e -> startBatch());
        btnPause = new Button("⏸ Pausa");
        btnPause.setOnAction(e -> { if (worker != null) worker.requestPause(); });
        btnResume = new Button("⏯ Reanudar");
        btnResume.setOnAction(e -> { if (worker != null) worker.resume(); });
        btnPrev = new Button("◀");
        btnPrev.setOnAction(e -> navigate(-1));
        btnNext = new Button("▶");
        btnNext.setOnAction(e -> navigate(+1));
        btnStop = new Button("🛑 Detener");
        btnStop.setStyle("-fx-base: #F44336; -fx-text-fill: white; -fx-font-weight: bold;");
        btnStop.setOnAction(e -> { if (worker != null) worker.requestStop(); });

        HBox modeBox = new HBox(10, btnSequential, btnPreSelect, btnBatch, new Separator(),
                btnPause, btnResume, btnPrev, btnNext, btnStop);
        modeBox.setAlignment(Pos.CENTER_LEFT);

        topContainer.getChildren().addAll(folderBox, params, modeBox);

        // --- IMAGEN ---
        imageView = new ImageView();
        imageView.setPreserveRatio(true);
        imageView.setFitWidth(640);
        overlay = new Group();
        Pane imagePane = new Pane(imageView, overlay);
        imagePane.setOnMouseClicked(this::onImageClicked);
        lblFrame = new Label("Sin imagen");
        VBox imageBox = new VBox(5, lblFrame, new ScrollPane(imagePane));

        logArea = new TextArea();
        logArea.setEditable(false);
        logArea.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        SplitPane splitPane = new SplitPane();
        splitPane.getItems().addAll(imageBox, logArea);
        splitPane.setDividerPositions(0.65);

        btnSaveCsv = new Button("💾 Guardar CSV");
        btnSaveCsv.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold;");
        btnSaveCsv.setOnAction(e -> saveCsv(root));
        btnSavePositions = new Button("💾 Guardar posiciones");
        btnSavePositions.setOnAction(e -> savePositions(root));
        btnLoadPositions = new Button("📂 Cargar posiciones");
        btnLoadPositions.setOnAction(e -> loadPositions(root));
        progressBar = new ProgressBar(0);
        progressBar.setMaxWidth(Double.MAX_VALUE);

        root.setTop(topContainer);
        root.setCenter(splitPane);
        root.setBottom(new VBox(5, new HBox(10, btnSaveCsv, btnSavePositions, btnLoadPositions), progressBar));

        updateButtons(null);
        tab.setContent(root);
        return tab;
    }

    // --- Carpeta y cuadros ---

    private void browseDir() {
        DirectoryChooser dc = new DirectoryChooser();
        File f = dc.showDialog(txtInput.getScene().getWindow());
        if (f != null) {
            txtInput.setText(f.getAbsolutePath());
            openFolder();
        }
    }

    private boolean openFolder() {
        String path = txtInput.getText().trim();
        if (path.isEmpty()) { log("⚠️ Selecciona carpeta."); return false; }
        File dir = new File(path);
        if (!dir.isDirectory()) { log("❌ No existe la carpeta: " + path); return false; }

        closeWorker();
        source = FitsFrameSource.fromDirectory(dir);
        anchor = null;
        AppConfig.setLastFolder(path);
        log("📂 " + source.frameCount() + " cuadros FITS.");
        if (source.frameCount() > 0) showFrame(0);
        return source.frameCount() > 0;
    }

    private void showFrame(int index) {
        if (source == null || index < 0 || index >= source.frameCount()) return;
        FrameLoad load = source.load(index);
        shownFrame = index;
        lblFrame.setText("Cuadro " + (index + 1) + "/" + source.frameCount() + ": " + source.frameName(index));
        if (!load.isLoaded()) {
            shownPlane = null;
            imageView.setImage(null);
            log("❌ " + source.frameName(index) + ": " + load.failure);
            return;
        }
        shownPlane = load.plane;
        imageView.setImage(render(load.plane.tracking()));
        drawOverlay();
    }

    // Estirado lineal entre mediana-2σ y mediana+10σ
    static WritableImage render(double[][] data) {
        int h = data.length, w = data[0].length;
        SigmaClippedStats st = SigmaClippedStats.of(data);
        double lo = st.median - 2 * st.std;
        double hi = st.median + 10 * st.std;
        double span = hi > lo ? hi - lo : 1.0;

        WritableImage img = new WritableImage(w, h);
        PixelWriter pw = img.getPixelWriter();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = (data[y][x] - lo) / span;
                v = Double.isFinite(v) ? Math.max(0, Math.min(1, v)) : 0;
                pw.setColor(x, y, Color.gray(v));
            }
        }
        return img;
    }

    private double scale() {
        if (shownPlane == null) return 1.0;
        return imageView.getBoundsInLocal().getWidth() / shownPlane.width();
    }

    private void drawOverlay() {
        overlay.getChildren().clear();
        Position p = positionForShownFrame();
        if (p == null || shownPlane == null) return;

        double s = scale();
        ApertureParams ap;
        try {
            ap = readAperture();
        } catch (RuntimeException ex) {
            return;
        }
        double cx = p.x * s, cy = p.y * s;
        overlay.getChildren().add(ring(cx, cy, ap.innerRadius * s, Color.LIME));
        if (ap.isSkySubtractionEnabled()) {
            overlay.getChildren().add(ring(cx, cy, ap.innerAnnulus * s, Color.ORANGE));
            overlay.getChildren().add(ring(cx, cy, ap.outerAnnulus * s, Color.ORANGE));
        }
    }

    private static Circle ring(double cx, double cy, double r, Color color) {
        Circle c = new Circle(cx, cy, r);
        c.setFill(Color.TRANSPARENT);
        c.setStroke(color);
        c.setMouseTransparent(true);
        return c;
    }

    private Position positionForShownFrame() {
        if (worker == null) return shownFrame == 0 ? anchor : null;
        return worker.snapshot().positionAt(shownFrame).orElse(shownFrame == 0 ? anchor : null);
    }

    private void onImageClicked(MouseEvent e) {
        if (shownPlane == null) return;
        double s = scale();
        Position p = new Position(e.getX() / s, e.getY() / s);

        if (worker != null) {
            Optional<PendingDecision> pending = worker.pendingDecision();
            if (pending.isPresent()) {
                log("🖱️ Posición manual " + p + " para el cuadro " + (pending.get().frameIndex() + 1));
                pending.get().supplyPosition(p);
                return;
            }
            if (worker.snapshot().mode == WorkflowMode.PAUSED) {
                log("✏️ Corrigiendo cuadro " + (shownFrame + 1) + " → " + p + " (se descartan los siguientes)");
                worker.overwritePosition(shownFrame, p).whenComplete((ok, err) -> Platform.runLater(() -> {
                    if (err != null) log("⚠️ Corrección rechazada: " + err.getMessage());
                    drawOverlay();
                }));
                return;
            }
            if (worker.snapshot().mode.isActive()) return;
        }
        if (shownFrame == 0) {
            anchor = p;
            log("📍 Ancla en " + p);
            drawOverlay();
        }
    }

    private void navigate(int delta) {
        if (worker == null) return;
        worker.navigate(delta).thenRun(() -> Platform.runLater(() -> showFrame(worker.snapshot().viewedFrameIndex)));
    }

    // --- Sesión ---

    private SessionSettings readSettings() {
        String star = txtStarName.getText();
        SessionSettings base = new SessionSettings(star, readAperture(), SettingsTab.parse(txtSearchRadius),
                chkAutoTracking.isSelected(), AppConfig.getHistorySize(),
                AppConfig.isConsensusTracking() ? SelectionPolicy.CONSENSUS : SelectionPolicy.FIRST_ACCEPTED);
        AppConfig.setStarName(base.starName);
        return base;
    }

    private ApertureParams readAperture() {
        return new ApertureParams(SettingsTab.parse(txtInnerRadius), SettingsTab.parse(txtInnerAnnulus),
                SettingsTab.parse(txtOuterAnnulus));
    }

    private boolean newWorker() {
        if (source == null && !openFolder()) return false;
        SessionSettings settings;
        try {
            settings = readSettings();
        } catch (IllegalArgumentException ex) {
            log("⚠️ " + ex.getMessage());
            return false;
        }
        closeWorker();
        worker = new SessionWorker(source, settings, new UiListener());
        return true;
    }

    private void startAcquisition(boolean preSelect) {
        if (source == null && !openFolder()) return;
        if (anchor == null) {
            showFrame(0);
            log("⚠️ Haz clic sobre la estrella en el primer cuadro.");
            return;
        }
        if (!newWorker()) return;
        log(preSelect ? "📍 Preselección de posiciones..." : "▶ Fotometría secuencial...");
        (preSelect ? worker.startPreSelection(anchor) : worker.startSequential(anchor))
                .exceptionally(ex -> { log("❌ " + rootMessage(ex)); return null; });
        updateButtons(WorkflowMode.PRE_SELECTING);
    }

    private void startBatch() {
        if (worker == null) { log("⚠️ Primero preselecciona o carga posiciones."); return; }
        log("🚀 Lote automático...");
        worker.startBatch().exceptionally(ex -> { log("❌ " + rootMessage(ex)); return null; });
        updateButtons(WorkflowMode.BATCH_AUTOMATIC);
    }

    private void closeWorker() {
        if (worker != null) worker.close();
        worker = null;
    }

    private class UiListener implements SessionListener {
        @Override
        public void onProgress(SessionSnapshot s) {
            Platform.runLater(() -> {
                progressBar.setProgress(s.frameCount == 0 ? 0 : (double) s.currentFrameIndex / s.frameCount);
                if (!s.results.isEmpty()) {
                    PhotometryResult r = s.results.get(s.results.size() - 1);
                    if (r.frameIndex == s.currentFrameIndex - 1) {
                        PixelPlane.Channel c = r.rgb ? PixelPlane.Channel.L : PixelPlane.Channel.GRAY;
                        log(String.format(Locale.US, "%s -> %s flujo %.1f ± %.1f (mov %.1f px)",
                                r.fileName, r.position, r.channel(c).correctedFlux, r.channel(c).poissonNoise,
                                r.movement));
                    }
                }
            });
        }

        @Override
        public void onDecisionRequired(PendingDecision d) {
            Platform.runLater(() -> {
                showFrame(d.frameIndex());
                log((d.reason() == PendingDecision.Reason.TRACKING_LOST ? "🔴 Estrella perdida" : "🖱️ Marca la estrella")
                        + " en el cuadro " + (d.frameIndex() + 1) + " (" + d.frameName() + ")");
                updateButtons(WorkflowMode.SEQUENTIAL_MANUAL);
            });
        }

        @Override
        public void onFrameFailed(FrameFailure f) {
            Platform.runLater(() -> log("⚠️ Cuadro " + (f.frameIndex + 1) + ": " + f.kind + " " + f.message));
        }

        @Override
        public void onRunEnded(SessionSnapshot s) {
            Platform.runLater(() -> {
                if (s.mode == WorkflowMode.PAUSED) {
                    log("⏸ En pausa en el cuadro " + (s.currentFrameIndex + 1) + ". Usa ◀ ▶ y clic para corregir.");
                    showFrame(s.viewedFrameIndex);
                } else {
                    log("🏁 Fin: " + s.results.size() + " resultados, "
                            + s.positions.stream().filter(p -> p != null).count() + " posiciones.");
                }
                updateButtons(s.mode);
            });
        }

        @Override
        public void onCompleted(SessionReport report) {
            Platform.runLater(() -> {
                log("✅ Sesión cerrada con " + report.results.size() + " resultados.");
                updateButtons(WorkflowMode.COMPLETED);
            });
        }
    }

    private void updateButtons(WorkflowMode mode) {
        boolean running = mode != null && mode.isActive();
        boolean paused = mode == WorkflowMode.PAUSED;
        btnSequential.setDisable(running || paused);
        btnPreSelect.setDisable(running || paused);
        btnBatch.setDisable(running || paused || worker == null || mode == WorkflowMode.COMPLETED);
        btnPause.setDisable(!running);
        btnResume.setDisable(!paused);
        btnPrev.setDisable(!paused);
        btnNext.setDisable(!paused);
        btnStop.setDisable(!running);
        btnSaveCsv.setDisable(running || worker == null || mode == WorkflowMode.COMPLETED);
        btnSavePositions.setDisable(running || worker == null);
        btnLoadPositions.setDisable(running || paused);
    }

    // --- Archivos ---

    private void saveCsv(Pane root) {
        if (worker == null) return;
        SessionSnapshot s = worker.snapshot();
        FileChooser fc = new FileChooser();
        fc.setInitialFileName(CsvResultSink.defaultFileName(txtStarName.getText().trim(), s.results.size()));
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("CSV", "*.csv"));
        File f = fc.showSaveDialog(root.getScene().getWindow());
        if (f == null) return;
        worker.finish(new CsvResultSink(f.toPath()))
                .thenRun(() -> Platform.runLater(() -> log("💾 CSV: " + f.getAbsolutePath())))
                .exceptionally(ex -> { log("❌ No se pudo guardar: " + rootMessage(ex)); return null; });
    }

    private void savePositions(Pane root) {
        if (worker == null || source == null) return;
        SessionSnapshot s = worker.snapshot();
        FileChooser fc = new FileChooser();
        fc.setInitialFileName(PositionFileService.defaultFileName(txtStarName.getText().trim(), s.positions.size()));
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("CSV", "*.csv"));
        File f = fc.showSaveDialog(root.getScene().getWindow());
        if (f == null) return;
        try {
            positionService.save(f.toPath(), txtStarName.getText().trim(), readAperture(), s.positions, names(),
                    chkAutoTracking.isSelected() ? "tracked" : "manual");
            log("💾 Posiciones: " + f.getAbsolutePath());
        } catch (IOException | IllegalArgumentException ex) {
            logger.error("Error guardando posiciones", ex);
            log("❌ " + ex.getMessage());
        }
    }

    private List<String> names() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < source.frameCount(); i++) names.add(source.frameName(i));
        return names;
    }

    private void loadPositions(Pane root) {
        if (source == null && !openFolder()) return;
        FileChooser fc = new FileChooser();
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("CSV", "*.csv"));
        File f = fc.showOpenDialog(root.getScene().getWindow());
        if (f == null) return;
        try {
            PositionFileService.LoadedPositions loaded = positionService.load(f.toPath());
            if (!loaded.starName.isEmpty()) txtStarName.setText(loaded.starName);
            if (loaded.aperture != null) {
                txtInnerRadius.setText(SettingsTab.fmt(loaded.aperture.innerRadius));
                txtInnerAnnulus.setText(SettingsTab.fmt(loaded.aperture.innerAnnulus));
                txtOuterAnnulus.setText(SettingsTab.fmt(loaded.aperture.outerAnnulus));
            }
            if (!newWorker()) return;
            worker.seedPositions(loaded.positions);
            anchor = loaded.positions.isEmpty() ? null : loaded.positions.get(0);
            log("📂 " + loaded.positions.stream().filter(p -> p != null).count()
                    + " posiciones cargadas. Pulsa 🚀 Lote.");
            updateButtons(WorkflowMode.IDLE);
            showFrame(0);
        } catch (IOException ex) {
            logger.error("Error cargando posiciones", ex);
            log("❌ " + ex.getMessage());
        }
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null) t = t.getCause();
        return t.getMessage();
    }

    private void log(String msg) {
        if (Platform.isFxApplicationThread()) logArea.appendText(msg + "\n");
        else Platform.runLater(() -> logArea.appendText(msg + "\n"));
    }
}
