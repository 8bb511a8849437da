package com.astrophot.ui;

import com.astrophot.model.AppConfig;
import com.astrophot.model.ApertureParams;
import com.astrophot.model.InvalidApertureException;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public class SettingsTab {

    private static final Logger logger = LoggerFactory.getLogger(SettingsTab.class);

    private TextField txtInnerRadius, txtInnerAnnulus, txtOuterAnnulus;
    private TextField txtSearchRadius;
    private Spinner<Integer> spnHistory;
    private CheckBox chkAutoTracking, chkConsensus;
    private Label lblStatus;

    public Tab create() {
        Tab tab = new Tab("⚙️ Configuración");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        VBox content = new VBox(20);
        content.setAlignment(Pos.TOP_CENTER);
        content.setMaxWidth(600);

        Label title = new Label("🔭 Valores por defecto");
        title.setFont(Font.font("System", FontWeight.BOLD, 20));

        // --- 1. APERTURA ---
        GridPane gridAp = new GridPane();
        gridAp.setHgap(15); gridAp.setVgap(15);
        gridAp.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");

        txtInnerRadius = new TextField(fmt(AppConfig.getInnerRadius()));
        txtInnerAnnulus = new TextField(fmt(AppConfig.getInnerAnnulus()));
        txtOuterAnnulus = new TextField(fmt(AppConfig.getOuterAnnulus()));

        gridAp.add(new Label("Radio apertura (px):"), 0, 0); gridAp.add(txtInnerRadius, 1, 0);
        gridAp.add(new Label("Anillo interior (px):"), 0, 1); gridAp.add(txtInnerAnnulus, 1, 1);
        gridAp.add(new Label("Anillo exterior (px):"), 0, 2); gridAp.add(txtOuterAnnulus, 1, 2);
        Label hint = new Label("Si anillo interior ≥ exterior no se resta el cielo.");
        hint.setStyle("-fx-font-size: 10px; -fx-text-fill: #666;");
        gridAp.add(hint, 0, 3, 2, 1);

        // --- 2. SEGUIMIENTO ---
        VBox trackBox = new VBox(10);
        trackBox.setStyle("-fx-border-color: #2196F3; -fx-border-width: 1; -fx-padding: 15; -fx-background-radius: 5; -fx-background-color: #E3F2FD;");
        Label lblTrack = new Label("🎯 Seguimiento");
        lblTrack.setFont(Font.font("System", FontWeight.BOLD, 13));

        GridPane gridTrack = new GridPane();
        gridTrack.setHgap(10); gridTrack.setVgap(10);
        txtSearchRadius = new TextField(fmt(AppConfig.getSearchRadius()));
        spnHistory = new Spinner<>(2, 20, AppConfig.getHistorySize());
        chkAutoTracking = new CheckBox("Seguimiento automático");
        chkAutoTracking.setSelected(AppConfig.isAutoTracking());
        chkConsensus = new CheckBox("Consenso de métodos (más lento, más robusto)");
        chkConsensus.setSelected(AppConfig.isConsensusTracking());

        gridTrack.add(new Label("Radio de búsqueda (px):"), 0, 0); gridTrack.add(txtSearchRadius, 1, 0);
        gridTrack.add(new Label("Historial (cuadros):"), 0, 1); gridTrack.add(spnHistory, 1, 1);
        trackBox.getChildren().addAll(lblTrack, gridTrack, chkAutoTracking, chkConsensus);

        // --- FOOTER ---
        lblStatus = new Label();
        Button btnSave = new Button("💾 Guardar");
        btnSave.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnSave.setOnAction(e -> save());

        content.getChildren().addAll(title, gridAp, trackBox, btnSave, lblStatus);
        root.setCenter(content);
        tab.setContent(root);
        return tab;
    }

    private void save() {
        try {
            ApertureParams aperture = new ApertureParams(parse(txtInnerRadius), parse(txtInnerAnnulus), parse(txtOuterAnnulus));
            double radius = parse(txtSearchRadius);
            if (radius <= 0) throw new NumberFormatException("radio de búsqueda <= 0");

            AppConfig.setAperture(aperture);
            AppConfig.setSearchRadius(radius);
            AppConfig.setHistorySize(spnHistory.getValue());
            AppConfig.setAutoTracking(chkAutoTracking.isSelected());
            AppConfig.setConsensusTracking(chkConsensus.isSelected());

            lblStatus.setText("✅ Guardado");
            lblStatus.setStyle("-fx-text-fill: #2E7D32;");
            logger.info("Configuración guardada: apertura {}, radio {}", aperture, radius);
        } catch (NumberFormatException | InvalidApertureException ex) {
            lblStatus.setText("❌ " + ex.getMessage());
            lblStatus.setStyle("-fx-text-fill: #D32F2F;");
        }
    }

    static double parse(TextField tf) {
        return Double.parseDouble(tf.getText().trim().replace(',', '.'));
    }

    static String fmt(double v) {
        return String.format(Locale.US, "%.1f", v);
    }
}
