package com.astrophot.main;

import com.astrophot.ui.PhotometryTab;
import com.astrophot.ui.SettingsTab;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class AstroPhotApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🔭 AstroPhot - Seguimiento y Fotometría");

        TabPane tabPane = new TabPane();
        tabPane.setTabClosingPolicy(TabPane.TabClosingPolicy.UNAVAILABLE);

        // ORDEN DE PESTAÑAS
        tabPane.getTabs().add(new PhotometryTab().create()); // 1. Medir
        tabPane.getTabs().add(new SettingsTab().create());   // 2. Valores por defecto

        Scene scene = new Scene(tabPane, 1100, 850);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
