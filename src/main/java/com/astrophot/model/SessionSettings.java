package com.astrophot.model;

/**
 * Parámetros de una sesión, inmutables. Los aporta quien llama; el núcleo no los persiste.
 */
public final class SessionSettings {

    public static final double DEFAULT_SEARCH_RADIUS = 25.0;
    public static final int DEFAULT_HISTORY_CAPACITY = 5;

    public final String starName;
    public final ApertureParams aperture;
    public final double searchRadius;
    public final boolean autoTracking;
    public final int historyCapacity;
    public final SelectionPolicy selectionPolicy;

    public SessionSettings(String starName, ApertureParams aperture, double searchRadius, boolean autoTracking,
                           int historyCapacity, SelectionPolicy selectionPolicy) {
        if (starName == null || starName.isBlank()) {
            throw new IllegalArgumentException("Se requiere un nombre de estrella");
        }
        if (aperture == null) throw new IllegalArgumentException("Falta la apertura");
        if (!(searchRadius > 0)) throw new IllegalArgumentException("Radio de búsqueda inválido: " + searchRadius);
        if (historyCapacity < 2) throw new IllegalArgumentException("Historial mínimo: 2");
        this.starName = starName.trim();
        this.aperture = aperture;
        this.searchRadius = searchRadius;
        this.autoTracking = autoTracking;
        this.historyCapacity = historyCapacity;
        this.selectionPolicy = selectionPolicy == null ? SelectionPolicy.FIRST_ACCEPTED : selectionPolicy;
    }

    public SessionSettings(String starName, ApertureParams aperture, double searchRadius, boolean autoTracking) {
        this(starName, aperture, searchRadius, autoTracking, DEFAULT_HISTORY_CAPACITY, SelectionPolicy.FIRST_ACCEPTED);
    }

    @Override
    public String toString() {
        return starName + " [" + aperture + ", búsqueda " + searchRadius + ", auto=" + autoTracking
                + ", historial " + historyCapacity + ", " + selectionPolicy + "]";
    }
}
