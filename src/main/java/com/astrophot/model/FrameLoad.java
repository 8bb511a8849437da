package com.astrophot.model;

import java.util.Map;

/**
 * Resultado de decodificar un cuadro: plano + metadatos, o el motivo del fallo.
 */
public class FrameLoad {
    public final PixelPlane plane;
    public final Map<String, String> metadata;
    public final String failure;

    private FrameLoad(PixelPlane plane, Map<String, String> metadata, String failure) {
        this.plane = plane;
        this.metadata = metadata;
        this.failure = failure;
    }

    public static FrameLoad loaded(PixelPlane plane, Map<String, String> metadata) {
        return new FrameLoad(plane, Map.copyOf(metadata), null);
    }

    public static FrameLoad loaded(PixelPlane plane) {
        return loaded(plane, Map.of());
    }

    public static FrameLoad failed(String reason) {
        return new FrameLoad(null, Map.of(), reason);
    }

    public boolean isLoaded() {
        return plane != null;
    }
}
