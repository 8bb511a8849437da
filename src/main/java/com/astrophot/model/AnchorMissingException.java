package com.astrophot.model;

/** El primer cuadro no tiene posición válida: no hay ancla para seguir la estrella. */
public class AnchorMissingException extends RuntimeException {

    private final int frameIndex;

    public AnchorMissingException(int frameIndex, String message) {
        super(message);
        this.frameIndex = frameIndex;
    }

    public int getFrameIndex() {
        return frameIndex;
    }
}
