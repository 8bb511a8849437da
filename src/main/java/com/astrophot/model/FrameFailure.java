package com.astrophot.model;

import java.util.Objects;

public final class FrameFailure {
    public final int frameIndex;
    public final FailureKind kind;
    public final String message;

    public FrameFailure(int frameIndex, FailureKind kind, String message) {
        this.frameIndex = frameIndex;
        this.kind = kind;
        this.message = message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrameFailure)) return false;
        FrameFailure f = (FrameFailure) o;
        return frameIndex == f.frameIndex && kind == f.kind && Objects.equals(message, f.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frameIndex, kind, message);
    }

    @Override
    public String toString() {
        return kind + "@" + frameIndex + ": " + message;
    }
}
