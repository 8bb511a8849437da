package com.astrophot.workflow;

import com.astrophot.model.Position;

/** Respuesta del usuario a una {@link PendingDecision}. */
public final class Decision {

    public enum Kind { POSITION, SKIP, STOP }

    public final Kind kind;
    public final Position position; // solo para POSITION

    private Decision(Kind kind, Position position) {
        this.kind = kind;
        this.position = position;
    }

    public static Decision position(Position p) {
        if (p == null) throw new IllegalArgumentException("Posición nula");
        return new Decision(Kind.POSITION, p);
    }

    public static Decision skip() {
        return new Decision(Kind.SKIP, null);
    }

    public static Decision stop() {
        return new Decision(Kind.STOP, null);
    }

    @Override
    public String toString() {
        return kind == Kind.POSITION ? "POSITION " + position : kind.name();
    }
}
