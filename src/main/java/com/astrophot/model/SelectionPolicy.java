package com.astrophot.model;

public enum SelectionPolicy {
    /** Métodos en orden, gana el primero aceptado. */
    FIRST_ACCEPTED,
    /** Todos los métodos, gana el mejor puntaje de consenso. */
    CONSENSUS
}
