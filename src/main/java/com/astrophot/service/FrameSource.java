package com.astrophot.service;

import com.astrophot.model.FrameLoad;

/** Secuencia ordenada de cuadros, direccionable por índice. */
public interface FrameSource {

    int frameCount();

    String frameName(int index);

    /** Nunca lanza por un cuadro ilegible: devuelve FrameLoad.failed. */
    FrameLoad load(int index);
}
