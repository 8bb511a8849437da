package com.astrophot.workflow;

import com.astrophot.model.FrameFailure;
import com.astrophot.model.SessionReport;
import com.astrophot.model.SessionSnapshot;

/**
 * Avisos de la sesión. Se llaman en el hilo de la sesión; la UI debe pasar a su propio hilo.
 */
public interface SessionListener {

    default void onProgress(SessionSnapshot snapshot) {}

    default void onDecisionRequired(PendingDecision decision) {}

    default void onFrameFailed(FrameFailure failure) {}

    /** La ejecución actual terminó (vuelta a IDLE) o quedó en pausa. */
    default void onRunEnded(SessionSnapshot snapshot) {}

    default void onCompleted(SessionReport report) {}
}
