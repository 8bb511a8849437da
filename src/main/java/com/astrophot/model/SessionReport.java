package com.astrophot.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Lo que recibe el ResultSink al cerrar la sesión. */
public final class SessionReport {
    public final SessionSettings settings;
    public final List<String> frameNames;
    public final List<Position> positions;
    public final List<PhotometryResult> results;
    public final List<FrameFailure> failures;

    public SessionReport(SessionSettings settings, List<String> frameNames, List<Position> positions,
                         List<PhotometryResult> results, List<FrameFailure> failures) {
        this.settings = settings;
        this.frameNames = List.copyOf(frameNames);
        this.positions = Collections.unmodifiableList(new ArrayList<>(positions));
        this.results = List.copyOf(results);
        this.failures = List.copyOf(failures);
    }
}
