package com.astrophot.service;

import com.astrophot.model.PixelPlane;
import com.astrophot.model.Position;
import com.astrophot.model.SelectionPolicy;
import com.astrophot.model.TrackResult;
import com.astrophot.service.centroid.Candidate;
import com.astrophot.service.centroid.CandidateSelector;
import com.astrophot.service.centroid.CenterOfMassMethod;
import com.astrophot.service.centroid.CentroidMethod;
import com.astrophot.service.centroid.ConnectedComponentMethod;
import com.astrophot.service.centroid.ConsensusSelector;
import com.astrophot.service.centroid.FirstAcceptedSelector;
import com.astrophot.service.centroid.IterativeWindowMethod;
import com.astrophot.service.centroid.MomentOutlierMethod;
import com.astrophot.service.centroid.MomentumMethod;
import com.astrophot.service.centroid.PeakRefineMethod;
import com.astrophot.service.centroid.PeakWeightedMethod;
import com.astrophot.service.centroid.SearchRegion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Re-localiza la estrella cerca de una posición esperada: predicción por momento,
 * radio y umbral adaptativos, métodos de centroide con respaldo. Nunca lanza por
 * pérdida de seguimiento: devuelve LOST con la posición esperada.
 */
public class CentroidTracker {

    private static final Logger logger = LoggerFactory.getLogger(CentroidTracker.class);

    private final TrackingHistory history;
    private final List<CentroidMethod> methods;
    private final CandidateSelector selector;
    private final CentroidMethod momentum = new MomentumMethod();

    public CentroidTracker(TrackingHistory history, List<CentroidMethod> methods, CandidateSelector selector) {
        this.history = history;
        this.methods = List.copyOf(methods);
        this.selector = selector;
    }

    public static CentroidTracker standard(TrackingHistory history) {
        return new CentroidTracker(history,
                List.of(new CenterOfMassMethod(), new PeakRefineMethod()),
                new FirstAcceptedSelector());
    }

    public static CentroidTracker consensus(TrackingHistory history) {
        return new CentroidTracker(history,
                List.of(new CenterOfMassMethod(), new PeakRefineMethod(), new IterativeWindowMethod(),
                        new MomentOutlierMethod(), new ConnectedComponentMethod(), new PeakWeightedMethod()),
                new ConsensusSelector());
    }

    public static CentroidTracker forPolicy(SelectionPolicy policy, TrackingHistory history) {
        return policy == SelectionPolicy.CONSENSUS ? consensus(history) : standard(history);
    }

    public TrackResult locate(PixelPlane plane, Position expected, double baseRadius) {
        return locate(plane.tracking(), expected, baseRadius);
    }

    public TrackResult locate(double[][] data, Position expected, double baseRadius) {
        Position searchCenter = history.predict(expected);
        double radius = history.adaptiveRadius(baseRadius);

        TrackResult result = search(data, expected, searchCenter, radius);
        history.push(result.position, result.confidence);

        if (result.isFound()) {
            logger.debug("Estrella en {} via {} (movió {} px, radio {})", result.position, result.method,
                    String.format("%.1f", result.position.distanceTo(expected)), String.format("%.0f", radius));
        } else {
            logger.debug("Seguimiento perdido, se usa la posición esperada {}", expected);
        }
        return result;
    }

    private TrackResult search(double[][] data, Position expected, Position searchCenter, double radius) {
        SearchRegion region = SearchRegion.extract(data, expected, searchCenter, radius);
        if (region == null) return TrackResult.lost(expected);

        Optional<Candidate> c = selector.select(methods, region);
        if (c.isEmpty()) c = momentum.locate(region);

        return c.map(k -> TrackResult.found(k.position, k.confidence, k.method))
                .orElseGet(() -> TrackResult.lost(expected));
    }

    public TrackingHistory history() {
        return history;
    }
}
