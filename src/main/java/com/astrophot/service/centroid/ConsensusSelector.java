package com.astrophot.service.centroid;

import com.astrophot.model.Position;
import com.astrophot.service.SigmaClippedStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ejecuta todos los métodos y elige por puntaje:
 * 0.5*confianza + 0.3*(1 - d_mediana/5) + 0.2*(1 - d_centro/radio).
 */
public class ConsensusSelector implements CandidateSelector {

    private static final Logger logger = LoggerFactory.getLogger(ConsensusSelector.class);

    private static final double CONSENSUS_SCALE = 5.0;

    @Override
    public Optional<Candidate> select(List<CentroidMethod> methods, SearchRegion region) {
        List<Candidate> candidates = new ArrayList<>();
        for (CentroidMethod m : methods) m.locate(region).ifPresent(candidates::add);
        if (candidates.isEmpty()) return Optional.empty();

        Position consensus = medianPosition(candidates);
        Candidate best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Candidate c : candidates) {
            double s = score(c, consensus, region.searchCenter, region.radius);
            if (s > bestScore) { bestScore = s; best = c; }
        }
        logger.debug("Consenso: {} candidatos, mejor {} en {} (score {})",
                candidates.size(), best.method, best.position, String.format("%.2f", bestScore));
        return Optional.of(best);
    }

    static double score(Candidate c, Position consensus, Position searchCenter, double radius) {
        double consensusScore = Math.max(0.0, 1.0 - c.position.distanceTo(consensus) / CONSENSUS_SCALE);
        double searchScore = Math.max(0.0, 1.0 - c.position.distanceTo(searchCenter) / radius);
        return 0.5 * c.confidence + 0.3 * consensusScore + 0.2 * searchScore;
    }

    static Position medianPosition(List<Candidate> candidates) {
        double[] xs = candidates.stream().mapToDouble(c -> c.position.x).sorted().toArray();
        double[] ys = candidates.stream().mapToDouble(c -> c.position.y).sorted().toArray();
        return new Position(SigmaClippedStats.median(xs), SigmaClippedStats.median(ys));
    }
}
