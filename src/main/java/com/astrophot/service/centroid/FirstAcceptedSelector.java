package com.astrophot.service.centroid;

import java.util.List;
import java.util.Optional;

public class FirstAcceptedSelector implements CandidateSelector {

    @Override
    public Optional<Candidate> select(List<CentroidMethod> methods, SearchRegion region) {
        for (CentroidMethod m : methods) {
            Optional<Candidate> c = m.locate(region);
            if (c.isPresent()) return c;
        }
        return Optional.empty();
    }
}
