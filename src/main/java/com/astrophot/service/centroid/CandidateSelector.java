package com.astrophot.service.centroid;

import java.util.List;
import java.util.Optional;

public interface CandidateSelector {

    Optional<Candidate> select(List<CentroidMethod> methods, SearchRegion region);
}
