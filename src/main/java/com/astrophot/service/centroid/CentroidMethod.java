package com.astrophot.service.centroid;

import java.util.Optional;

/**
 * Un método de centroide sobre la región de búsqueda. Devuelve vacío si no encuentra
 * una posición aceptable.
 */
public interface CentroidMethod {

    String name();

    Optional<Candidate> locate(SearchRegion region);
}
