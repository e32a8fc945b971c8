package hydrocascade.compute.repository;

import hydrocascade.domain.dto.cascade.CascadeDescription;

import java.util.Collection;
import java.util.List;

public interface CascadeRepository {

    /**
     * Descripciones de cascadas del catálogo de topologías.
     *
     * @param cascadeIds Filtro por identificador; vacío devuelve todas.
     */
    List<CascadeDescription> findCascades(Collection<String> cascadeIds);
}
