package hydrocascade.factory;

import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.cascade.ReservoirLinks;
import hydrocascade.domain.dto.cascade.CascadeDescription;
import hydrocascade.domain.dto.cascade.ReservoirDescription;
import hydrocascade.domain.exception.InvalidTopologyException;
import hydrocascade.domain.reservoir.GenerationUnit;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.reservoir.ReservoirType;
import hydrocascade.domain.reservoir.SeasonalRules;
import hydrocascade.physics.model.HydroUnits;
import hydrocascade.physics.simulator.TopologyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Transforma descripciones crudas de cascadas en {@link CascadeTopology} validadas y las
 * registra en el {@link TopologyRegistry} del calculador.
 * <p>
 * Validaciones (todas fatales, {@link InvalidTopologyException}):
 * <ul>
 * <li>{@code cascade_id} y {@code reservoir_id} obligatorios.</li>
 * <li>Identificadores de embalse únicos dentro de la cascada.</li>
 * <li>Todo enlace aguas arriba o aguas abajo apunta a un embalse de la cascada.</li>
 * <li>Los enlaces aguas arriba no forman ciclos.</li>
 * </ul>
 * Las declaraciones asimétricas (A declara B aguas abajo pero B no declara A aguas arriba)
 * sólo se avisan: el cálculo usa exclusivamente los enlaces aguas arriba.
 */
@Slf4j
@RequiredArgsConstructor
public class CascadeTopologyLoader {

    private final TopologyRegistry registry;

    /**
     * Carga y registra una cascada, sustituyendo cualquier topología previa con el mismo id.
     *
     * @return La topología registrada.
     * @throws InvalidTopologyException si la descripción es inconsistente.
     */
    public CascadeTopology load(CascadeDescription description) {
        CascadeTopology topology = build(description);
        registry.register(topology);
        log.info("Cascada {} cargada: {} embalses, orden de resolución {}",
                topology.cascadeId(), topology.size(), topology.resolutionOrder());
        return topology;
    }

    /**
     * Construye la topología sin registrarla.
     */
    public CascadeTopology build(CascadeDescription description) {
        Objects.requireNonNull(description, "La descripción de la cascada no puede ser nula.");
        String cascadeId = description.cascadeId();
        if (cascadeId == null || cascadeId.isBlank()) {
            throw new InvalidTopologyException("Cascade description is missing cascade_id");
        }
        SeasonalRules cascadeRules = description.seasonalRules() == null
                ? SeasonalRules.EMPTY
                : description.seasonalRules();

        // 1. Embalses tipados y enlaces declarados
        Map<String, Reservoir> reservoirs = new LinkedHashMap<>();
        Map<String, ReservoirLinks> links = new LinkedHashMap<>();
        for (ReservoirDescription reservoirDescription : description.reservoirs()) {
            if (reservoirDescription == null) {
                throw new InvalidTopologyException("Cascade " + cascadeId + " contains a null reservoir entry");
            }
            String reservoirId = reservoirDescription.reservoirId();
            if (reservoirId == null || reservoirId.isBlank()) {
                throw new InvalidTopologyException("Reservoir in cascade " + cascadeId + " is missing reservoir_id");
            }
            if (reservoirs.containsKey(reservoirId)) {
                throw new InvalidTopologyException("Duplicate reservoir_id " + reservoirId + " in cascade " + cascadeId);
            }
            reservoirs.put(reservoirId, toReservoir(reservoirDescription, cascadeRules));
            links.put(reservoirId, new ReservoirLinks(
                    distinct(reservoirDescription.upstreamReservoirs()),
                    distinct(reservoirDescription.downstreamReservoirs())));
        }

        // 2. Integridad de enlaces
        validateLinks(cascadeId, reservoirs, links);
        warnAsymmetricLinks(cascadeId, links);

        // 3. Orden de resolución
        List<String> order = ResolutionOrder.compute(cascadeId, new ArrayList<>(reservoirs.keySet()), links);

        return CascadeTopology.builder()
                .cascadeId(cascadeId)
                .cascadeName(description.cascadeName())
                .riverSystem(description.riverSystem())
                .baId(description.baId())
                .region(description.region())
                .reservoirs(reservoirs)
                .links(links)
                .resolutionOrder(order)
                .build();
    }

    // --- Normalización de metadatos ---

    Reservoir toReservoir(ReservoirDescription description, SeasonalRules cascadeRules) {
        SeasonalRules ownRules = description.seasonalRules();
        SeasonalRules rules = ownRules == null || ownRules.isEmpty() ? cascadeRules : ownRules;

        Double maxStorageAf = description.maxStorageAf() != null
                ? description.maxStorageAf()
                : mcmToAcreFeet(description.activeStorageMcm());
        Double minStorageAf = description.minStorageAf() != null
                ? description.minStorageAf()
                : mcmToAcreFeet(description.deadStorageMcm());
        if (minStorageAf == null && maxStorageAf != null) {
            minStorageAf = 0.0;
        }

        List<GenerationUnit> units = description.generationUnits();
        return Reservoir.builder()
                .reservoirId(description.reservoirId())
                .reservoirName(description.reservoirName())
                .type(ReservoirType.fromCode(description.reservoirType()))
                .minStorageAf(minStorageAf)
                .maxStorageAf(maxStorageAf)
                .elevationRange(description.elevationRange())
                .headCurve(description.headCurve())
                .efficiencyCurve(description.efficiencyCurve())
                .seasonalRules(rules)
                .environmentalMinReleaseCfs(description.environmentalMinReleaseCfs())
                .maxReleaseCfs(description.maxReleaseCfs())
                .downstreamMinReleaseCfs(description.downstreamMinReleaseCfs())
                .maxGenerationMw(maxGeneration(description.maxGenerationMw(), units))
                .tailwaterElevationFeet(tailwaterFeet(description))
                .generationUnitIds(units.stream()
                        .map(GenerationUnit::unitId)
                        .filter(Objects::nonNull)
                        .toList())
                .build();
    }

    /**
     * Sin grupos se conserva el tope declarado (puede ser nulo). Con grupos, el tope es el
     * declarado (o 0) más la potencia efectiva de cada grupo.
     */
    static Double maxGeneration(Double declaredMw, List<GenerationUnit> units) {
        if (units.isEmpty()) {
            return declaredMw;
        }
        double total = declaredMw == null ? 0.0 : declaredMw;
        for (GenerationUnit unit : units) {
            total += unit.effectiveCapacityMw();
        }
        return total;
    }

    static double tailwaterFeet(ReservoirDescription description) {
        if (description.tailwaterElevationFeet() != null) return description.tailwaterElevationFeet();
        if (description.tailwaterElevationM() != null) return HydroUnits.metersToFeet(description.tailwaterElevationM());
        return 0.0;
    }

    private static Double mcmToAcreFeet(Double mcm) {
        return mcm == null ? null : HydroUnits.mcmToAcreFeet(mcm);
    }

    private static List<String> distinct(List<String> ids) {
        return List.copyOf(new LinkedHashSet<>(ids));
    }

    // --- Validación ---

    private static void validateLinks(String cascadeId, Map<String, Reservoir> reservoirs, Map<String, ReservoirLinks> links) {
        links.forEach((reservoirId, reservoirLinks) -> {
            for (String upstreamId : reservoirLinks.upstream()) {
                if (!reservoirs.containsKey(upstreamId)) {
                    throw new InvalidTopologyException("Reservoir " + reservoirId + " in cascade " + cascadeId
                            + " references unknown upstream reservoir " + upstreamId);
                }
            }
            for (String downstreamId : reservoirLinks.downstream()) {
                if (!reservoirs.containsKey(downstreamId)) {
                    throw new InvalidTopologyException("Reservoir " + reservoirId + " in cascade " + cascadeId
                            + " references unknown downstream reservoir " + downstreamId);
                }
            }
        });
    }

    private static void warnAsymmetricLinks(String cascadeId, Map<String, ReservoirLinks> links) {
        links.forEach((reservoirId, reservoirLinks) -> {
            for (String downstreamId : reservoirLinks.downstream()) {
                if (!links.get(downstreamId).upstream().contains(reservoirId)) {
                    log.warn("Cascada {}: {} declara {} aguas abajo, pero {} no lo declara aguas arriba",
                            cascadeId, reservoirId, downstreamId, downstreamId);
                }
            }
            for (String upstreamId : reservoirLinks.upstream()) {
                if (!links.get(upstreamId).downstream().contains(reservoirId)) {
                    log.warn("Cascada {}: {} declara {} aguas arriba, pero {} no lo declara aguas abajo",
                            cascadeId, reservoirId, upstreamId, upstreamId);
                }
            }
        });
    }
}
