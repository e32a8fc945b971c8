package hydrocascade.physics.simulator;

import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.inflow.InflowSeries;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.reservoir.ReservoirState;
import hydrocascade.factory.ReservoirStateFactory;
import hydrocascade.physics.model.GenerationResult;
import hydrocascade.physics.model.HydroUnits;
import hydrocascade.physics.model.ReservoirPhysics;
import hydrocascade.physics.policy.ReleasePolicy;
import hydrocascade.physics.policy.RuleCurveReleasePolicy;
import hydrocascade.physics.solver.MassBalanceSolver;
import hydrocascade.physics.solver.StorageBalance;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orquesta el balance de masas de una cascada paso a paso.
 * <p>
 * Para cada instante (en orden cronológico) recorre los embalses en el orden topológico
 * precalculado por el cargador, de modo que cada embalse recibe el desembalse de sus
 * embalses aguas arriba en el mismo instante (propagación sin retardo).
 * <p>
 * El estado de cada ejecución es local a la llamada; sólo el registro de topologías se
 * comparte entre ejecuciones.
 */
@Slf4j
public class MassBalanceCalculator {

    public static final double DEFAULT_TIME_STEP_HOURS = 1.0;

    @Getter
    private final TopologyRegistry registry;
    private final ReleasePolicy releasePolicy;

    public MassBalanceCalculator() {
        this(new TopologyRegistry(), new RuleCurveReleasePolicy());
    }

    public MassBalanceCalculator(TopologyRegistry registry, ReleasePolicy releasePolicy) {
        this.registry = registry;
        this.releasePolicy = releasePolicy;
    }

    public List<ReservoirState> calculateMassBalance(String cascadeId, InflowSeries inflows,
                                                     Map<String, ReservoirState> initialStates) {
        return calculateMassBalance(cascadeId, inflows, initialStates, DEFAULT_TIME_STEP_HOURS);
    }

    /**
     * Simula la cascada sobre todos los instantes de la serie de aportaciones.
     *
     * @param cascadeId     Cascada previamente cargada.
     * @param inflows       Aportaciones directas por instante y embalse.
     * @param initialStates Estado de partida por embalse; los ausentes usan el estado por defecto.
     * @param timeStepHours Duración de cada paso en horas.
     * @return Estados en orden de resolución dentro de cada bloque de instante.
     * @throws hydrocascade.domain.exception.CascadeNotLoadedException si la cascada no está cargada.
     * @throws IllegalArgumentException si el paso de tiempo no es positivo y finito.
     */
    public List<ReservoirState> calculateMassBalance(String cascadeId, InflowSeries inflows,
                                                     Map<String, ReservoirState> initialStates,
                                                     double timeStepHours) {
        CascadeTopology topology = registry.require(cascadeId);
        if (!(timeStepHours > 0.0) || !Double.isFinite(timeStepHours)) {
            throw new IllegalArgumentException("Time step must be a positive finite number of hours: " + timeStepHours);
        }
        if (inflows == null || inflows.isEmpty()) {
            log.info("Cascada {}: serie de aportaciones vacía, no hay nada que simular", cascadeId);
            return List.of();
        }

        double timeStepSeconds = HydroUnits.hoursToSeconds(timeStepHours);
        Map<String, ReservoirState> current = new HashMap<>(initialStates == null ? Map.of() : initialStates);
        List<ReservoirState> results = new ArrayList<>(inflows.timestepCount() * topology.size());

        log.info("Cascada {}: simulando {} instantes x {} embalses (Δt = {} h)",
                cascadeId, inflows.timestepCount(), topology.size(), timeStepHours);

        for (Instant timestamp : inflows.timestamps()) {
            Map<String, ReservoirState> resolved = new HashMap<>();
            for (String reservoirId : topology.resolutionOrder()) {
                ReservoirState next = step(topology, reservoirId, timestamp, inflows, current, resolved, timeStepSeconds);
                resolved.put(reservoirId, next);
                current.put(reservoirId, next);
                results.add(next);
            }
            log.debug("Cascada {}: instante {} resuelto", cascadeId, timestamp);
        }

        log.info("Cascada {}: simulación completada, {} estados calculados", cascadeId, results.size());
        return results;
    }

    private ReservoirState step(CascadeTopology topology, String reservoirId, Instant timestamp,
                                InflowSeries inflows, Map<String, ReservoirState> current,
                                Map<String, ReservoirState> resolved, double timeStepSeconds) {
        Reservoir reservoir = topology.reservoir(reservoirId);

        // 1-3. Entrada total: aportación directa + desembalses aguas arriba del mismo instante
        double totalInflow = inflows.inflowAt(timestamp, reservoirId);
        for (String upstreamId : topology.upstreamOf(reservoirId)) {
            totalInflow += resolved.get(upstreamId).releaseCfs();
        }

        // 4. Estado previo
        ReservoirState prior = current.get(reservoirId);
        if (prior == null) {
            prior = ReservoirStateFactory.createDefaultState(reservoir, timestamp);
        }

        // 5. Política de desembalse
        double proposedRelease = releasePolicy.calculateRelease(
                reservoir, prior.storageAf(), totalInflow, timestamp, timeStepSeconds);

        // 6-7. Balance de masas con corrección por límites
        StorageBalance balance = MassBalanceSolver.solve(
                reservoir, prior.storageAf(), totalInflow, proposedRelease, timeStepSeconds);
        if (balance.forcedClamp()) {
            log.warn("Cascada {}: volumen de {} saturado a sus límites en {} (la corrección del desembalse no bastó)",
                    topology.cascadeId(), reservoirId, timestamp);
        }

        // 8-10. Física derivada
        double elevation = ReservoirPhysics.storageToElevation(balance.storageAf(), reservoir);
        double head = ReservoirPhysics.elevationToHead(elevation, reservoir);
        GenerationResult generation = ReservoirPhysics.calculateGeneration(balance.releaseCfs(), head, reservoir);

        // 11. Nuevo estado
        return ReservoirState.builder()
                .reservoirId(reservoirId)
                .timestamp(timestamp)
                .storageAf(balance.storageAf())
                .elevationFeet(elevation)
                .inflowCfs(totalInflow)
                .releaseCfs(balance.releaseCfs())
                .generationMw(generation.generationMw())
                .headFeet(head)
                .efficiencyPercent(generation.efficiencyPercent())
                .build();
    }
}
