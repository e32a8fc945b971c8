package hydrocascade.compute.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import hydrocascade.compute.config.HydroProperties;
import hydrocascade.compute.repository.CascadeRepository;
import hydrocascade.compute.repository.HydroResultRepository;
import hydrocascade.compute.repository.InflowRepository;
import hydrocascade.compute.repository.ReservoirStateRepository;
import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.dto.cascade.CascadeDescription;
import hydrocascade.domain.dto.preprocessing.CascadeRunSummary;
import hydrocascade.domain.dto.preprocessing.HydroCascadeRecord;
import hydrocascade.domain.dto.preprocessing.InflowSource;
import hydrocascade.domain.dto.preprocessing.PreprocessingReport;
import hydrocascade.domain.dto.preprocessing.PreprocessingRequest;
import hydrocascade.domain.exception.HydroConfigurationException;
import hydrocascade.domain.inflow.InflowSeries;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.reservoir.ReservoirState;
import hydrocascade.factory.CascadeTopologyLoader;
import hydrocascade.factory.ReservoirStateFactory;
import hydrocascade.physics.model.SyntheticInflowGenerator;
import hydrocascade.physics.simulator.MassBalanceCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the mass-balance engine over every requested cascade and stores the resulting
 * reservoir trajectories as planning inputs.
 * <p>
 * A failure in one cascade is logged and reported; the remaining cascades still run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HydroPreprocessingService {

    private final CascadeRepository cascadeRepository;
    private final InflowRepository inflowRepository;
    private final ReservoirStateRepository stateRepository;
    private final HydroResultRepository resultRepository;
    private final CascadeTopologyLoader topologyLoader;
    private final MassBalanceCalculator calculator;
    private final SyntheticInflowGenerator syntheticInflowGenerator;
    private final HydroProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Preprocesses the requested cascades over the normalized window.
     *
     * @param request Cascade filter, window and record context.
     * @return Summary of the run with one entry per attempted cascade.
     */
    public PreprocessingReport preprocessCascades(PreprocessingRequest request) {
        PreprocessingWindow window = PreprocessingWindow.normalize(request.startDate(), request.endDate(), clock);
        log.info("Starting hydro cascade preprocessing (case: {}, window: {} → {})",
                request.caseId(), window.start(), window.end());

        Map<String, CascadeRunSummary> results = new LinkedHashMap<>();
        List<HydroCascadeRecord> staged = new ArrayList<>();

        // 1. Load topologies
        List<CascadeTopology> topologies = new ArrayList<>();
        for (CascadeDescription description : cascadeRepository.findCascades(request.cascadeIds())) {
            // Descriptions without an id bypass the filter so the loader rejects them as an error entry
            if (description.cascadeId() != null && !request.includes(description.cascadeId())) {
                continue;
            }
            try {
                topologies.add(topologyLoader.load(description));
            } catch (HydroConfigurationException e) {
                log.error("Failed to load cascade topology {}", description.cascadeId(), e);
                results.put(String.valueOf(description.cascadeId()),
                        CascadeRunSummary.failure(description.cascadeId(), e.getMessage()));
            }
        }

        // 2. Simulate each cascade independently
        for (CascadeTopology topology : topologies) {
            try {
                CascadeOutcome outcome = processCascade(topology, window, request);
                results.put(topology.cascadeId(), outcome.summary());
                staged.addAll(outcome.records());
                log.info("Cascade {} processed: {} records (inflow source: {})",
                        topology.cascadeId(), outcome.records().size(), outcome.summary().inflowSource());
            } catch (RuntimeException e) {
                log.error("Failed to process cascade {}", topology.cascadeId(), e);
                results.put(topology.cascadeId(), CascadeRunSummary.failure(topology.cascadeId(), e.getMessage()));
            }
        }

        // 3. Persist
        int storedRows = staged.isEmpty() ? 0 : storeRecords(request, staged);

        int processed = (int) results.values().stream().filter(CascadeRunSummary::isSuccess).count();
        int failed = results.size() - processed;
        PreprocessingReport report = PreprocessingReport.builder()
                .status(failed == 0 ? PreprocessingReport.STATUS_COMPLETED : PreprocessingReport.STATUS_COMPLETED_WITH_ERRORS)
                .processedCascades(processed)
                .failedCascades(failed)
                .storedRows(storedRows)
                .windowStart(window.start())
                .windowEnd(window.end())
                .results(results)
                .build();
        log.info("Hydro preprocessing finished: {} ({} processed, {} failed, {} rows stored)",
                report.status(), processed, failed, storedRows);
        return report;
    }

    private CascadeOutcome processCascade(CascadeTopology topology, PreprocessingWindow window, PreprocessingRequest request) {
        String cascadeId = topology.cascadeId();
        double timeStepHours = properties.timeStepHours();

        // 1. Inflows: observed, or synthetic when the store has nothing for the window
        InflowSeries inflows = fetchObservedInflows(cascadeId, window);
        InflowSource source = InflowSource.OBSERVED;
        if (inflows.isEmpty()) {
            log.info("No observed inflows for cascade {}, generating synthetic series", cascadeId);
            inflows = InflowSeries.of(syntheticInflowGenerator.generate(
                    topology.reservoirs().values(), window.start(), window.end(), timeStepHours));
            source = InflowSource.SYNTHETIC;
        }

        // 2. Initial states
        Map<String, ReservoirState> initialStates = fetchInitialStates(topology, window);

        // 3. Mass balance
        List<ReservoirState> states = calculator.calculateMassBalance(cascadeId, inflows, initialStates, timeStepHours);

        // 4. Records
        List<HydroCascadeRecord> records = toRecords(topology, states, request, source);
        CascadeRunSummary summary = CascadeRunSummary.builder()
                .cascadeId(cascadeId)
                .status(CascadeRunSummary.STATUS_SUCCESS)
                .reservoirCount((int) states.stream().map(ReservoirState::reservoirId).distinct().count())
                .timeSteps(states.size())
                .recordsStaged(records.size())
                .inflowSource(source)
                .build();
        return new CascadeOutcome(summary, records);
    }

    private InflowSeries fetchObservedInflows(String cascadeId, PreprocessingWindow window) {
        try {
            return InflowSeries.fromRawRows(inflowRepository.findInflows(cascadeId, window.start(), window.end()))
                    .between(window.start(), window.end());
        } catch (RuntimeException e) {
            log.warn("Failed to load inflow data for cascade {}, falling back to synthetic inflows", cascadeId, e);
            return InflowSeries.empty();
        }
    }

    private Map<String, ReservoirState> fetchInitialStates(CascadeTopology topology, PreprocessingWindow window) {
        Map<String, ReservoirState> states = new HashMap<>();
        try {
            states.putAll(stateRepository.findLatestStatesBefore(topology.cascadeId(), window.start()));
        } catch (RuntimeException e) {
            log.warn("Failed to fetch initial states for cascade {}, using defaults", topology.cascadeId(), e);
        }
        for (Reservoir reservoir : topology.reservoirs().values()) {
            states.computeIfAbsent(reservoir.reservoirId(),
                    id -> ReservoirStateFactory.createDefaultState(reservoir, window.start()));
        }
        return states;
    }

    List<HydroCascadeRecord> toRecords(CascadeTopology topology, List<ReservoirState> states,
                                       PreprocessingRequest request, InflowSource source) {
        Map<String, String> metadataByReservoir = new HashMap<>();
        List<HydroCascadeRecord> records = new ArrayList<>(states.size());
        for (ReservoirState state : states) {
            Reservoir reservoir = topology.reservoir(state.reservoirId());
            String metadata = metadataByReservoir.computeIfAbsent(reservoir.reservoirId(), id -> metadataJson(reservoir, source));
            records.add(HydroCascadeRecord.builder()
                    .caseId(request.caseId())
                    .scenarioId(request.scenarioId())
                    .market(request.market())
                    .baId(topology.baId())
                    .cascadeId(topology.cascadeId())
                    .cascadeName(topology.cascadeName())
                    .reservoirId(state.reservoirId())
                    .reservoirName(reservoir.reservoirName())
                    .timestamp(state.timestamp())
                    .inflowCfs(state.inflowCfs())
                    .storageAf(state.storageAf())
                    .elevationFeet(state.elevationFeet())
                    .releaseCfs(state.releaseCfs())
                    .generationMw(state.generationMw())
                    .headFeet(state.headFeet())
                    .efficiencyPercent(state.efficiencyPercent())
                    .weatherScenario(request.weatherScenario())
                    .dataSource(request.dataSource())
                    .metadata(metadata)
                    .build());
        }
        return records;
    }

    private String metadataJson(Reservoir reservoir, InflowSource source) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("inflow_source", source.getCode());
        metadata.put("preprocessor_version", properties.preprocessorVersion());
        metadata.put("reservoir_type", reservoir.type().getCode());
        metadata.put("generation_units", reservoir.generationUnitIds());
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize metadata for reservoir " + reservoir.reservoirId(), e);
        }
    }

    private int storeRecords(PreprocessingRequest request, List<HydroCascadeRecord> records) {
        if (Boolean.TRUE.equals(request.overwriteExisting())) {
            try {
                int deleted = resultRepository.deleteCase(request.caseId());
                log.info("Deleted {} existing rows for case {}", deleted, request.caseId());
            } catch (RuntimeException e) {
                log.warn("Failed to delete existing rows for case {}", request.caseId(), e);
            }
        }

        int batchSize = properties.recordBatchSize();
        int inserted = 0;
        for (int from = 0; from < records.size(); from += batchSize) {
            List<HydroCascadeRecord> batch = records.subList(from, Math.min(from + batchSize, records.size()));
            resultRepository.insertBatch(List.copyOf(batch));
            inserted += batch.size();
        }
        log.info("Stored {} hydro input rows for case {}", inserted, request.caseId());
        return inserted;
    }

    private record CascadeOutcome(CascadeRunSummary summary, List<HydroCascadeRecord> records) {}
}
