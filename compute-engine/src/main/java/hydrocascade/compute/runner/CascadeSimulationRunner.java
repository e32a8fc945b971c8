package hydrocascade.compute.runner;

import com.fasterxml.jackson.core.type.TypeReference;
import hydrocascade.compute.config.HydroProperties;
import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.dto.cascade.CascadeDescription;
import hydrocascade.domain.inflow.InflowSeries;
import hydrocascade.domain.inflow.RawInflowRow;
import hydrocascade.domain.reservoir.ReservoirState;
import hydrocascade.factory.CascadeTopologyLoader;
import hydrocascade.io.JsonFileHandler;
import hydrocascade.physics.simulator.MassBalanceCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Runs a single cascade simulation from JSON files when the application is started with
 * <pre>
 * --cascade=cascade.json --inflows=inflows.json --output=states.json
 * [--initial-states=states.json] [--time-step-hours=1.0]
 * </pre>
 * Without {@code --cascade} it does nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CascadeSimulationRunner implements CommandLineRunner {

    static final String CASCADE = "cascade";
    static final String INFLOWS = "inflows";
    static final String OUTPUT = "output";
    static final String INITIAL_STATES = "initial-states";
    static final String TIME_STEP_HOURS = "time-step-hours";

    private static final TypeReference<List<RawInflowRow>> INFLOW_ROWS = new TypeReference<>() {};
    private static final TypeReference<Map<String, ReservoirState>> STATES_BY_RESERVOIR = new TypeReference<>() {};

    private final CascadeTopologyLoader topologyLoader;
    private final MassBalanceCalculator calculator;
    private final JsonFileHandler jsonFileHandler;
    private final HydroProperties properties;

    @Override
    public void run(String... args) throws Exception {
        ApplicationArguments arguments = new DefaultApplicationArguments(args);
        if (!arguments.containsOption(CASCADE)) {
            log.debug("No --{} option given, skipping file-based simulation", CASCADE);
            return;
        }

        String cascadeFile = required(arguments, CASCADE);
        String inflowFile = required(arguments, INFLOWS);
        String outputFile = required(arguments, OUTPUT);
        double timeStepHours = arguments.containsOption(TIME_STEP_HOURS)
                ? Double.parseDouble(required(arguments, TIME_STEP_HOURS))
                : properties.timeStepHours();

        // 1. Topology
        CascadeTopology topology = topologyLoader.load(jsonFileHandler.readFromFile(cascadeFile, CascadeDescription.class));

        // 2. Inputs
        InflowSeries inflows = InflowSeries.fromRawRows(jsonFileHandler.readFromFile(inflowFile, INFLOW_ROWS));
        Map<String, ReservoirState> initialStates = arguments.containsOption(INITIAL_STATES)
                ? jsonFileHandler.readFromFile(required(arguments, INITIAL_STATES), STATES_BY_RESERVOIR)
                : Map.of();

        // 3. Simulation and output
        List<ReservoirState> states = calculator.calculateMassBalance(
                topology.cascadeId(), inflows, initialStates, timeStepHours);
        jsonFileHandler.writeToFile(states, outputFile);

        log.info("Cascade {} simulated from files: {} states written to {}", topology.cascadeId(), states.size(), outputFile);
    }

    private static String required(ApplicationArguments arguments, String option) {
        List<String> values = arguments.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Missing required option --" + option + "=<value>");
        }
        return values.get(0);
    }
}
