package hydrocascade.compute.config;

import hydrocascade.config.ReleasePolicyParameters;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Set;

/**
 * Configuration bound from the {@code hydro.*} namespace.
 * Every value is optional; missing values fall back to the historical model constants.
 */
@ConfigurationProperties(prefix = "hydro")
public record HydroProperties(
        Double timeStepHours,
        Integer recordBatchSize,
        String preprocessorVersion,
        Policy policy
) {

    public static final double DEFAULT_TIME_STEP_HOURS = 1.0;
    public static final int DEFAULT_RECORD_BATCH_SIZE = 5_000;
    public static final String DEFAULT_PREPROCESSOR_VERSION = "1.0.0";

    public HydroProperties {
        timeStepHours = timeStepHours == null ? DEFAULT_TIME_STEP_HOURS : timeStepHours;
        recordBatchSize = recordBatchSize == null ? DEFAULT_RECORD_BATCH_SIZE : recordBatchSize;
        preprocessorVersion = preprocessorVersion == null ? DEFAULT_PREPROCESSOR_VERSION : preprocessorVersion;
        policy = policy == null ? Policy.defaults() : policy;
        if (!(timeStepHours > 0.0)) {
            throw new IllegalArgumentException("hydro.time-step-hours must be positive");
        }
        if (recordBatchSize <= 0) {
            throw new IllegalArgumentException("hydro.record-batch-size must be positive");
        }
    }

    public static HydroProperties defaults() {
        return new HydroProperties(null, null, null, null);
    }

    /**
     * Release policy tuning ({@code hydro.policy.*}).
     */
    public record Policy(
            Double tolerancePercent,
            Double runOfRiverTargetPercent,
            Double defaultTargetPercent,
            Double floodMaxStoragePercent,
            Double floodReleaseFactor,
            Double inflowMaxReleaseFactor,
            Double minimumBandWidthCfs,
            List<Integer> winterMonths
    ) {

        public static Policy defaults() {
            return new Policy(null, null, null, null, null, null, null, null);
        }

        public ReleasePolicyParameters toParameters() {
            ReleasePolicyParameters d = ReleasePolicyParameters.defaults();
            return ReleasePolicyParameters.builder()
                    .tolerancePercent(orDefault(tolerancePercent, d.tolerancePercent()))
                    .runOfRiverTargetPercent(orDefault(runOfRiverTargetPercent, d.runOfRiverTargetPercent()))
                    .defaultTargetPercent(orDefault(defaultTargetPercent, d.defaultTargetPercent()))
                    .defaultFloodMaxStoragePercent(orDefault(floodMaxStoragePercent, d.defaultFloodMaxStoragePercent()))
                    .floodReleaseFactor(orDefault(floodReleaseFactor, d.floodReleaseFactor()))
                    .inflowMaxReleaseFactor(orDefault(inflowMaxReleaseFactor, d.inflowMaxReleaseFactor()))
                    .minimumBandWidthCfs(orDefault(minimumBandWidthCfs, d.minimumBandWidthCfs()))
                    .winterMonths(winterMonths == null ? d.winterMonths() : Set.copyOf(winterMonths))
                    .build();
        }

        private static double orDefault(Double value, double fallback) {
            return value == null ? fallback : value;
        }
    }
}
