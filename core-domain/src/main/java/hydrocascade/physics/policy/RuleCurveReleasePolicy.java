package hydrocascade.physics.policy;

import hydrocascade.config.ReleasePolicyParameters;
import hydrocascade.domain.reservoir.FloodControlCurve;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.reservoir.RuleCurve;
import hydrocascade.physics.model.HydroUnits;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * Política de desembalse por curvas de regla estacionales.
 * <p>
 * Algoritmo:
 * <ol>
 * <li>Selecciona la curva de la temporada. Sin curva, el embalse es fluyente: desembalsa lo que entra.</li>
 * <li>Calcula el volumen objetivo y una banda de tolerancia alrededor.</li>
 * <li>Por encima de la banda desembalsa el excedente; por debajo retiene el déficit; dentro, desembalsa lo que entra.</li>
 * <li>Aplica el resguardo de avenidas y el caudal mínimo aguas abajo.</li>
 * <li>Satura al intervalo [desembalse mínimo, desembalse máximo].</li>
 * </ol>
 * Stateless y Thread-Safe.
 */
@RequiredArgsConstructor
public class RuleCurveReleasePolicy implements ReleasePolicy {

    @Getter
    private final ReleasePolicyParameters parameters;

    public RuleCurveReleasePolicy() {
        this(ReleasePolicyParameters.defaults());
    }

    @Override
    public double calculateRelease(Reservoir reservoir, double storageAf, double inflowCfs,
                                   Instant timestamp, double timeStepSeconds) {
        Season season = Season.of(timestamp, parameters.winterMonths());
        Optional<RuleCurve> selected = season.selectCurve(reservoir.seasonalRules());
        if (selected.isEmpty()) {
            return inflowCfs;
        }
        RuleCurve rule = selected.get();

        double capacityAf = reservoir.capacityAf();
        double targetPercent = rule.targetStoragePercent() != null
                ? rule.targetStoragePercent()
                : defaultTargetPercent(reservoir);
        double targetStorageAf = capacityAf * targetPercent / 100.0;

        double minRelease = Math.max(orZero(rule.minReleaseCfs()), orZero(reservoir.environmentalMinReleaseCfs()));
        double maxRelease = maxRelease(rule, reservoir, inflowCfs);
        maxRelease = Math.max(maxRelease, minRelease + parameters.minimumBandWidthCfs());

        double release = bandRelease(storageAf, inflowCfs, capacityAf, targetStorageAf,
                minRelease, maxRelease, timeStepSeconds);

        FloodControlCurve flood = reservoir.seasonalRules().floodControlCurve();
        if (flood != null && capacityAf > 0.0) {
            double floodThreshold = flood.maxStoragePercent() != null
                    ? flood.maxStoragePercent()
                    : parameters.defaultFloodMaxStoragePercent();
            double storagePercent = storageAf / capacityAf * 100.0;
            if (storagePercent > floodThreshold) {
                release = Math.max(release, Math.min(maxRelease, inflowCfs * parameters.floodReleaseFactor()));
            }
        }

        if (reservoir.downstreamMinReleaseCfs() != null) {
            release = Math.max(release, reservoir.downstreamMinReleaseCfs());
        }

        return Math.max(minRelease, Math.min(maxRelease, release));
    }

    private double bandRelease(double storageAf, double inflowCfs, double capacityAf, double targetStorageAf,
                               double minRelease, double maxRelease, double timeStepSeconds) {
        // Sin capacidad conocida no hay objetivo que perseguir
        if (capacityAf <= 0.0) {
            return inflowCfs;
        }
        double tolerance = capacityAf * parameters.tolerancePercent() / 100.0;

        if (storageAf > targetStorageAf + tolerance) {
            double surplusCfs = HydroUnits.volumeToFlow(storageAf - targetStorageAf, timeStepSeconds);
            return Math.min(inflowCfs + surplusCfs, maxRelease);
        }
        if (storageAf < targetStorageAf - tolerance) {
            double deficitCfs = HydroUnits.volumeToFlow(targetStorageAf - storageAf, timeStepSeconds);
            return Math.max(inflowCfs - deficitCfs, minRelease);
        }
        return inflowCfs;
    }

    private double maxRelease(RuleCurve rule, Reservoir reservoir, double inflowCfs) {
        if (rule.maxReleaseCfs() != null) return rule.maxReleaseCfs();
        if (reservoir.maxReleaseCfs() != null) return reservoir.maxReleaseCfs();
        return inflowCfs * parameters.inflowMaxReleaseFactor();
    }

    private double defaultTargetPercent(Reservoir reservoir) {
        return reservoir.isRunOfRiver()
                ? parameters.runOfRiverTargetPercent()
                : parameters.defaultTargetPercent();
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
