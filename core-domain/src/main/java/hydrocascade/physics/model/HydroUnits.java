package hydrocascade.physics.model;

/**
 * Constantes y conversiones de unidades del balance de masas.
 * <p>
 * El motor trabaja en unidades imperiales: volúmenes en acre-pies (AF), caudales en
 * pies cúbicos por segundo (cfs) y cotas en pies.
 */
public final class HydroUnits {

    /** Pies cúbicos en un acre-pie. */
    public static final double CUBIC_FEET_PER_ACRE_FOOT = 43_560.0;

    public static final double FEET_PER_METER = 3.28084;

    /** Acre-pies en un hectómetro cúbico (millón de m³). */
    public static final double ACRE_FEET_PER_MCM = 1_233.48;

    public static final double SECONDS_PER_HOUR = 3_600.0;

    private HydroUnits() {}

    /**
     * Volumen [AF] que transporta un caudal constante durante un intervalo.
     */
    public static double flowToVolume(double flowCfs, double seconds) {
        return flowCfs * seconds / CUBIC_FEET_PER_ACRE_FOOT;
    }

    /**
     * Caudal constante [cfs] que transporta un volumen en un intervalo.
     */
    public static double volumeToFlow(double volumeAf, double seconds) {
        return volumeAf * CUBIC_FEET_PER_ACRE_FOOT / seconds;
    }

    public static double metersToFeet(double meters) {
        return meters * FEET_PER_METER;
    }

    public static double mcmToAcreFeet(double mcm) {
        return mcm * ACRE_FEET_PER_MCM;
    }

    public static double hoursToSeconds(double hours) {
        return hours * SECONDS_PER_HOUR;
    }
}
