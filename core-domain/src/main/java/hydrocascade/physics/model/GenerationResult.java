package hydrocascade.physics.model;

/**
 * Generación instantánea y rendimiento con el que se obtuvo.
 *
 * @param generationMw      Potencia [MW].
 * @param efficiencyPercent Rendimiento de turbinas [%].
 */
public record GenerationResult(double generationMw, double efficiencyPercent) {

    public static final GenerationResult NONE = new GenerationResult(0.0, 0.0);
}
