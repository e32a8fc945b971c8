package hydrocascade.physics.solver;

/**
 * Resultado del balance de un paso: volumen final y desembalse corregido.
 *
 * @param storageAf     Volumen al final del paso [AF].
 * @param releaseCfs    Desembalse tras la corrección por límites [cfs].
 * @param forcedClamp   {@code true} si hubo que saturar el volumen directamente porque la
 *                      corrección del desembalse no bastó (se pierde la conservación de masa).
 */
public record StorageBalance(double storageAf, double releaseCfs, boolean forcedClamp) {}
