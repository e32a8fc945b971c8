package hydrocascade.domain.exception;

import lombok.Getter;

/**
 * Se pidió una simulación sobre una cascada cuya topología no ha sido cargada.
 */
@Getter
public class CascadeNotLoadedException extends HydroConfigurationException {

    private final String cascadeId;

    public CascadeNotLoadedException(String cascadeId) {
        super("Cascade " + cascadeId + " not loaded");
        this.cascadeId = cascadeId;
    }
}
