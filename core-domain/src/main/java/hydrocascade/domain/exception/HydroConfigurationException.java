package hydrocascade.domain.exception;

/**
 * Error de configuración de una cascada. Es fatal para la operación en curso:
 * no se reintenta ni se recupera.
 */
public class HydroConfigurationException extends RuntimeException {

    public HydroConfigurationException(String message) {
        super(message);
    }

    public HydroConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
