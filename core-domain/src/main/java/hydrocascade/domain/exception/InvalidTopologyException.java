package hydrocascade.domain.exception;

/**
 * La descripción de la cascada es inconsistente: claves obligatorias ausentes,
 * identificadores duplicados, enlaces a embalses inexistentes o ciclos.
 */
public class InvalidTopologyException extends HydroConfigurationException {

    public InvalidTopologyException(String message) {
        super(message);
    }
}
