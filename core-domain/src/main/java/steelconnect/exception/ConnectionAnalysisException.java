package steelconnect.exception;

/**
 * Raíz de los errores que puede producir un análisis de unión.
 * <p>
 * Todos los errores se propagan de forma síncrona al llamador inmediato.
 * Ningún error se sustituye por una demanda nula o por un valor por defecto.
 */
public class ConnectionAnalysisException extends RuntimeException {

    public ConnectionAnalysisException(String message) {
        super(message);
    }

    public ConnectionAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
