package steelconnect.exception;

/**
 * Error de uso: combinación de método, tipo de grupo y carga que el motor no admite.
 * Indica una violación del contrato por parte del llamador, no un fallo numérico.
 */
public class InvalidAnalysisModeException extends ConnectionAnalysisException {

    public InvalidAnalysisModeException(String message) {
        super(message);
    }
}
