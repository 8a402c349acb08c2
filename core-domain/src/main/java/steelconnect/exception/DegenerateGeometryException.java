package steelconnect.exception;

/**
 * La geometría no permite el cálculo: grupo vacío, peso total nulo,
 * inercia nula frente a un momento no nulo o ninguna fila en el lado traccionado.
 */
public class DegenerateGeometryException extends ConnectionAnalysisException {

    public DegenerateGeometryException(String message) {
        super(message);
    }
}
