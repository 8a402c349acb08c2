package steelconnect.exception;

import lombok.Getter;

/**
 * El solver ICR no alcanzó la tolerancia de residuo dentro del límite de iteraciones
 * o no encontró un intervalo con cambio de signo.
 * <p>
 * Es un error distinto de los geométricos para que el llamador pueda reintentar
 * con el método elástico.
 */
@Getter
public class IcrConvergenceException extends ConnectionAnalysisException {

    /** Iteraciones consumidas antes de abandonar la búsqueda. */
    private final int iterations;

    /** Mejor residuo |h(d)| observado, en unidades de longitud. */
    private final double bestResidual;

    public IcrConvergenceException(String message, int iterations, double bestResidual) {
        super(message);
        this.iterations = iterations;
        this.bestResidual = bestResidual;
    }
}
