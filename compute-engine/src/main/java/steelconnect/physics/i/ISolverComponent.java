package steelconnect.physics.i;

/**
 * Contrato base de los componentes numéricos del motor.
 * Permite identificar cada distribuidor o ley en los mensajes de log
 * sin conocer su implementación.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "ICR", "Crawford-Kulak").
     */
    String getName();

    /**
     * Descripción técnica del modelo que implementa.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
