package steelconnect.physics.i;

import steelconnect.domain.geometry.ElementGroup;
import steelconnect.physics.solver.IcrTrialState;

/**
 * Ley fuerza-deformación no lineal usada por el solver ICR.
 * <p>
 * La ley se elige según el tipo de grupo al construir el distribuidor,
 * nunca inspeccionando el grupo en tiempo de ejecución.
 *
 * @param <G> Tipo de grupo al que se aplica la ley.
 */
public interface ILoadDeformationLaw<G extends ElementGroup> extends ISolverComponent {

    /**
     * Fuerza resistente de cada elemento para un centro de prueba.
     * Los elementos con distancia nula al centro pueden devolver cualquier valor:
     * el solver los anula.
     *
     * @param group Grupo de elementos.
     * @param state Distancias y direcciones de fuerza para el centro de prueba.
     * @return Fuerza sin escalar de cada elemento (>= 0).
     */
    double[] resistances(G group, IcrTrialState state);

    /**
     * Dimensión característica del elemento (diámetro del tornillo, lado del cordón),
     * usada para acotar la búsqueda del centro instantáneo.
     */
    double characteristicSize(G group);
}
