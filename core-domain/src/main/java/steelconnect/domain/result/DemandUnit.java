package steelconnect.domain.result;

/**
 * Magnitud en la que se expresan las demandas de un resultado.
 */
public enum DemandUnit {
    /** Fuerza por tornillo (N). */
    FORCE,
    /** Tensión en la garganta del segmento de soldadura (MPa). */
    STRESS
}
