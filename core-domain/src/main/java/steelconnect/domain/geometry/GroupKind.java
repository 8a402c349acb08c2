package steelconnect.domain.geometry;

/**
 * Naturaleza de los elementos de un grupo. Determina la ley fuerza-deformación
 * del ICR y si las demandas se expresan como fuerza o como tensión.
 */
public enum GroupKind {
    /** Tornillos puntuales con peso unitario. Demanda en fuerza. */
    FASTENER,
    /** Segmentos de un cordón de soldadura ponderados por área. Demanda en tensión. */
    WELD
}
