package steelconnect.domain.geometry;

import steelconnect.domain.load.Point2D;

/**
 * Conjunto ordenado y no vacío de elementos discretos en el plano de la unión.
 * <p>
 * Las implementaciones son inmutables. El orden de los elementos define el índice
 * de cada registro de demanda.
 */
public interface ElementGroup {

    GroupKind getKind();

    /**
     * Número de elementos del grupo (siempre mayor que cero).
     */
    int size();

    Point2D positionAt(int index);

    /**
     * Peso del elemento en el cálculo de centroide e inercias: 1 para tornillos,
     * área efectiva (garganta × longitud) para segmentos de soldadura.
     */
    double weightAt(int index);

    /**
     * Longitud del elemento. Cero para elementos puntuales.
     */
    default double lengthAt(int index) {
        return 0.0;
    }

    /**
     * Segundo momento del elemento respecto a su propio centro, para flexión alrededor de y.
     * Cero para elementos puntuales.
     */
    default double ownInertiaY(int index) {
        return 0.0;
    }

    /**
     * Segundo momento del elemento respecto a su propio centro, para flexión alrededor de z.
     */
    default double ownInertiaZ(int index) {
        return 0.0;
    }
}
