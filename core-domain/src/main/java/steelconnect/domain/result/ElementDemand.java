package steelconnect.domain.result;

import steelconnect.domain.load.Point2D;

/**
 * Demanda sobre un elemento individual del grupo.
 * <p>
 * Las componentes son fuerzas para tornillos y tensiones para segmentos de soldadura.
 *
 * @param index             Índice del elemento en el grupo.
 * @param position          Posición del elemento (punto medio para soldadura).
 * @param inPlaneY          Componente y en el plano.
 * @param inPlaneZ          Componente z en el plano.
 * @param axial             Componente axial con signo, positiva en tracción.
 * @param directionalFactor Factor k_ds de la soldadura según el ángulo de la demanda (1 para tornillos).
 */
public record ElementDemand(int index, Point2D position,
                            double inPlaneY, double inPlaneZ, double axial,
                            double directionalFactor) {

    public double inPlaneResultant() {
        return Math.hypot(inPlaneY, inPlaneZ);
    }

    /**
     * Módulo total combinando la resultante en el plano y la componente axial.
     */
    public double resultant() {
        return Math.sqrt(inPlaneY * inPlaneY + inPlaneZ * inPlaneZ + axial * axial);
    }

    /**
     * Ángulo de la demanda en el plano, en grados desde el eje y.
     */
    public double inPlaneAngleDegrees() {
        return Math.toDegrees(Math.atan2(inPlaneZ, inPlaneY));
    }
}
