package steelconnect.domain.geometry;

import steelconnect.domain.load.Point2D;

/**
 * Sub-segmento recto de un cordón discretizado.
 *
 * @param midpoint Punto medio del segmento.
 * @param length   Longitud ds (> 0).
 * @param tangentY Componente y de la tangente unitaria.
 * @param tangentZ Componente z de la tangente unitaria.
 */
public record WeldSegment(Point2D midpoint, double length, double tangentY, double tangentZ) {

    public WeldSegment {
        if (midpoint == null) {
            throw new IllegalArgumentException("El punto medio del segmento no puede ser nulo.");
        }
        if (!(length > 0) || !Double.isFinite(length)) {
            throw new IllegalArgumentException("La longitud del segmento debe ser positiva y finita: " + length);
        }
        double norm = Math.hypot(tangentY, tangentZ);
        if (!(norm > 0) || !Double.isFinite(norm)) {
            throw new IllegalArgumentException("La tangente del segmento no puede ser nula.");
        }
        tangentY /= norm;
        tangentZ /= norm;
    }

    /**
     * Segmento recto entre dos puntos.
     */
    public static WeldSegment between(Point2D start, Point2D end) {
        double dy = end.y() - start.y();
        double dz = end.z() - start.z();
        return new WeldSegment(
                new Point2D((start.y() + end.y()) / 2.0, (start.z() + end.z()) / 2.0),
                Math.hypot(dy, dz), dy, dz);
    }
}
