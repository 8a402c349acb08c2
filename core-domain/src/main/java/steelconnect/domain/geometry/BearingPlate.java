package steelconnect.domain.geometry;

import steelconnect.domain.load.Point2D;
import steelconnect.exception.DegenerateGeometryException;

/**
 * Chapa de apoyo rectangular alineada con los ejes y-z.
 * <p>
 * Solo aporta su extensión, necesaria para localizar el borde comprimido
 * y el eje neutro en el reparto de tracciones.
 */
public record BearingPlate(double yMin, double yMax, double zMin, double zMax) {

    public BearingPlate {
        if (!(yMax - yMin > 0) || !(zMax - zMin > 0)) {
            throw new DegenerateGeometryException(String.format(
                    "La chapa debe tener canto positivo en ambos ejes (y=[%g, %g], z=[%g, %g]).",
                    yMin, yMax, zMin, zMax));
        }
    }

    /**
     * Chapa de ancho (según y) y alto (según z) dados centrada en {@code center}.
     */
    public static BearingPlate centeredAt(Point2D center, double width, double height) {
        return new BearingPlate(center.y() - width / 2.0, center.y() + width / 2.0,
                center.z() - height / 2.0, center.z() + height / 2.0);
    }

    public static BearingPlate fromCorners(Point2D a, Point2D b) {
        return new BearingPlate(Math.min(a.y(), b.y()), Math.max(a.y(), b.y()),
                Math.min(a.z(), b.z()), Math.max(a.z(), b.z()));
    }

    public double width() {
        return yMax - yMin;
    }

    public double height() {
        return zMax - zMin;
    }
}
