package steelconnect.domain.load;

/**
 * Punto en el plano de la unión (coordenadas locales y, z).
 */
public record Point2D(double y, double z) {

    public static final Point2D ORIGIN = new Point2D(0.0, 0.0);

    public Point2D {
        if (!Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException(String.format("Coordenadas no finitas: (%s, %s).", y, z));
        }
    }

    public double distanceTo(Point2D other) {
        return Math.hypot(y - other.y, z - other.z);
    }

    public Point2D translate(double dy, double dz) {
        return new Point2D(y + dy, z + dz);
    }
}
