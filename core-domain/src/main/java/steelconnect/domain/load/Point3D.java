package steelconnect.domain.load;

/**
 * Punto de aplicación de una carga. El eje x es el eje de la barra,
 * normal al plano de la unión.
 */
public record Point3D(double x, double y, double z) {

    public static final Point3D ORIGIN = new Point3D(0.0, 0.0, 0.0);

    public Point3D {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException(String.format("Coordenadas no finitas: (%s, %s, %s).", x, y, z));
        }
    }

    /**
     * Punto en el plano x = 0 con las coordenadas en el plano dadas.
     */
    public static Point3D inPlane(Point2D point) {
        return new Point3D(0.0, point.y(), point.z());
    }
}
