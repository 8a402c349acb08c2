package steelconnect.domain.load;

import lombok.Builder;
import lombok.With;

/**
 * Carga general de seis componentes aplicada en un punto.
 * <p>
 * Los momentos se interpretan siempre respecto a {@code location} y siguen la regla
 * de la mano derecha en torsión ({@code mx} positivo gira el grupo de y hacia z). Los
 * momentos de flexión se orientan por el lado que traccionan: {@code my} positivo
 * tracciona el lado +z y {@code mz} positivo tracciona el lado +y.
 * Las fuerzas están en N y los momentos en N·mm cuando las longitudes están en mm.
 *
 * @param fx       Fuerza axial (normal al plano de la unión), positiva en tracción.
 * @param fy       Cortante en el plano, dirección y.
 * @param fz       Cortante en el plano, dirección z.
 * @param mx       Torsión en el plano de la unión.
 * @param my       Flexión alrededor del eje y.
 * @param mz       Flexión alrededor del eje z.
 * @param location Punto de aplicación. Si es nulo se toma el origen.
 *
 * @author Duo Xu
 * @version 0.1
 */
@Builder(toBuilder = true)
@With
public record Load(double fx, double fy, double fz,
                   double mx, double my, double mz,
                   Point3D location) {

    public Load {
        double[] components = {fx, fy, fz, mx, my, mz};
        for (double c : components) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("Todas las componentes de la carga deben ser finitas.");
            }
        }
        if (location == null) {
            location = Point3D.ORIGIN;
        }
    }

    /**
     * Carga sin componentes aplicada en el punto indicado.
     */
    public static Load at(Point3D location) {
        return new Load(0, 0, 0, 0, 0, 0, location);
    }

    public static Load at(double x, double y, double z) {
        return at(new Point3D(x, y, z));
    }

    /**
     * Devuelve la carga equivalente aplicada en {@code target}.
     * <p>
     * Las fuerzas no cambian; el momento se incrementa con r × F, siendo
     * r = location - target el brazo desde el nuevo punto de referencia
     * hasta la línea de acción de la fuerza.
     *
     * @param target Nuevo punto de referencia.
     * @return Una nueva carga estáticamente equivalente.
     */
    public Load transferTo(Point3D target) {
        double rx = location.x() - target.x();
        double ry = location.y() - target.y();
        double rz = location.z() - target.z();

        double newMx = mx + ry * fz - rz * fy;
        double newMy = my + rz * fx - rx * fz;
        double newMz = mz + ry * fx - rx * fy;
        return new Load(fx, fy, fz, newMx, newMy, newMz, target);
    }

    /**
     * Momentos (mx, my, mz) de la carga respecto a un punto arbitrario.
     */
    public double[] momentsAbout(Point3D point) {
        Load moved = transferTo(point);
        return new double[]{moved.mx, moved.my, moved.mz};
    }

    /**
     * Módulo del cortante en el plano de la unión.
     */
    public double shearMagnitude() {
        return Math.hypot(fy, fz);
    }

    public double totalForceMagnitude() {
        return Math.sqrt(fx * fx + fy * fy + fz * fz);
    }

    /**
     * Indica si la carga tiene componentes fuera del plano (fx, my o mz)
     * por encima de la tolerancia dada.
     */
    public boolean hasOutOfPlaneComponents(double tolerance) {
        return Math.abs(fx) > tolerance || Math.abs(my) > tolerance || Math.abs(mz) > tolerance;
    }
}
