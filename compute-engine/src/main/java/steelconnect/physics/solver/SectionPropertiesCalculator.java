package steelconnect.physics.solver;

import steelconnect.domain.geometry.ElementGroup;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.load.Point2D;
import steelconnect.exception.DegenerateGeometryException;

/**
 * Calcula centroide e inercias de un grupo de elementos.
 * <p>
 * Los tornillos pesan 1 y las soldaduras su área efectiva. Las inercias incluyen
 * la contribución propia de cada segmento, que el grupo expone en
 * {@link ElementGroup#ownInertiaY(int)} y {@link ElementGroup#ownInertiaZ(int)}.
 * Esta clase es thread safe.
 */
public final class SectionPropertiesCalculator {

    /**
     * Prohibido construir esta clase utilidad
     */
    private SectionPropertiesCalculator() {
    }

    /**
     * @param group Grupo no vacío.
     * @return El resumen de centroide e inercias.
     * @throws DegenerateGeometryException si el peso total es nulo o no finito.
     */
    public static SectionProperties compute(ElementGroup group) {
        int n = group.size();
        if (n == 0) {
            throw new DegenerateGeometryException("No se pueden calcular propiedades de un grupo vacío.");
        }

        // Primera pasada: peso total y momentos estáticos
        double totalWeight = 0.0;
        double totalLength = 0.0;
        double sy = 0.0;
        double sz = 0.0;
        for (int i = 0; i < n; i++) {
            double w = group.weightAt(i);
            if (w < 0 || !Double.isFinite(w)) {
                throw new DegenerateGeometryException(String.format("Peso inválido en el elemento %d: %g", i, w));
            }
            Point2D p = group.positionAt(i);
            totalWeight += w;
            totalLength += group.lengthAt(i);
            sy += w * p.y();
            sz += w * p.z();
        }
        if (!(totalWeight > 0) || !Double.isFinite(totalWeight)) {
            throw new DegenerateGeometryException(String.format(
                    "El peso total del grupo es nulo o no finito (%g). Elementos: %d.", totalWeight, n));
        }
        double cy = sy / totalWeight;
        double cz = sz / totalWeight;

        // Segunda pasada: segundos momentos respecto al centroide
        double iy = 0.0;
        double iz = 0.0;
        for (int i = 0; i < n; i++) {
            double w = group.weightAt(i);
            Point2D p = group.positionAt(i);
            double dy = p.y() - cy;
            double dz = p.z() - cz;
            iy += w * dz * dz + group.ownInertiaY(i);
            iz += w * dy * dy + group.ownInertiaZ(i);
        }
        return new SectionProperties(cy, cz, totalWeight, totalLength, iy, iz);
    }
}
