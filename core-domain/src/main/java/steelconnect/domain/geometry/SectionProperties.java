package steelconnect.domain.geometry;

import steelconnect.domain.load.Point2D;
import steelconnect.domain.load.Point3D;

/**
 * Resumen de centroide e inercias de un grupo de elementos.
 * <p>
 * Para tornillos el peso es unitario y las inercias tienen unidades de longitud²;
 * para soldaduras el peso es área y las inercias son longitud⁴.
 *
 * @param cy          Coordenada y del centroide.
 * @param cz          Coordenada z del centroide.
 * @param totalWeight Número de tornillos o área total de soldadura.
 * @param totalLength Longitud total del cordón (0 para tornillos).
 * @param iy          Σ w·Δz², inercia para flexión alrededor de y.
 * @param iz          Σ w·Δy², inercia para flexión alrededor de z.
 */
public record SectionProperties(double cy, double cz, double totalWeight, double totalLength,
                                double iy, double iz) {

    /**
     * Momento polar respecto al centroide.
     */
    public double ip() {
        return iy + iz;
    }

    public Point2D centroid() {
        return new Point2D(cy, cz);
    }

    /**
     * Centroide como punto de referencia para trasladar cargas (x = 0).
     */
    public Point3D centroid3D() {
        return new Point3D(0.0, cy, cz);
    }
}
