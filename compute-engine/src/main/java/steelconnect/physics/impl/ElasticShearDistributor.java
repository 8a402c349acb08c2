package steelconnect.physics.impl;

import steelconnect.config.AnalysisConfig;
import steelconnect.domain.geometry.ElementGroup;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.load.Load;
import steelconnect.domain.load.Point2D;
import steelconnect.domain.result.ElasticDistribution;
import steelconnect.domain.result.InPlaneDistribution;
import steelconnect.exception.DegenerateGeometryException;
import steelconnect.physics.i.IInPlaneDistributor;

import java.util.Objects;

/**
 * Reparto elástico en el plano por superposición lineal.
 * <p>
 * Cada elemento recibe la parte directa F/W más la parte torsional
 * mx/Ip·(-Δz, Δy), perpendicular al radio desde el centroide.
 * Válido para tornillos y soldaduras: el resultado es demanda por unidad de peso.
 */
public class ElasticShearDistributor implements IInPlaneDistributor<ElementGroup> {

    private final double zeroTolerance;

    public ElasticShearDistributor(AnalysisConfig config) {
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.zeroTolerance = config.zeroTolerance();
    }

    @Override
    public String getName() {
        return "Elástico";
    }

    @Override
    public String getDescription() {
        return "Superposición lineal con rotación rígida alrededor del centroide";
    }

    @Override
    public InPlaneDistribution distribute(ElementGroup group, SectionProperties properties, Load loadAtCentroid) {
        int n = group.size();
        double directY = loadAtCentroid.fy() / properties.totalWeight();
        double directZ = loadAtCentroid.fz() / properties.totalWeight();

        double torsion = 0.0;
        if (Math.abs(loadAtCentroid.mx()) > zeroTolerance) {
            if (properties.ip() <= zeroTolerance) {
                throw new DegenerateGeometryException(String.format(
                        "Momento polar nulo (Ip=%g) con torsión mx=%g: la torsión no puede repartirse.",
                        properties.ip(), loadAtCentroid.mx()));
            }
            torsion = loadAtCentroid.mx() / properties.ip();
        }

        double[] qy = new double[n];
        double[] qz = new double[n];
        for (int i = 0; i < n; i++) {
            Point2D p = group.positionAt(i);
            double dy = p.y() - properties.cy();
            double dz = p.z() - properties.cz();
            qy[i] = directY - torsion * dz;
            qz[i] = directZ + torsion * dy;
        }
        return new ElasticDistribution(qy, qz);
    }
}
