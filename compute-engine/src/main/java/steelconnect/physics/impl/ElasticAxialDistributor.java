package steelconnect.physics.impl;

import steelconnect.config.AnalysisConfig;
import steelconnect.domain.analysis.BendingAxis;
import steelconnect.domain.geometry.ElementGroup;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.load.Load;
import steelconnect.domain.load.Point2D;
import steelconnect.exception.DegenerateGeometryException;
import steelconnect.physics.i.IAxialDistributor;

import java.util.Objects;

/**
 * Demanda axial elástica fuera del plano: fx/A más la flexión de cada eje.
 * <p>
 * La flexión suma my·Δz/Iy + mz·Δy/Iz: un momento positivo tracciona el lado de
 * coordenada positiva.
 * El resultado tiene signo (tracción positiva) y no se recorta.
 */
public class ElasticAxialDistributor implements IAxialDistributor<ElementGroup> {

    private final double zeroTolerance;

    public ElasticAxialDistributor(AnalysisConfig config) {
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.zeroTolerance = config.zeroTolerance();
    }

    @Override
    public double[] distribute(ElementGroup group, SectionProperties properties, Load loadAtCentroid) {
        int n = group.size();
        double[] axial = new double[n];
        double direct = loadAtCentroid.fx() / properties.totalWeight();
        for (int i = 0; i < n; i++) {
            axial[i] = direct;
        }

        for (BendingAxis axis : BendingAxis.values()) {
            double moment = axis.moment(loadAtCentroid);
            if (Math.abs(moment) <= zeroTolerance) {
                continue;
            }
            double inertia = axis.inertia(properties);
            if (inertia <= zeroTolerance) {
                throw new DegenerateGeometryException(String.format(
                        "Inercia nula alrededor del eje %s con momento %g.", axis, moment));
            }
            double centroid = axis.centroidCoordinate(properties);
            for (int i = 0; i < n; i++) {
                Point2D p = group.positionAt(i);
                axial[i] += moment * (axis.coordinate(p) - centroid) / inertia;
            }
        }
        return axial;
    }
}
