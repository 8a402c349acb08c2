package steelconnect.domain.result;

import lombok.Getter;
import steelconnect.domain.analysis.ShearMethod;
import steelconnect.domain.load.Point2D;

import java.util.Objects;
import java.util.Optional;

/**
 * Resultado del reparto por centro instantáneo de rotación.
 * <p>
 * Además de las componentes, conserva el centro hallado y los datos de
 * convergencia como información de diagnóstico.
 */
@Getter
public final class IcrDistribution implements InPlaneDistribution {

    private final double[] componentY;
    private final double[] componentZ;
    private final Point2D center;
    /** Distancia del centro instantáneo al centroide. */
    private final double centerDistance;
    private final int iterations;
    /** Residuo final |h(d)| del equilibrio de momentos, en unidades de longitud. */
    private final double residual;

    public IcrDistribution(double[] componentY, double[] componentZ, Point2D center,
                           double centerDistance, int iterations, double residual) {
        Objects.requireNonNull(componentY, "El array de componentes y no puede ser nulo.");
        Objects.requireNonNull(componentZ, "El array de componentes z no puede ser nulo.");
        Objects.requireNonNull(center, "El centro instantáneo no puede ser nulo.");
        if (componentY.length != componentZ.length) {
            throw new IllegalArgumentException("Los arrays de componentes deben tener la misma longitud.");
        }
        this.componentY = componentY.clone();
        this.componentZ = componentZ.clone();
        this.center = center;
        this.centerDistance = centerDistance;
        this.iterations = iterations;
        this.residual = residual;
    }

    @Override
    public ShearMethod method() {
        return ShearMethod.ICR;
    }

    @Override
    public int size() {
        return componentY.length;
    }

    @Override
    public double componentY(int index) {
        return componentY[index];
    }

    @Override
    public double componentZ(int index) {
        return componentZ[index];
    }

    @Override
    public Optional<Point2D> instantaneousCenter() {
        return Optional.of(center);
    }

    public double[] getComponentY() {
        return componentY.clone();
    }

    public double[] getComponentZ() {
        return componentZ.clone();
    }
}
