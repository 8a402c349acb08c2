package steelconnect.domain.result;

import steelconnect.domain.analysis.ShearMethod;

import java.util.Objects;

/**
 * Resultado del reparto elástico en el plano.
 */
public final class ElasticDistribution implements InPlaneDistribution {

    private final double[] componentY;
    private final double[] componentZ;

    public ElasticDistribution(double[] componentY, double[] componentZ) {
        Objects.requireNonNull(componentY, "El array de componentes y no puede ser nulo.");
        Objects.requireNonNull(componentZ, "El array de componentes z no puede ser nulo.");
        if (componentY.length != componentZ.length) {
            throw new IllegalArgumentException("Los arrays de componentes deben tener la misma longitud.");
        }
        this.componentY = componentY.clone();
        this.componentZ = componentZ.clone();
    }

    @Override
    public ShearMethod method() {
        return ShearMethod.ELASTIC;
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
}
