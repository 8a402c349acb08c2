package steelconnect.domain.result;

import steelconnect.domain.analysis.ShearMethod;
import steelconnect.domain.load.Point2D;

import java.util.Optional;

/**
 * Reparto de las cargas en el plano, elemento a elemento.
 * <p>
 * Tiene dos variantes: {@link ElasticDistribution} e {@link IcrDistribution}.
 * La variante indica el método realmente aplicado, que puede diferir del
 * solicitado cuando el ICR recurre al reparto elástico.
 */
public interface InPlaneDistribution {

    ShearMethod method();

    int size();

    double componentY(int index);

    double componentZ(int index);

    /**
     * Centro instantáneo de rotación, solo presente en los resultados ICR.
     */
    default Optional<Point2D> instantaneousCenter() {
        return Optional.empty();
    }
}
