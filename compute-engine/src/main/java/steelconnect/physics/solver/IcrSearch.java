package steelconnect.physics.solver;

import lombok.extern.slf4j.Slf4j;
import steelconnect.config.AnalysisConfig.IcrSearchParams;
import steelconnect.exception.IcrConvergenceException;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * Búsqueda unidimensional de la distancia d entre el centroide y el centro instantáneo.
 * <p>
 * Primero barre candidatos espaciados logarítmicamente buscando un cambio de signo del
 * residuo; si no lo encuentra amplía el límite superior. Después refina por bisección.
 * Nunca acepta un resultado fuera de tolerancia: lanza {@link IcrConvergenceException}.
 */
@Slf4j
public final class IcrSearch {

    /**
     * Prohibido construir esta clase utilidad
     */
    private IcrSearch() {
    }

    /**
     * Raíz hallada.
     *
     * @param distance   Distancia d del centro instantáneo al centroide.
     * @param residual   |h(d)| final.
     * @param iterations Evaluaciones del residuo consumidas.
     */
    public record Root(double distance, double residual, int iterations) {
    }

    /**
     * Límites de búsqueda a partir de la extensión del grupo, la excentricidad y la
     * dimensión característica del elemento.
     *
     * @return {dMin, dMax}
     */
    public static double[] searchBounds(double[] y, double[] z, double eccentricity,
                                        double characteristicSize, double positionTolerance) {
        double spanY = y.length > 1 ? Arrays.stream(y).max().orElse(0) - Arrays.stream(y).min().orElse(0) : 0.0;
        double spanZ = z.length > 1 ? Arrays.stream(z).max().orElse(0) - Arrays.stream(z).min().orElse(0) : 0.0;
        double charLength = Math.max(Math.max(spanY, spanZ), Math.max(2.0 * characteristicSize, 1.0));

        double dMin = Math.max(positionTolerance, Math.max(0.02 * charLength, 0.1 * characteristicSize));
        double dMax = Math.max(50.0 * dMin, Math.max(10.0 * charLength, 5.0 * eccentricity));
        return new double[]{dMin, dMax};
    }

    /**
     * Encuentra d tal que h(d) = 0.
     *
     * @param residual     Función residuo. Puede devolver NaN en distancias no evaluables.
     * @param dMin         Límite inferior (> 0).
     * @param dMax         Límite superior inicial.
     * @param eccentricity Excentricidad |mx|/P, usada como candidato y para escalar la tolerancia.
     * @param params       Parámetros de búsqueda.
     * @return La raíz dentro de tolerancia.
     * @throws IcrConvergenceException si no hay cambio de signo o se agota el límite de iteraciones.
     */
    public static Root findRoot(DoubleUnaryOperator residual, double dMin, double dMax,
                                double eccentricity, IcrSearchParams params) {
        final double tolerance = params.tolerance() * Math.max(1.0, eccentricity);

        double[] candidates = logSpace(dMin, dMax, params.candidateCount());
        if (eccentricity > dMin && eccentricity < dMax) {
            candidates = Arrays.copyOf(candidates, candidates.length + 1);
            candidates[candidates.length - 1] = eccentricity;
            Arrays.sort(candidates);
        }

        int evaluations = 0;
        double bestResidual = Double.POSITIVE_INFINITY;
        double prevD = Double.NaN;
        double prevH = Double.NaN;
        double lo = Double.NaN;
        double hLo = Double.NaN;
        double hi = Double.NaN;

        // Fase 1: barrido grueso
        for (double d : candidates) {
            double h = residual.applyAsDouble(d);
            evaluations++;
            if (!Double.isFinite(h)) {
                continue;
            }
            bestResidual = Math.min(bestResidual, Math.abs(h));
            if (Math.abs(h) <= tolerance) {
                return new Root(d, Math.abs(h), evaluations);
            }
            if (!Double.isNaN(prevH) && Double.isNaN(lo) && prevH * h < 0) {
                lo = prevD;
                hLo = prevH;
                hi = d;
            }
            prevD = d;
            prevH = h;
        }

        // Ampliación del límite superior cuando la excentricidad es muy pequeña
        int expansions = 0;
        while (Double.isNaN(lo) && !Double.isNaN(prevH) && prevH > 0 && expansions < params.maxBracketExpansions()) {
            double d = prevD * 10.0;
            double h = residual.applyAsDouble(d);
            evaluations++;
            expansions++;
            if (!Double.isFinite(h)) {
                break;
            }
            bestResidual = Math.min(bestResidual, Math.abs(h));
            if (Math.abs(h) <= tolerance) {
                return new Root(d, Math.abs(h), evaluations);
            }
            if (prevH * h < 0) {
                lo = prevD;
                hLo = prevH;
                hi = d;
            }
            prevD = d;
            prevH = h;
        }

        if (Double.isNaN(lo)) {
            throw new IcrConvergenceException(String.format(
                    "No se encontró un intervalo con cambio de signo en [%g, %g]. Mejor residuo: %g",
                    dMin, prevD, bestResidual), evaluations, bestResidual);
        }
        log.debug("Intervalo ICR encontrado: [{}, {}] tras {} evaluaciones", lo, hi, evaluations);

        // Fase 2: bisección
        for (int i = 0; i < params.maxIterations(); i++) {
            double mid = 0.5 * (lo + hi);
            double h = residual.applyAsDouble(mid);
            evaluations++;
            if (!Double.isFinite(h)) {
                break;
            }
            bestResidual = Math.min(bestResidual, Math.abs(h));
            if (Math.abs(h) <= tolerance) {
                return new Root(mid, Math.abs(h), evaluations);
            }
            if (hLo * h < 0) {
                hi = mid;
            } else {
                lo = mid;
                hLo = h;
            }
        }

        throw new IcrConvergenceException(String.format(
                "La bisección ICR no alcanzó la tolerancia %g en %d iteraciones. Mejor residuo: %g",
                tolerance, params.maxIterations(), bestResidual), evaluations, bestResidual);
    }

    private static double[] logSpace(double from, double to, int count) {
        double[] values = new double[count];
        double logFrom = Math.log(from);
        double step = (Math.log(to) - logFrom) / (count - 1);
        for (int i = 0; i < count; i++) {
            values[i] = Math.exp(logFrom + i * step);
        }
        values[count - 1] = to;
        return values;
    }
}
