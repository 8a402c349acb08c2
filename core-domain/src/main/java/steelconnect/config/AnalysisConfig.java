package steelconnect.config;

import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Contenedor inmutable con todas las constantes numéricas y de modelo que usa el motor.
 * <p>
 * Agrupa las tolerancias generales con los parámetros de las dos leyes
 * fuerza-deformación y de la búsqueda del centro instantáneo de rotación.
 * No existe estado global mutable: cada analizador recibe su propia instancia.
 *
 * @param zeroTolerance     Umbral por debajo del cual una fuerza o momento se considera nulo.
 * @param positionTolerance Umbral de distancia (unidades de longitud) para considerar dos puntos coincidentes.
 * @param rowTolerance      Tolerancia para agrupar tornillos en una misma fila del eje neutro.
 * @param crawfordKulak     Parámetros de la ley de tornillos de Crawford-Kulak.
 * @param weldLaw           Parámetros de la ley direccional AISC para soldaduras en ángulo.
 * @param icrSearch         Parámetros de la búsqueda unidimensional del centro instantáneo.
 *
 * @author Duo Xu
 * @version 0.1
 */
@Builder
@With
public record AnalysisConfig(
        double zeroTolerance,
        double positionTolerance,
        double rowTolerance,
        CrawfordKulakParams crawfordKulak,
        WeldLawParams weldLaw,
        IcrSearchParams icrSearch
) {

    public AnalysisConfig {
        if (zeroTolerance <= 0 || positionTolerance <= 0 || rowTolerance <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Las tolerancias deben ser positivas (cero=%g, posición=%g, fila=%g).",
                    zeroTolerance, positionTolerance, rowTolerance));
        }
        Objects.requireNonNull(crawfordKulak, "Los parámetros de Crawford-Kulak no pueden ser nulos.");
        Objects.requireNonNull(weldLaw, "Los parámetros de la ley de soldadura no pueden ser nulos.");
        Objects.requireNonNull(icrSearch, "Los parámetros de búsqueda ICR no pueden ser nulos.");
    }

    /**
     * Configuración de referencia usada por los analizadores cuando no se indica otra.
     */
    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder()
                .zeroTolerance(1e-12)
                .positionTolerance(1e-9)
                .rowTolerance(1e-6)
                .crawfordKulak(CrawfordKulakParams.defaults())
                .weldLaw(WeldLawParams.defaults())
                .icrSearch(IcrSearchParams.defaults())
                .build();
    }

    /**
     * Constantes de la curva R = R_ult·(1 - e^(-μρ))^λ.
     *
     * @param mu                  Coeficiente μ de la exponencial.
     * @param lambda              Exponente λ.
     * @param ultimateDeformation Deformación última Δ_ult del tornillo crítico (mm).
     * @param ultimateStrength    Resistencia última R_ult. Se cancela en el reescalado.
     */
    @Builder
    @With
    public record CrawfordKulakParams(double mu, double lambda, double ultimateDeformation, double ultimateStrength) {

        public CrawfordKulakParams {
            if (mu <= 0 || lambda <= 0 || ultimateDeformation <= 0 || ultimateStrength <= 0) {
                throw new IllegalArgumentException("Los parámetros de Crawford-Kulak deben ser positivos.");
            }
        }

        public static CrawfordKulakParams defaults() {
            return new CrawfordKulakParams(10.0, 0.55, 8.64, 100.0);
        }
    }

    /**
     * Parámetros de la ley direccional de soldaduras en ángulo.
     *
     * @param electrodeStrength Resistencia del electrodo F_EXX (MPa).
     * @param minStrainRatio    Límite inferior de p = Δ/Δm, evita potencias de cero.
     * @param maxStrainRatio    Límite superior de p.
     */
    @Builder
    @With
    public record WeldLawParams(double electrodeStrength, double minStrainRatio, double maxStrainRatio) {

        public WeldLawParams {
            if (electrodeStrength <= 0) {
                throw new IllegalArgumentException("La resistencia del electrodo debe ser positiva: " + electrodeStrength);
            }
            if (minStrainRatio <= 0 || maxStrainRatio <= minStrainRatio) {
                throw new IllegalArgumentException(String.format(
                        "Rango de deformación normalizada inválido [%g, %g].", minStrainRatio, maxStrainRatio));
            }
        }

        public static WeldLawParams defaults() {
            return new WeldLawParams(483.0, 1e-6, 2.1);
        }
    }

    /**
     * Parámetros de la búsqueda del centro instantáneo a lo largo de la recta de búsqueda.
     *
     * @param maxIterations        Límite de iteraciones de la bisección.
     * @param tolerance            Tolerancia relativa del residuo h(d), escalada por max(1, e).
     * @param candidateCount       Número de candidatos del barrido logarítmico inicial.
     * @param maxBracketExpansions Veces que se multiplica por 10 el límite superior si no hay cambio de signo.
     */
    @Builder
    @With
    public record IcrSearchParams(int maxIterations, double tolerance, int candidateCount, int maxBracketExpansions) {

        public IcrSearchParams {
            if (maxIterations <= 0 || candidateCount < 2 || maxBracketExpansions < 0) {
                throw new IllegalArgumentException(String.format(
                        "Parámetros de búsqueda ICR inválidos (iteraciones=%d, candidatos=%d, expansiones=%d).",
                        maxIterations, candidateCount, maxBracketExpansions));
            }
            if (tolerance <= 0) {
                throw new IllegalArgumentException("La tolerancia ICR debe ser positiva: " + tolerance);
            }
        }

        public static IcrSearchParams defaults() {
            return new IcrSearchParams(100, 1e-6, 60, 6);
        }
    }
}
