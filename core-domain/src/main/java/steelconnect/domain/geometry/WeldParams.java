package steelconnect.domain.geometry;

import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Propiedades de sección comunes a todos los segmentos de un cordón.
 *
 * @param type   Tipo de soldadura.
 * @param leg    Lado del cordón w (mm). Obligatorio en soldaduras en ángulo.
 * @param throat Garganta efectiva (mm). Si no es positiva y el cordón es en ángulo se usa 0.707·w.
 */
@Builder
@With
public record WeldParams(WeldType type, double leg, double throat) {

    /** Relación garganta/lado de un cordón en ángulo de lados iguales. */
    public static final double FILLET_THROAT_RATIO = 0.707;

    public WeldParams {
        Objects.requireNonNull(type, "El tipo de soldadura no puede ser nulo.");
        if (type == WeldType.FILLET && !(leg > 0)) {
            throw new IllegalArgumentException("Una soldadura en ángulo necesita un lado positivo: " + leg);
        }
        if (!(throat > 0)) {
            if (type != WeldType.FILLET) {
                throw new IllegalArgumentException("La garganta efectiva debe ser positiva: " + throat);
            }
            throat = FILLET_THROAT_RATIO * leg;
        }
    }

    public static WeldParams fillet(double leg) {
        return new WeldParams(WeldType.FILLET, leg, 0.0);
    }
}
