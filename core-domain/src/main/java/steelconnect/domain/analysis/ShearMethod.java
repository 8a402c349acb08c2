package steelconnect.domain.analysis;

import steelconnect.exception.InvalidAnalysisModeException;

import java.util.Locale;

/**
 * Método de reparto de las cargas en el plano de la unión.
 */
public enum ShearMethod {
    /** Superposición lineal con rotación rígida alrededor del centroide. */
    ELASTIC("elastic"),
    /** Equilibrio no lineal alrededor del centro instantáneo de rotación. */
    ICR("icr");

    private final String label;

    ShearMethod(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Traduce la etiqueta textual ("elastic" o "icr", sin distinguir mayúsculas).
     *
     * @throws InvalidAnalysisModeException si la etiqueta no corresponde a ningún método.
     */
    public static ShearMethod fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (ShearMethod method : values()) {
                if (method.label.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new InvalidAnalysisModeException("Método de cortante desconocido: '" + label + "'. Use 'elastic' o 'icr'.");
    }
}
