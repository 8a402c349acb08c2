package steelconnect.domain.analysis;

import steelconnect.exception.InvalidAnalysisModeException;

import java.util.Locale;

/**
 * Posición del eje neutro en el reparto de tracciones por flexión.
 */
public enum TensionMode {
    /** Eje neutro en el centro de la chapa de apoyo. */
    CONSERVATIVE("conservative"),
    /** Eje neutro a un sexto del canto de la chapa desde el borde comprimido. */
    ACCURATE("accurate");

    private final String label;

    TensionMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static TensionMode fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (TensionMode mode : values()) {
                if (mode.label.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new InvalidAnalysisModeException(
                "Modo de eje neutro desconocido: '" + label + "'. Use 'conservative' o 'accurate'.");
    }
}
