package steelconnect.domain.geometry;

/**
 * Tipos de soldadura admitidos. Solo la soldadura en ángulo tiene ley
 * fuerza-deformación direccional y por tanto admite el método ICR.
 */
public enum WeldType {
    FILLET(true),
    PJP(false),
    CJP(false);

    private final boolean supportsIcr;

    WeldType(boolean supportsIcr) {
        this.supportsIcr = supportsIcr;
    }

    public boolean supportsIcr() {
        return supportsIcr;
    }
}
