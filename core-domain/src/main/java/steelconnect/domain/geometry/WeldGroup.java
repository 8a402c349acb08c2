package steelconnect.domain.geometry;

import lombok.Getter;
import steelconnect.domain.load.Point2D;
import steelconnect.exception.DegenerateGeometryException;

import java.util.List;
import java.util.Objects;

/**
 * Cordón (o conjunto de cordones) de soldadura discretizado en segmentos rectos.
 * <p>
 * El peso de cada segmento es su área efectiva, garganta × longitud.
 * La tangente local se conserva porque la ley direccional del ICR
 * depende del ángulo entre la fuerza y el cordón.
 *
 * @author Duo Xu
 * @version 0.1
 */
public final class WeldGroup implements ElementGroup {

    private final List<WeldSegment> segments;

    @Getter
    private final WeldParams params;

    /**
     * Si es falso, el factor direccional k_ds se fuerza a 1.
     * Es el caso de las uniones de extremo en perfiles tubulares rectangulares.
     */
    @Getter
    private final boolean directionalStrengthIncrease;

    public WeldGroup(List<WeldSegment> segments, WeldParams params, boolean directionalStrengthIncrease) {
        Objects.requireNonNull(segments, "La lista de segmentos no puede ser nula.");
        Objects.requireNonNull(params, "Los parámetros de soldadura no pueden ser nulos.");
        if (segments.isEmpty()) {
            throw new DegenerateGeometryException("Un grupo de soldadura debe contener al menos un segmento.");
        }
        this.segments = List.copyOf(segments);
        this.params = params;
        this.directionalStrengthIncrease = directionalStrengthIncrease;
    }

    public WeldGroup(List<WeldSegment> segments, WeldParams params) {
        this(segments, params, true);
    }

    @Override
    public GroupKind getKind() {
        return GroupKind.WELD;
    }

    @Override
    public int size() {
        return segments.size();
    }

    @Override
    public Point2D positionAt(int index) {
        return segments.get(index).midpoint();
    }

    @Override
    public double weightAt(int index) {
        return params.throat() * segments.get(index).length();
    }

    @Override
    public double lengthAt(int index) {
        return segments.get(index).length();
    }

    /**
     * dA·ds²·t_z²/12: contribución de un segmento recto inclinado sobre su punto medio.
     */
    @Override
    public double ownInertiaY(int index) {
        WeldSegment s = segments.get(index);
        return weightAt(index) * s.length() * s.length() * s.tangentZ() * s.tangentZ() / 12.0;
    }

    @Override
    public double ownInertiaZ(int index) {
        WeldSegment s = segments.get(index);
        return weightAt(index) * s.length() * s.length() * s.tangentY() * s.tangentY() / 12.0;
    }

    public WeldSegment segmentAt(int index) {
        return segments.get(index);
    }

    public List<WeldSegment> getSegments() {
        return segments;
    }

    public WeldType getType() {
        return params.type();
    }

}
