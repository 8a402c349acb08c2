package steelconnect.domain.geometry;

import lombok.Builder;
import lombok.Getter;
import steelconnect.domain.load.Point2D;
import steelconnect.exception.DegenerateGeometryException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Grupo de tornillos idénticos en el plano de la unión.
 * <p>
 * Cada tornillo tiene peso unitario. La chapa de apoyo es opcional y solo se
 * requiere cuando la carga tiene componentes fuera del plano.
 *
 * @author Duo Xu
 * @version 0.1
 */
public final class FastenerGroup implements ElementGroup {

    private final double[] y;
    private final double[] z;

    /** Diámetro nominal del tornillo (mm). */
    @Getter
    private final double diameter;

    private final BearingPlate plate;

    /**
     * @param positions Posiciones de los tornillos. No puede ser nula ni vacía.
     * @param diameter  Diámetro nominal (> 0).
     * @param plate     Chapa de apoyo, puede ser nula.
     */
    @Builder
    public FastenerGroup(List<Point2D> positions, double diameter, BearingPlate plate) {
        Objects.requireNonNull(positions, "La lista de posiciones no puede ser nula.");
        if (positions.isEmpty()) {
            throw new DegenerateGeometryException("Un grupo de tornillos debe contener al menos un tornillo.");
        }
        if (!(diameter > 0)) {
            throw new IllegalArgumentException("El diámetro del tornillo debe ser positivo: " + diameter);
        }

        int n = positions.size();
        this.y = new double[n];
        this.z = new double[n];
        for (int i = 0; i < n; i++) {
            Point2D p = Objects.requireNonNull(positions.get(i), "La posición " + i + " no puede ser nula.");
            this.y[i] = p.y();
            this.z[i] = p.z();
        }
        this.diameter = diameter;
        this.plate = plate;
    }

    /**
     * Grupo de tornillos M20 sin chapa de apoyo.
     */
    public static FastenerGroup of(Point2D... positions) {
        return new FastenerGroup(List.of(positions), 20.0, null);
    }

    public FastenerGroup withPlate(BearingPlate newPlate) {
        return new FastenerGroup(positions(), diameter, newPlate);
    }

    @Override
    public GroupKind getKind() {
        return GroupKind.FASTENER;
    }

    @Override
    public int size() {
        return y.length;
    }

    @Override
    public Point2D positionAt(int index) {
        return new Point2D(y[index], z[index]);
    }

    @Override
    public double weightAt(int index) {
        return 1.0;
    }

    public List<Point2D> positions() {
        Point2D[] points = new Point2D[y.length];
        for (int i = 0; i < y.length; i++) {
            points[i] = positionAt(i);
        }
        return List.of(points);
    }

    public Optional<BearingPlate> getPlate() {
        return Optional.ofNullable(plate);
    }
}
