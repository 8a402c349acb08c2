package steelconnect.domain.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import steelconnect.domain.load.Point2D;
import steelconnect.exception.DegenerateGeometryException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FastenerGroupTest {

    @Test
    @DisplayName("Grupo vacío: DegenerateGeometryException")
    void constructor_emptyGroupIsDegenerate() {
        assertThrows(DegenerateGeometryException.class, () -> FastenerGroup.of());
        assertThrows(DegenerateGeometryException.class,
                () -> FastenerGroup.builder().positions(List.of()).diameter(20).build());
    }

    @Test
    @DisplayName("Diámetro no positivo o posiciones nulas se rechazan")
    void constructor_invalidBoltData() {
        List<Point2D> positions = List.of(Point2D.ORIGIN);

        assertThrows(IllegalArgumentException.class, () -> new FastenerGroup(positions, 0.0, null));
        assertThrows(IllegalArgumentException.class, () -> new FastenerGroup(positions, -20.0, null));
        assertThrows(NullPointerException.class, () -> new FastenerGroup(null, 20.0, null));
    }

    @Test
    @DisplayName("Cada tornillo pesa 1 y conserva su posición")
    void accessors() {
        FastenerGroup group = FastenerGroup.of(new Point2D(10, 20), new Point2D(-30, 40));

        assertEquals(2, group.size());
        assertEquals(GroupKind.FASTENER, group.getKind());
        assertEquals(new Point2D(-30, 40), group.positionAt(1));
        assertEquals(1.0, group.weightAt(0));
        assertEquals(0.0, group.ownInertiaY(0));
        assertThat(group.positions()).containsExactly(new Point2D(10, 20), new Point2D(-30, 40));
        assertThat(group.getPlate()).isEmpty();
        assertEquals(20.0, group.getDiameter());
    }

    @Test
    @DisplayName("withPlate devuelve una copia con chapa sin modificar el original")
    void withPlate_isImmutable() {
        FastenerGroup group = FastenerGroup.of(new Point2D(0, -50), new Point2D(0, 50));
        BearingPlate plate = new BearingPlate(-60, 60, -100, 100);

        FastenerGroup withPlate = group.withPlate(plate);

        assertThat(group.getPlate()).isEmpty();
        assertThat(withPlate.getPlate()).contains(plate);
        assertEquals(group.positions(), withPlate.positions());
    }
}
