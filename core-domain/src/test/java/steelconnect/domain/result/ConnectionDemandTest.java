package steelconnect.domain.result;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import steelconnect.domain.analysis.ShearMethod;
import steelconnect.domain.analysis.TensionMode;
import steelconnect.domain.geometry.GroupKind;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.load.Load;
import steelconnect.domain.load.Point2D;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ConnectionDemandTest {

    private List<ElementDemand> elements;
    private ConnectionDemand demand;

    @BeforeEach
    void setUp() {
        elements = new ArrayList<>(List.of(
                new ElementDemand(0, new Point2D(0, -50), 3, 4, 0, 1),
                new ElementDemand(1, new Point2D(0, 50), 0, 6, 8, 1),
                new ElementDemand(2, new Point2D(80, 0), -9, 0, -2, 1)));
        demand = new ConnectionDemand(GroupKind.FASTENER, DemandUnit.FORCE, ShearMethod.ICR, ShearMethod.ELASTIC,
                TensionMode.CONSERVATIVE, Load.builder().build(),
                new SectionProperties(0, 0, 3, 0, 5000, 6400), elements, null);
    }

    @Test
    @DisplayName("Máximos en el plano, axial y total")
    void maxima() {
        assertEquals(9.0, demand.maxInPlaneResultant(), 1e-12);
        assertEquals(8.0, demand.maxAxial(), 1e-12);
        assertEquals(10.0, demand.maxResultant(), 1e-12);
    }

    @Test
    @DisplayName("El elemento determinante es el de mayor demanda total, no el de mayor cortante")
    void governing() {
        assertEquals(1, demand.governing().index());
    }

    @Test
    @DisplayName("Búsqueda del elemento más cercano a un punto")
    void nearestTo() {
        assertEquals(2, demand.nearestTo(new Point2D(70, 10)).index());
        assertEquals(0, demand.nearestTo(new Point2D(0, -100)).index());
    }

    @Test
    @DisplayName("La lista de elementos se copia y es inmutable")
    void elements_areCopied() {
        elements.clear();

        assertEquals(3, demand.size());
        assertThrows(UnsupportedOperationException.class, () -> demand.elements().clear());
        assertThat(demand.instantaneousCenter()).isEmpty();
    }

    @Test
    @DisplayName("Un resultado sin elementos no es válido")
    void emptyElements() {
        assertThrows(IllegalArgumentException.class, () -> new ConnectionDemand(GroupKind.WELD, DemandUnit.STRESS,
                ShearMethod.ELASTIC, ShearMethod.ELASTIC, null, Load.builder().build(),
                new SectionProperties(0, 0, 1, 1, 1, 1), List.of(), null));
    }

    @Test
    @DisplayName("Componentes de la demanda de un elemento")
    void elementDemand_components() {
        ElementDemand element = demand.element(0);

        assertEquals(5.0, element.inPlaneResultant(), 1e-12);
        assertEquals(Math.toDegrees(Math.atan2(4, 3)), element.inPlaneAngleDegrees(), 1e-12);
    }
}
