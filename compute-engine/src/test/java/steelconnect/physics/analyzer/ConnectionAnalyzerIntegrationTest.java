package steelconnect.physics.analyzer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import steelconnect.domain.analysis.ShearMethod;
import steelconnect.domain.analysis.TensionMode;
import steelconnect.domain.geometry.BearingPlate;
import steelconnect.domain.geometry.FastenerGroup;
import steelconnect.domain.geometry.GroupKind;
import steelconnect.domain.geometry.WeldGroup;
import steelconnect.domain.geometry.WeldParams;
import steelconnect.domain.load.Load;
import steelconnect.domain.load.Point2D;
import steelconnect.domain.load.Point3D;
import steelconnect.domain.result.ConnectionDemand;
import steelconnect.domain.result.DemandUnit;
import steelconnect.domain.result.ElementDemand;
import steelconnect.exception.DegenerateGeometryException;
import steelconnect.physics.WeldShapes;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test de integración de ConnectionAnalyzer con los distribuidores reales.
 */
class ConnectionAnalyzerIntegrationTest {

    private ConnectionAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ConnectionAnalyzer();
    }

    @Test
    @DisplayName("Unión de chapa frontal: cortante excéntrico por ICR y flexión por eje neutro en la misma llamada")
    void analyze_boltedEndPlate() {
        // ARRANGE
        FastenerGroup group = new FastenerGroup(List.of(
                new Point2D(-50, -100), new Point2D(50, -100),
                new Point2D(-50, 0), new Point2D(50, 0),
                new Point2D(-50, 100), new Point2D(50, 100)),
                20, new BearingPlate(-100, 100, -150, 150));
        Load load = Load.builder().fz(-80_000).my(6.0e6).location(new Point3D(0, 120, 0)).build();

        // ACT
        ConnectionDemand demand = analyzer.analyze(group, load, ShearMethod.ICR, TensionMode.CONSERVATIVE);

        // ASSERT
        assertEquals(GroupKind.FASTENER, demand.kind());
        assertEquals(DemandUnit.FORCE, demand.unit());
        assertEquals(ShearMethod.ICR, demand.appliedMethod());
        assertThat(demand.instantaneousCenter()).isPresent();
        assertEquals(6, demand.size());

        double sumZ = demand.elements().stream().mapToDouble(ElementDemand::inPlaneZ).sum();
        assertEquals(-80_000.0, sumZ, 1e-6 * 80_000);
        // Fila superior traccionada, inferior a cero
        assertThat(demand.element(4).axial()).isPositive();
        assertEquals(0.0, demand.element(0).axial(), 1e-12);
        assertThat(demand.governing().axial()).isPositive();
    }

    @Test
    @DisplayName("Un único tornillo en el origen con torsión: DegenerateGeometryException")
    void analyze_singleFastenerUnderTorsion() {
        FastenerGroup group = FastenerGroup.of(Point2D.ORIGIN);

        assertThrows(DegenerateGeometryException.class, () -> analyzer.analyze(group,
                Load.builder().mx(1.0e5).build(), ShearMethod.ELASTIC, TensionMode.CONSERVATIVE));
        assertThrows(DegenerateGeometryException.class, () -> analyzer.analyze(group,
                Load.builder().fz(1000).mx(1.0e5).build(), ShearMethod.ICR, TensionMode.CONSERVATIVE));
    }

    @Test
    @DisplayName("Soldadura perimetral por ICR: tensiones, centro instantáneo y k_ds entre 1 y 1.5")
    void analyze_weldIcr() {
        // ARRANGE
        WeldGroup group = WeldShapes.rectangle(120, 200, 12, WeldParams.fillet(8), true);
        Load load = Load.builder().fz(-60_000).location(new Point3D(0, 180, 0)).build();

        // ACT
        ConnectionDemand demand = analyzer.analyze(group, load, "icr");

        // ASSERT
        assertEquals(DemandUnit.STRESS, demand.unit());
        assertEquals(ShearMethod.ICR, demand.appliedMethod());
        assertNull(demand.tensionMode());
        for (ElementDemand element : demand.elements()) {
            assertThat(element.directionalFactor()).isBetween(1.0, 1.5);
            assertEquals(0.0, element.axial(), 1e-12);
        }
        double sumForce = 0.0;
        for (int i = 0; i < group.size(); i++) {
            sumForce += demand.element(i).inPlaneZ() * group.weightAt(i);
        }
        assertEquals(-60_000.0, sumForce, 1e-6 * 60_000);
    }

    @Test
    @DisplayName("Sin aumento direccional todos los factores k_ds valen 1")
    void analyze_weldWithoutDirectionalIncrease() {
        WeldGroup group = WeldShapes.rectangle(120, 200, 12, WeldParams.fillet(8), false);

        ConnectionDemand demand = analyzer.analyze(group,
                Load.builder().fz(-60_000).location(new Point3D(0, 180, 0)).build(), ShearMethod.ELASTIC);

        for (ElementDemand element : demand.elements()) {
            assertEquals(1.0, element.directionalFactor());
        }
    }

    @Test
    @DisplayName("Soldadura elástica con carga fuera del plano: tensión axial con signo")
    void analyze_weldElasticOutOfPlane() {
        WeldGroup group = WeldShapes.rectangle(120, 200, 12, WeldParams.fillet(8), true);

        ConnectionDemand demand = analyzer.analyze(group, Load.builder().fx(30_000).my(4.0e6).build(),
                ShearMethod.ELASTIC);

        ElementDemand top = demand.nearestTo(new Point2D(0, 100));
        ElementDemand bottom = demand.nearestTo(new Point2D(0, -100));
        assertThat(top.axial()).isGreaterThan(bottom.axial());
        assertThat(bottom.axial()).isNegative();
        assertEquals(top.axial(), demand.maxAxial(), 1e-9);
    }
}
