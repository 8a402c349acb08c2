package steelconnect.physics.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import steelconnect.config.AnalysisConfig;
import steelconnect.domain.analysis.ShearMethod;
import steelconnect.domain.geometry.ElementGroup;
import steelconnect.domain.geometry.FastenerGroup;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.geometry.WeldGroup;
import steelconnect.domain.geometry.WeldParams;
import steelconnect.domain.load.Load;
import steelconnect.domain.load.Point2D;
import steelconnect.domain.load.Point3D;
import steelconnect.domain.result.InPlaneDistribution;
import steelconnect.exception.DegenerateGeometryException;
import steelconnect.physics.WeldShapes;
import steelconnect.physics.solver.SectionPropertiesCalculator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario de ElasticShearDistributor: torsión pura, equilibrio y geometría degenerada.
 */
class ElasticShearDistributorTest {

    private ElasticShearDistributor distributor;

    @BeforeEach
    void setUp() {
        distributor = new ElasticShearDistributor(AnalysisConfig.defaults());
    }

    @Test
    @DisplayName("Torsión pura en cuadrado 100x100: |F| = 1e6·70.7/20000 ≈ 3535.5 y dirección tangencial")
    void distribute_pureTorsionOnSquare() {
        // ARRANGE
        FastenerGroup group = FastenerGroup.of(
                new Point2D(-50, -50), new Point2D(50, -50), new Point2D(50, 50), new Point2D(-50, 50));
        SectionProperties props = SectionPropertiesCalculator.compute(group);
        Load load = Load.builder().mx(1_000_000).build();

        // ACT
        InPlaneDistribution result = distributor.distribute(group, props, load);

        // ASSERT
        assertEquals(ShearMethod.ELASTIC, result.method());
        double expected = 1_000_000 * Math.hypot(50, 50) / 20000.0;
        for (int i = 0; i < group.size(); i++) {
            Point2D p = group.positionAt(i);
            double qy = result.componentY(i);
            double qz = result.componentZ(i);
            assertEquals(expected, Math.hypot(qy, qz), 1e-6, "Módulo torsional del tornillo " + i);
            assertEquals(0.0, qy * p.y() + qz * p.z(), 1e-6, "La fuerza debe ser perpendicular al radio.");
            assertTrue(p.y() * qz - p.z() * qy > 0, "Mx positivo debe girar en sentido antihorario.");
        }
    }

    @Test
    @DisplayName("Equilibrio elástico en tornillos: ΣF = F aplicada y ΣΔ×F = mx")
    void distribute_fastenerEquilibriumClosure() {
        // ARRANGE
        FastenerGroup group = FastenerGroup.of(new Point2D(0, 0), new Point2D(80, 10), new Point2D(35, 120),
                new Point2D(-20, 60), new Point2D(10, -45));
        SectionProperties props = SectionPropertiesCalculator.compute(group);
        Load load = Load.builder().fy(12_000).fz(-30_000).location(new Point3D(0, 250, 40)).build()
                .transferTo(props.centroid3D());

        // ACT
        InPlaneDistribution result = distributor.distribute(group, props, load);

        // ASSERT
        double[] closure = closure(group, props, result);
        assertEquals(load.fy(), closure[0], 1e-6);
        assertEquals(load.fz(), closure[1], 1e-6);
        assertEquals(load.mx(), closure[2], 1e-9 * Math.abs(load.mx()));
    }

    @Test
    @DisplayName("Equilibrio elástico en soldadura: Σq·dA = F aplicada y el momento cierra con discretización fina")
    void distribute_weldEquilibriumClosure() {
        // ARRANGE
        WeldGroup group = WeldShapes.rectangle(150, 250, 25, WeldParams.fillet(8), true);
        SectionProperties props = SectionPropertiesCalculator.compute(group);
        Load load = Load.builder().fy(-20_000).fz(45_000).mx(3.0e6).build();

        // ACT
        InPlaneDistribution result = distributor.distribute(group, props, load);

        // ASSERT
        double[] closure = closure(group, props, result);
        assertEquals(load.fy(), closure[0], 1e-6);
        assertEquals(load.fz(), closure[1], 1e-6);
        // La contribución propia de los segmentos hace que el cierre de momentos sea aproximado
        assertEquals(load.mx(), closure[2], 1e-3 * Math.abs(load.mx()));
    }

    @Test
    @DisplayName("Solo cortante directo: todos los tornillos reciben F/n")
    void distribute_directShearIsUniform() {
        FastenerGroup group = FastenerGroup.of(new Point2D(0, 0), new Point2D(0, 75), new Point2D(0, 150));
        SectionProperties props = SectionPropertiesCalculator.compute(group);
        Load load = Load.builder().fz(-90_000).build().transferTo(props.centroid3D());

        InPlaneDistribution result = distributor.distribute(group, props, load);

        for (int i = 0; i < 3; i++) {
            assertEquals(0.0, result.componentY(i), 1e-9);
            assertEquals(-30_000.0, result.componentZ(i), 1e-9);
        }
    }

    @Test
    @DisplayName("Un único tornillo en el origen con mx ≠ 0: debe lanzar DegenerateGeometryException")
    void distribute_singleFastenerUnderTorsionIsDegenerate() {
        FastenerGroup group = FastenerGroup.of(Point2D.ORIGIN);
        SectionProperties props = SectionPropertiesCalculator.compute(group);
        Load load = Load.builder().mx(50_000).build();

        assertThrows(DegenerateGeometryException.class, () -> distributor.distribute(group, props, load));
    }

    @Test
    @DisplayName("Un único tornillo sin torsión: recibe todo el cortante")
    void distribute_singleFastenerWithoutTorsion() {
        FastenerGroup group = FastenerGroup.of(Point2D.ORIGIN);
        SectionProperties props = SectionPropertiesCalculator.compute(group);
        Load load = Load.builder().fy(1000).fz(2000).build();

        InPlaneDistribution result = distributor.distribute(group, props, load);

        assertEquals(1000.0, result.componentY(0), 1e-12);
        assertEquals(2000.0, result.componentZ(0), 1e-12);
    }

    /**
     * {ΣFy, ΣFz, ΣΔ×F} de las demandas multiplicadas por el peso de cada elemento.
     */
    static double[] closure(ElementGroup group, SectionProperties props, InPlaneDistribution result) {
        double sumY = 0.0;
        double sumZ = 0.0;
        double moment = 0.0;
        for (int i = 0; i < group.size(); i++) {
            double w = group.weightAt(i);
            double fy = result.componentY(i) * w;
            double fz = result.componentZ(i) * w;
            Point2D p = group.positionAt(i);
            sumY += fy;
            sumZ += fz;
            moment += (p.y() - props.cy()) * fz - (p.z() - props.cz()) * fy;
        }
        return new double[]{sumY, sumZ, moment};
    }
}
