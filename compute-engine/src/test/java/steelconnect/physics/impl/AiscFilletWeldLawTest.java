package steelconnect.physics.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import steelconnect.config.AnalysisConfig;
import steelconnect.domain.geometry.WeldGroup;
import steelconnect.domain.geometry.WeldParams;
import steelconnect.domain.geometry.WeldSegment;
import steelconnect.domain.load.Point2D;
import steelconnect.physics.WeldShapes;
import steelconnect.physics.solver.IcrTrialState;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test de la ley direccional AISC para soldaduras en ángulo.
 */
class AiscFilletWeldLawTest {

    private AiscFilletWeldLaw law;

    @BeforeEach
    void setUp() {
        law = new AiscFilletWeldLaw(AnalysisConfig.WeldLawParams.defaults());
    }

    @Test
    @DisplayName("k_ds vale 1 en carga longitudinal y 1.5 en carga transversal")
    void directionalFactor_limits() {
        assertEquals(1.0, AiscFilletWeldLaw.directionalFactor(0.0), 1e-12);
        assertEquals(1.5, AiscFilletWeldLaw.directionalFactor(Math.PI / 2), 1e-12);
        assertEquals(1.0 + 0.5 * Math.pow(Math.sin(Math.PI / 4), 1.5),
                AiscFilletWeldLaw.directionalFactor(Math.PI / 4), 1e-12);
    }

    @Test
    @DisplayName("Δu: límite 0.17w en carga longitudinal, fórmula angular en carga transversal")
    void ultimateDeformation_values() {
        assertEquals(0.17 * 8.0, AiscFilletWeldLaw.ultimateDeformation(0.0, 8.0), 1e-12);
        assertEquals(1.087 * Math.pow(96.0, -0.65) * 8.0, AiscFilletWeldLaw.ultimateDeformation(90.0, 8.0), 1e-12);
        assertTrue(AiscFilletWeldLaw.ultimateDeformation(90.0, 8.0) < AiscFilletWeldLaw.ultimateDeformation(0.0, 8.0),
                "La soldadura transversal es menos dúctil.");
    }

    @Test
    @DisplayName("Tensión con p = 1 y θ = 0: p(1.9 - 0.9p) = 1, queda 0.6·F_EXX")
    void stressAt_longitudinal() {
        double expected = 0.6 * 483.0;
        assertEquals(expected, law.stressAt(1.0, 0.0, true), 1e-9);
    }

    @Test
    @DisplayName("Sin aumento direccional la tensión no depende del ángulo")
    void stressAt_directionalDisabled() {
        assertEquals(law.stressAt(1.0, 0.0, false), law.stressAt(1.0, Math.PI / 2, false), 1e-12);
        assertEquals(1.5 * law.stressAt(1.0, Math.PI / 2, false), law.stressAt(1.0, Math.PI / 2, true), 1e-9);
    }

    @Test
    @DisplayName("El ángulo con la tangente se mide en [0, π/2] sin importar el sentido")
    void angleToTangent_values() {
        WeldSegment vertical = WeldSegment.between(new Point2D(0, 0), new Point2D(0, 10));
        assertEquals(0.0, AiscFilletWeldLaw.angleToTangent(0, -3, vertical), 1e-12);
        assertEquals(Math.PI / 2, AiscFilletWeldLaw.angleToTangent(2, 0, vertical), 1e-12);
        assertEquals(Math.PI / 4, AiscFilletWeldLaw.angleToTangent(1, 1, vertical), 1e-12);
    }

    @Test
    @DisplayName("El segmento crítico (menor Δu/c) define la deformación; todos los segmentos resisten")
    void resistances_forceIsStressTimesArea() {
        // ARRANGE: cordón vertical con el centro a su izquierda, fuerzas transversales al cordón
        List<WeldSegment> segments = WeldShapes.line(new Point2D(50, -40), new Point2D(50, 40), 8);
        WeldGroup group = new WeldGroup(segments, WeldParams.fillet(8));
        double[] y = new double[8];
        double[] z = new double[8];
        for (int i = 0; i < 8; i++) {
            y[i] = segments.get(i).midpoint().y();
            z[i] = segments.get(i).midpoint().z();
        }
        IcrTrialState state = IcrTrialState.at(Point2D.ORIGIN, y, z, 1.0, 1e-9);

        // ACT
        double[] r = law.resistances(group, state);

        // ASSERT
        for (double value : r) {
            assertTrue(value > 0);
            assertTrue(value <= 1.5 * 0.6 * 483.0 * 1.01 * group.weightAt(0));
        }
        // Segmentos simétricos respecto a z = 0 dan la misma fuerza
        assertEquals(r[0], r[7], 1e-9 * r[0]);
        assertEquals(8.0, law.characteristicSize(group));
    }
}
