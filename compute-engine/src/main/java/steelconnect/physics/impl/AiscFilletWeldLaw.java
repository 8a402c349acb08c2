package steelconnect.physics.impl;

import steelconnect.config.AnalysisConfig.WeldLawParams;
import steelconnect.domain.geometry.WeldGroup;
import steelconnect.domain.geometry.WeldSegment;
import steelconnect.physics.i.ILoadDeformationLaw;
import steelconnect.physics.solver.IcrTrialState;

import java.util.Objects;

/**
 * Ley direccional AISC para soldaduras en ángulo.
 * <p>
 * f_w = 0.60·F_EXX·k_ds(θ)·[p(1.9 - 0.9p)]^0.3 con k_ds(θ) = 1 + 0.5·sin^1.5(θ),
 * siendo θ el ángulo entre la fuerza y el cordón. La deformación de cada segmento
 * es proporcional a su distancia al centro y queda limitada por el segmento crítico,
 * el de menor Δ_u/c. Los ángulos de las fórmulas de deformación van en grados.
 */
public class AiscFilletWeldLaw implements ILoadDeformationLaw<WeldGroup> {

    /** Suelo del término p(1.9 - 0.9p) antes de elevarlo a 0.3. */
    private static final double MIN_SHAPE = 1e-6;

    private final WeldLawParams params;

    public AiscFilletWeldLaw(WeldLawParams params) {
        this.params = Objects.requireNonNull(params, "Los parámetros de la ley de soldadura no pueden ser nulos.");
    }

    @Override
    public String getName() {
        return "AISC direccional";
    }

    @Override
    public String getDescription() {
        return "Ley de deformación direccional para soldaduras en ángulo, F_EXX = " + params.electrodeStrength();
    }

    @Override
    public double[] resistances(WeldGroup group, IcrTrialState state) {
        int n = state.size();
        double leg = group.getParams().leg();
        double throat = group.getParams().throat();

        double[] thetaDeg = new double[n];
        double[] ultimate = new double[n];
        double[] atMaxStress = new double[n];
        double criticalRatio = Double.POSITIVE_INFINITY;

        for (int i = 0; i < n; i++) {
            if (state.isAtCenter(i)) {
                continue;
            }
            WeldSegment s = group.segmentAt(i);
            thetaDeg[i] = Math.toDegrees(angleToTangent(state.directionY()[i], state.directionZ()[i], s));
            ultimate[i] = ultimateDeformation(thetaDeg[i], leg);
            atMaxStress[i] = maxStressDeformation(thetaDeg[i], leg);
            criticalRatio = Math.min(criticalRatio, ultimate[i] / state.distances()[i]);
        }

        double[] r = new double[n];
        if (Double.isInfinite(criticalRatio)) {
            return r;
        }
        for (int i = 0; i < n; i++) {
            if (state.isAtCenter(i)) {
                continue;
            }
            double deformation = Math.min(criticalRatio * state.distances()[i], ultimate[i]);
            double p = deformation / atMaxStress[i];
            double stress = stressAt(p, Math.toRadians(thetaDeg[i]), group.isDirectionalStrengthIncrease());
            r[i] = stress * throat * group.segmentAt(i).length();
        }
        return r;
    }

    /**
     * Tensión en la garganta para una deformación normalizada p y un ángulo θ (radianes).
     */
    public double stressAt(double p, double thetaRad, boolean directional) {
        double ratio = Math.min(params.maxStrainRatio(), Math.max(params.minStrainRatio(), p));
        double shape = Math.max(ratio * (1.9 - 0.9 * ratio), MIN_SHAPE);
        double kds = directional ? directionalFactor(thetaRad) : 1.0;
        return 0.60 * params.electrodeStrength() * kds * Math.pow(shape, 0.3);
    }

    /**
     * Δ_u = min(0.17w, 1.087(θ+6)^-0.65·w), con θ en grados.
     */
    public static double ultimateDeformation(double thetaDeg, double leg) {
        return Math.min(0.17 * leg, 1.087 * Math.pow(thetaDeg + 6.0, -0.65) * leg);
    }

    /**
     * Δ_m = 0.209(θ+2)^-0.32·w, con θ en grados.
     */
    public static double maxStressDeformation(double thetaDeg, double leg) {
        return 0.209 * Math.pow(thetaDeg + 2.0, -0.32) * leg;
    }

    /**
     * k_ds(θ) = 1 + 0.5·sin^1.5(θ).
     */
    public static double directionalFactor(double thetaRad) {
        return 1.0 + 0.5 * Math.pow(Math.abs(Math.sin(thetaRad)), 1.5);
    }

    /**
     * Ángulo entre una dirección en el plano y la tangente del segmento, en [0, π/2].
     */
    public static double angleToTangent(double dirY, double dirZ, WeldSegment segment) {
        double norm = Math.hypot(dirY, dirZ);
        if (norm == 0.0) {
            return 0.0;
        }
        double cos = Math.abs(dirY * segment.tangentY() + dirZ * segment.tangentZ()) / norm;
        return Math.acos(Math.min(1.0, cos));
    }

    @Override
    public double characteristicSize(WeldGroup group) {
        return group.getParams().leg();
    }
}
