package steelconnect.physics.impl;

import steelconnect.config.AnalysisConfig.CrawfordKulakParams;
import steelconnect.domain.geometry.FastenerGroup;
import steelconnect.physics.i.ILoadDeformationLaw;
import steelconnect.physics.solver.IcrTrialState;

import java.util.Objects;

/**
 * Ley de Crawford-Kulak para tornillos: R = R_ult·(1 - e^(-μρ))^λ.
 * <p>
 * La deformación de cada tornillo es proporcional a su distancia al centro
 * instantáneo, Δ_i = Δ_ult·c_i/c_max, de modo que el tornillo más alejado
 * alcanza la deformación última.
 */
public class CrawfordKulakLaw implements ILoadDeformationLaw<FastenerGroup> {

    /** Límite inferior de ρ para evitar fuerzas exactamente nulas en el reescalado. */
    private static final double MIN_RATIO = 1e-6;

    private final CrawfordKulakParams params;

    public CrawfordKulakLaw(CrawfordKulakParams params) {
        this.params = Objects.requireNonNull(params, "Los parámetros de Crawford-Kulak no pueden ser nulos.");
    }

    @Override
    public String getName() {
        return "Crawford-Kulak";
    }

    @Override
    public String getDescription() {
        return String.format("R = R_ult(1 - exp(-%.2f ρ))^%.2f, Δ_ult = %.2f",
                params.mu(), params.lambda(), params.ultimateDeformation());
    }

    @Override
    public double[] resistances(FastenerGroup group, IcrTrialState state) {
        int n = state.size();
        double[] r = new double[n];
        double cMax = state.maxDistance();
        if (cMax <= 0) {
            return r;
        }
        for (int i = 0; i < n; i++) {
            if (state.isAtCenter(i)) {
                continue;
            }
            double deformation = params.ultimateDeformation() * state.distances()[i] / cMax;
            r[i] = forceAt(deformation);
        }
        return r;
    }

    /**
     * Fuerza del tornillo para una deformación dada (mm).
     */
    public double forceAt(double deformation) {
        double rho = Math.min(1.0, Math.max(MIN_RATIO, deformation / params.ultimateDeformation()));
        return params.ultimateStrength() * Math.pow(1.0 - Math.exp(-params.mu() * rho), params.lambda());
    }

    @Override
    public double characteristicSize(FastenerGroup group) {
        return group.getDiameter();
    }
}
