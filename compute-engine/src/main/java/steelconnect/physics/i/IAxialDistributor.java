package steelconnect.physics.i;

import steelconnect.domain.geometry.ElementGroup;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.load.Load;

/**
 * Reparte la carga fuera del plano (fx, my, mz) en una demanda axial con signo por elemento,
 * positiva en tracción.
 *
 * @param <G> Tipo de grupo que el distribuidor sabe tratar.
 */
@FunctionalInterface
public interface IAxialDistributor<G extends ElementGroup> {

    double[] distribute(G group, SectionProperties properties, Load loadAtCentroid);
}
