package steelconnect.physics.i;

import steelconnect.domain.geometry.ElementGroup;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.load.Load;
import steelconnect.domain.result.InPlaneDistribution;

/**
 * Reparte el cortante (fy, fz) y la torsión mx entre los elementos de un grupo.
 * <p>
 * Las componentes devueltas son demanda por unidad de peso: fuerza para tornillos
 * (peso unitario) y tensión para soldadura (peso = área).
 *
 * @param <G> Tipo de grupo que el distribuidor sabe tratar.
 */
public interface IInPlaneDistributor<G extends ElementGroup> extends ISolverComponent {

    /**
     * @param group          Grupo de elementos.
     * @param properties     Centroide e inercias del grupo.
     * @param loadAtCentroid Carga ya trasladada al centroide.
     * @return Componentes en el plano por elemento.
     */
    InPlaneDistribution distribute(G group, SectionProperties properties, Load loadAtCentroid);
}
