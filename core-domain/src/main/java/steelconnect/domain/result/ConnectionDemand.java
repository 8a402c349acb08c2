package steelconnect.domain.result;

import steelconnect.domain.analysis.ShearMethod;
import steelconnect.domain.analysis.TensionMode;
import steelconnect.domain.geometry.GroupKind;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.load.Load;
import steelconnect.domain.load.Point2D;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resultado completo de un análisis: un registro de demanda por elemento
 * más el contexto necesario para comprobarlo o dibujarlo.
 *
 * @param kind            Tipo de grupo analizado.
 * @param unit            Fuerza (tornillos) o tensión (soldadura).
 * @param requestedMethod Método de cortante solicitado.
 * @param appliedMethod   Método realmente aplicado (ELASTIC si el ICR no era necesario).
 * @param tensionMode     Modo de eje neutro usado, nulo si no hubo reparto de tracciones por eje neutro.
 * @param loadAtCentroid  Carga trasladada al centroide del grupo.
 * @param properties      Centroide e inercias del grupo.
 * @param elements        Demandas por elemento, en el orden del grupo.
 * @param icPoint         Centro instantáneo, nulo salvo en resultados ICR.
 */
public record ConnectionDemand(GroupKind kind,
                               DemandUnit unit,
                               ShearMethod requestedMethod,
                               ShearMethod appliedMethod,
                               TensionMode tensionMode,
                               Load loadAtCentroid,
                               SectionProperties properties,
                               List<ElementDemand> elements,
                               Point2D icPoint) {

    public ConnectionDemand {
        Objects.requireNonNull(kind, "El tipo de grupo no puede ser nulo.");
        Objects.requireNonNull(unit, "La unidad de demanda no puede ser nula.");
        Objects.requireNonNull(elements, "La lista de demandas no puede ser nula.");
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("Un resultado debe contener al menos una demanda.");
        }
        elements = List.copyOf(elements);
    }

    public Optional<Point2D> instantaneousCenter() {
        return Optional.ofNullable(icPoint);
    }

    public ElementDemand element(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public double maxInPlaneResultant() {
        return elements.stream().mapToDouble(ElementDemand::inPlaneResultant).max().orElse(0.0);
    }

    public double maxAxial() {
        return elements.stream().mapToDouble(ElementDemand::axial).max().orElse(0.0);
    }

    public double maxResultant() {
        return elements.stream().mapToDouble(ElementDemand::resultant).max().orElse(0.0);
    }

    /**
     * Elemento con mayor demanda total.
     */
    public ElementDemand governing() {
        return elements.stream()
                .max(Comparator.comparingDouble(ElementDemand::resultant))
                .orElseThrow();
    }

    /**
     * Elemento más cercano a un punto dado del plano.
     */
    public ElementDemand nearestTo(Point2D point) {
        return elements.stream()
                .min(Comparator.comparingDouble(e -> e.position().distanceTo(point)))
                .orElseThrow();
    }
}
