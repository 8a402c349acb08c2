package steelconnect.physics.analyzer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import steelconnect.config.AnalysisConfig;
import steelconnect.domain.analysis.ShearMethod;
import steelconnect.domain.analysis.TensionMode;
import steelconnect.domain.geometry.ElementGroup;
import steelconnect.domain.geometry.FastenerGroup;
import steelconnect.domain.geometry.GroupKind;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.geometry.WeldGroup;
import steelconnect.domain.geometry.WeldSegment;
import steelconnect.domain.load.Load;
import steelconnect.domain.result.ConnectionDemand;
import steelconnect.domain.result.DemandUnit;
import steelconnect.domain.result.ElementDemand;
import steelconnect.domain.result.InPlaneDistribution;
import steelconnect.exception.ConnectionAnalysisException;
import steelconnect.exception.InvalidAnalysisModeException;
import steelconnect.physics.i.IAxialDistributor;
import steelconnect.physics.i.IInPlaneDistributor;
import steelconnect.physics.impl.AiscFilletWeldLaw;
import steelconnect.physics.impl.ElasticAxialDistributor;
import steelconnect.physics.impl.ElasticShearDistributor;
import steelconnect.physics.impl.IcrShearDistributor;
import steelconnect.physics.impl.NeutralAxisTensionDistributor;
import steelconnect.physics.solver.SectionPropertiesCalculator;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Punto de entrada del motor: analiza un grupo de tornillos o de soldadura bajo una carga.
 * <p>
 * Cada análisis calcula las propiedades del grupo, traslada la carga al centroide,
 * reparte la parte en el plano (elástica o ICR) y la parte fuera del plano
 * (eje neutro para tornillos, elástica para soldadura) y combina ambas en un
 * registro por elemento. El analizador no guarda estado entre llamadas y puede
 * usarse desde varios hilos.
 *
 * @author Duo Xu
 * @version 0.1
 */
@Slf4j
public class ConnectionAnalyzer {

    @Getter
    private final AnalysisConfig config;
    private final IInPlaneDistributor<ElementGroup> elasticShear;
    private final IInPlaneDistributor<FastenerGroup> fastenerIcr;
    private final IInPlaneDistributor<WeldGroup> weldIcr;
    private final IAxialDistributor<ElementGroup> weldAxial;
    private final Map<TensionMode, IAxialDistributor<FastenerGroup>> fastenerTension;

    public ConnectionAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public ConnectionAnalyzer(AnalysisConfig config) {
        this(config,
                new ElasticShearDistributor(config),
                IcrShearDistributor.forFasteners(config),
                IcrShearDistributor.forWelds(config),
                new ElasticAxialDistributor(config),
                defaultTensionDistributors(config));
    }

    /**
     * Constructor con todos los colaboradores, para sustituirlos en pruebas.
     */
    ConnectionAnalyzer(AnalysisConfig config,
                       IInPlaneDistributor<ElementGroup> elasticShear,
                       IInPlaneDistributor<FastenerGroup> fastenerIcr,
                       IInPlaneDistributor<WeldGroup> weldIcr,
                       IAxialDistributor<ElementGroup> weldAxial,
                       Map<TensionMode, IAxialDistributor<FastenerGroup>> fastenerTension) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.elasticShear = Objects.requireNonNull(elasticShear);
        this.fastenerIcr = Objects.requireNonNull(fastenerIcr);
        this.weldIcr = Objects.requireNonNull(weldIcr);
        this.weldAxial = Objects.requireNonNull(weldAxial);
        this.fastenerTension = new EnumMap<>(fastenerTension);
        for (TensionMode mode : TensionMode.values()) {
            if (!this.fastenerTension.containsKey(mode)) {
                throw new IllegalArgumentException("Falta el distribuidor de tracciones para el modo " + mode);
            }
        }
        log.info("ConnectionAnalyzer inicializado. ICR tornillos={}, ICR soldadura={}",
                fastenerIcr.getDescription(), weldIcr.getDescription());
    }

    private static Map<TensionMode, IAxialDistributor<FastenerGroup>> defaultTensionDistributors(AnalysisConfig config) {
        Map<TensionMode, IAxialDistributor<FastenerGroup>> map = new EnumMap<>(TensionMode.class);
        for (TensionMode mode : TensionMode.values()) {
            map.put(mode, new NeutralAxisTensionDistributor(mode, config));
        }
        return map;
    }

    /**
     * Analiza un grupo de tornillos.
     *
     * @param group       Grupo de tornillos. Necesita chapa si la carga tiene flexión fuera del plano.
     * @param load        Carga en su punto de aplicación.
     * @param method      Método de reparto en el plano.
     * @param tensionMode Posición del eje neutro para las tracciones.
     * @return Demanda por tornillo en fuerzas.
     */
    public ConnectionDemand analyze(FastenerGroup group, Load load, ShearMethod method, TensionMode tensionMode) {
        Objects.requireNonNull(group, "El grupo de tornillos no puede ser nulo.");
        Objects.requireNonNull(load, "La carga no puede ser nula.");
        Objects.requireNonNull(method, "El método de cortante no puede ser nulo.");
        Objects.requireNonNull(tensionMode, "El modo de eje neutro no puede ser nulo.");

        try {
            SectionProperties props = SectionPropertiesCalculator.compute(group);
            Load atCentroid = load.transferTo(props.centroid3D());
            log.info("Analizando {} tornillos. Método={}, eje neutro={}", group.size(), method, tensionMode);

            InPlaneDistribution inPlane = method == ShearMethod.ICR
                    ? fastenerIcr.distribute(group, props, atCentroid)
                    : elasticShear.distribute(group, props, atCentroid);
            double[] axial = fastenerTension.get(tensionMode).distribute(group, props, atCentroid);

            List<ElementDemand> elements = new ArrayList<>(group.size());
            for (int i = 0; i < group.size(); i++) {
                elements.add(new ElementDemand(i, group.positionAt(i),
                        inPlane.componentY(i), inPlane.componentZ(i), axial[i], 1.0));
            }
            return new ConnectionDemand(GroupKind.FASTENER, DemandUnit.FORCE, method, inPlane.method(),
                    tensionMode, atCentroid, props, elements, inPlane.instantaneousCenter().orElse(null));
        } catch (ConnectionAnalysisException e) {
            log.warn("Análisis de tornillos abortado ({}): {}", e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    /**
     * Variante con etiquetas textuales ("elastic"/"icr" y "conservative"/"accurate").
     */
    public ConnectionDemand analyze(FastenerGroup group, Load load, String method, String tensionMode) {
        return analyze(group, load, ShearMethod.fromLabel(method), TensionMode.fromLabel(tensionMode));
    }

    /**
     * Analiza un grupo de soldadura. La parte fuera del plano siempre se reparte elásticamente.
     *
     * @param group  Cordón discretizado.
     * @param load   Carga en su punto de aplicación.
     * @param method Método de reparto en el plano. ICR solo admite soldadura en ángulo sin carga fuera del plano.
     * @return Demanda por segmento en tensiones.
     */
    public ConnectionDemand analyze(WeldGroup group, Load load, ShearMethod method) {
        Objects.requireNonNull(group, "El grupo de soldadura no puede ser nulo.");
        Objects.requireNonNull(load, "La carga no puede ser nula.");
        Objects.requireNonNull(method, "El método de cortante no puede ser nulo.");

        try {
            if (method == ShearMethod.ICR && !group.getType().supportsIcr()) {
                throw new InvalidAnalysisModeException(
                        "El método ICR solo es válido para soldaduras en ángulo, no para " + group.getType() + ".");
            }
            SectionProperties props = SectionPropertiesCalculator.compute(group);
            Load atCentroid = load.transferTo(props.centroid3D());
            if (method == ShearMethod.ICR && atCentroid.hasOutOfPlaneComponents(config.zeroTolerance())) {
                throw new InvalidAnalysisModeException(String.format(
                        "El método ICR no admite carga fuera del plano en soldadura (fx=%g, my=%g, mz=%g en el centroide). "
                                + "Use el método elástico.", atCentroid.fx(), atCentroid.my(), atCentroid.mz()));
            }
            log.info("Analizando soldadura {} de {} segmentos. Método={}", group.getType(), group.size(), method);

            InPlaneDistribution inPlane = method == ShearMethod.ICR
                    ? weldIcr.distribute(group, props, atCentroid)
                    : elasticShear.distribute(group, props, atCentroid);
            double[] axial = weldAxial.distribute(group, props, atCentroid);

            List<ElementDemand> elements = new ArrayList<>(group.size());
            for (int i = 0; i < group.size(); i++) {
                double qy = inPlane.componentY(i);
                double qz = inPlane.componentZ(i);
                elements.add(new ElementDemand(i, group.positionAt(i), qy, qz, axial[i],
                        directionalFactor(group, i, qy, qz)));
            }
            return new ConnectionDemand(GroupKind.WELD, DemandUnit.STRESS, method, inPlane.method(),
                    null, atCentroid, props, elements, inPlane.instantaneousCenter().orElse(null));
        } catch (ConnectionAnalysisException e) {
            log.warn("Análisis de soldadura abortado ({}): {}", e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
    }

    public ConnectionDemand analyze(WeldGroup group, Load load, String method) {
        return analyze(group, load, ShearMethod.fromLabel(method));
    }

    /**
     * k_ds según el ángulo entre la demanda en el plano y el cordón; 1 si el grupo
     * no admite el aumento direccional o la demanda en el plano es nula.
     */
    private double directionalFactor(WeldGroup group, int index, double qy, double qz) {
        if (!group.isDirectionalStrengthIncrease() || Math.hypot(qy, qz) <= config.zeroTolerance()) {
            return 1.0;
        }
        WeldSegment segment = group.segmentAt(index);
        return AiscFilletWeldLaw.directionalFactor(AiscFilletWeldLaw.angleToTangent(qy, qz, segment));
    }
}
