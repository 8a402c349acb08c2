package steelconnect.physics.impl;

import lombok.extern.slf4j.Slf4j;
import steelconnect.config.AnalysisConfig;
import steelconnect.domain.analysis.BendingAxis;
import steelconnect.domain.analysis.TensionMode;
import steelconnect.domain.geometry.BearingPlate;
import steelconnect.domain.geometry.FastenerGroup;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.load.Load;
import steelconnect.exception.DegenerateGeometryException;
import steelconnect.exception.InvalidAnalysisModeException;
import steelconnect.physics.i.IAxialDistributor;
import steelconnect.physics.i.ISolverComponent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Reparto de tracciones en tornillos por el método del eje neutro.
 * <p>
 * La tracción directa fx/n (solo si fx > 0) se suma a la contribución con signo de cada
 * eje de flexión. En cada eje los tornillos se agrupan en filas, la fila traccionada más
 * alejada del eje neutro recibe
 * <pre>
 *     T1 = |M| / Σ_tracción y_i·(y_i/y1 - y_c/y1)
 * </pre>
 * y cada fila recibe T1·y_i/y1, negativa en el lado comprimido. La suma de ambos ejes se
 * recorta a cero una sola vez al final, de modo que un eje puede anular al otro.
 *
 * @author Duo Xu
 * @version 0.1
 */
@Slf4j
public class NeutralAxisTensionDistributor implements IAxialDistributor<FastenerGroup>, ISolverComponent {

    private final TensionMode mode;
    private final AnalysisConfig config;

    public NeutralAxisTensionDistributor(TensionMode mode, AnalysisConfig config) {
        this.mode = Objects.requireNonNull(mode, "El modo de eje neutro no puede ser nulo.");
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
    }

    @Override
    public String getName() {
        return "Eje neutro (" + mode.getLabel() + ")";
    }

    public TensionMode getMode() {
        return mode;
    }

    @Override
    public double[] distribute(FastenerGroup group, SectionProperties properties, Load loadAtCentroid) {
        int n = group.size();
        double[] tension = new double[n];

        // 1. Término directo, solo tracción
        if (loadAtCentroid.fx() > 0) {
            Arrays.fill(tension, loadAtCentroid.fx() / n);
        }

        // 2. Contribución con signo de cada eje de flexión
        for (BendingAxis axis : BendingAxis.values()) {
            double moment = axis.moment(loadAtCentroid);
            if (Math.abs(moment) <= config.zeroTolerance()) {
                continue;
            }
            BearingPlate plate = group.getPlate().orElseThrow(() -> new InvalidAnalysisModeException(
                    "Se necesita una chapa de apoyo para repartir la flexión alrededor del eje " + axis + "."));
            double[] contribution = bendingContribution(group, plate, axis, moment);
            for (int i = 0; i < n; i++) {
                tension[i] += contribution[i];
            }
        }

        // 3. Solo tracción, recortado tras la suma completa
        for (int i = 0; i < n; i++) {
            tension[i] = Math.max(0.0, tension[i]);
        }
        return tension;
    }

    /**
     * Contribución con signo de un eje. {@code moment} es positivo cuando tracciona el
     * lado de coordenada positiva. En modo conservador el eje neutro pasa por el centro
     * de la chapa, no por el centroide de los tornillos.
     */
    double[] bendingContribution(FastenerGroup group, BearingPlate plate, BendingAxis axis, double moment) {
        double uMin = axis.plateMin(plate);
        double uMax = axis.plateMax(plate);
        double depth = uMax - uMin;
        double tensionSide = moment > 0 ? 1.0 : -1.0;
        double compressionEdge = moment > 0 ? uMin : uMax;

        double neutralAxis = switch (mode) {
            case CONSERVATIVE -> 0.5 * (uMin + uMax);
            case ACCURATE -> compressionEdge + tensionSide * depth / 6.0;
        };

        List<Row> rows = groupRows(group, axis);
        double y1 = 0.0;
        for (Row row : rows) {
            if (isTensionSide(row, neutralAxis, tensionSide)) {
                y1 = Math.max(y1, Math.abs(row.coordinate - neutralAxis));
            }
        }
        if (y1 <= 0.0) {
            throw new DegenerateGeometryException(String.format(
                    "No hay filas de tornillos en el lado traccionado del eje neutro (eje %s, u_NA=%g, M=%g).",
                    axis, neutralAxis, moment));
        }

        double yc = -Math.abs(compressionEdge - neutralAxis);
        double denominator = 0.0;
        for (Row row : rows) {
            if (isTensionSide(row, neutralAxis, tensionSide)) {
                double yi = Math.abs(row.coordinate - neutralAxis);
                denominator += yi * (yi / y1 - yc / y1);
            }
        }
        double t1 = Math.abs(moment) / denominator;
        log.debug("Eje {}: u_NA={}, y1={}, yc={}, T1={}, filas={}", axis, neutralAxis, y1, yc, t1, rows.size());

        double[] contribution = new double[group.size()];
        for (Row row : rows) {
            double yi = Math.abs(row.coordinate - neutralAxis);
            double rowForce = t1 * yi / y1;
            if (!isTensionSide(row, neutralAxis, tensionSide)) {
                rowForce = -rowForce;
            }
            double perFastener = rowForce / row.members.size();
            for (int index : row.members) {
                contribution[index] = perFastener;
            }
        }
        return contribution;
    }

    private boolean isTensionSide(Row row, double neutralAxis, double tensionSide) {
        return tensionSide * (row.coordinate - neutralAxis) > config.positionTolerance();
    }

    /**
     * Agrupa los tornillos en filas de igual coordenada, con tolerancia {@code rowTolerance}
     * medida desde el primer tornillo de la fila.
     */
    List<Row> groupRows(FastenerGroup group, BendingAxis axis) {
        Integer[] order = new Integer[group.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> axis.coordinate(group.positionAt(i))));

        List<Row> rows = new ArrayList<>();
        Row current = null;
        double start = 0.0;
        for (int index : order) {
            double u = axis.coordinate(group.positionAt(index));
            if (current == null || u - start > config.rowTolerance()) {
                current = new Row();
                rows.add(current);
                start = u;
            }
            current.add(index, u);
        }
        return rows;
    }

    /**
     * Fila de tornillos con coordenada media de sus miembros.
     */
    static final class Row {
        private final List<Integer> members = new ArrayList<>();
        private double coordinate;

        private void add(int index, double u) {
            coordinate = (coordinate * members.size() + u) / (members.size() + 1);
            members.add(index);
        }

        List<Integer> getMembers() {
            return members;
        }

        double getCoordinate() {
            return coordinate;
        }
    }
}
