package steelconnect.domain.analysis;

import steelconnect.domain.geometry.BearingPlate;
import steelconnect.domain.geometry.SectionProperties;
import steelconnect.domain.load.Load;
import steelconnect.domain.load.Point2D;

/**
 * Eje de flexión fuera del plano y su correspondencia fija con la coordenada
 * que varía a lo largo del canto.
 * <p>
 * La flexión alrededor de y varía con la coordenada z del tornillo; la flexión
 * alrededor de z varía con la coordenada y. En ambos ejes un momento positivo
 * tracciona el lado de coordenada positiva.
 */
public enum BendingAxis {
    Y {
        @Override
        public double moment(Load load) {
            return load.my();
        }

        @Override
        public double coordinate(Point2D point) {
            return point.z();
        }

        @Override
        public double centroidCoordinate(SectionProperties props) {
            return props.cz();
        }

        @Override
        public double inertia(SectionProperties props) {
            return props.iy();
        }

        @Override
        public double plateMin(BearingPlate plate) {
            return plate.zMin();
        }

        @Override
        public double plateMax(BearingPlate plate) {
            return plate.zMax();
        }
    },
    Z {
        @Override
        public double moment(Load load) {
            return load.mz();
        }

        @Override
        public double coordinate(Point2D point) {
            return point.y();
        }

        @Override
        public double centroidCoordinate(SectionProperties props) {
            return props.cy();
        }

        @Override
        public double inertia(SectionProperties props) {
            return props.iz();
        }

        @Override
        public double plateMin(BearingPlate plate) {
            return plate.yMin();
        }

        @Override
        public double plateMax(BearingPlate plate) {
            return plate.yMax();
        }
    };

    /**
     * Momento alrededor de este eje, positivo cuando tracciona el lado de coordenada positiva.
     */
    public abstract double moment(Load load);

    public abstract double coordinate(Point2D point);

    public abstract double centroidCoordinate(SectionProperties props);

    public abstract double inertia(SectionProperties props);

    public abstract double plateMin(BearingPlate plate);

    public abstract double plateMax(BearingPlate plate);
}
