package steelconnect.physics.solver;

import steelconnect.domain.load.Point2D;

/**
 * Estado transitorio de una evaluación del ICR: centro de prueba, distancia de cada elemento
 * al centro y dirección unitaria de su fuerza (tangente a la circunferencia centrada en el centro,
 * en el sentido de giro de la torsión). Se descarta al terminar la búsqueda.
 *
 * @param center      Centro instantáneo de prueba.
 * @param distances   Distancia c_i de cada elemento al centro.
 * @param directionY  Componente y de la dirección de la fuerza (0 si c_i es nula).
 * @param directionZ  Componente z de la dirección de la fuerza.
 * @param maxDistance Máximo de c_i.
 */
public record IcrTrialState(Point2D center, double[] distances, double[] directionY, double[] directionZ,
                            double maxDistance) {

    /**
     * Construye el estado para el centro dado.
     *
     * @param center            Centro de prueba.
     * @param y                 Coordenadas y de los elementos.
     * @param z                 Coordenadas z de los elementos.
     * @param rotationSign      Signo de la torsión (+1 antihorario, -1 horario).
     * @param positionTolerance Distancia por debajo de la cual un elemento se considera en el centro.
     */
    public static IcrTrialState at(Point2D center, double[] y, double[] z, double rotationSign,
                                   double positionTolerance) {
        int n = y.length;
        double[] c = new double[n];
        double[] dirY = new double[n];
        double[] dirZ = new double[n];
        double cMax = 0.0;
        for (int i = 0; i < n; i++) {
            double ry = y[i] - center.y();
            double rz = z[i] - center.z();
            double dist = Math.hypot(ry, rz);
            if (dist < positionTolerance) {
                continue;
            }
            c[i] = dist;
            // Radio girado 90º en el sentido de la torsión
            dirY[i] = -rotationSign * rz / dist;
            dirZ[i] = rotationSign * ry / dist;
            cMax = Math.max(cMax, dist);
        }
        return new IcrTrialState(center, c, dirY, dirZ, cMax);
    }

    public int size() {
        return distances.length;
    }

    /**
     * Indica si el elemento coincide con el centro y no aporta resistencia.
     */
    public boolean isAtCenter(int index) {
        return distances[index] == 0.0;
    }
}
