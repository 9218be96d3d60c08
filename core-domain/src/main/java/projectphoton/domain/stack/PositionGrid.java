package projectphoton.domain.stack;

import lombok.Getter;
import projectphoton.domain.exception.InvalidGeometryException;

import java.util.Objects;

/**
 * Rejilla de profundidades [nm] donde se evalúa el campo eléctrico.
 * <p>
 * Los puntos están en {@code step/2, 3·step/2, ...} hasta la profundidad total del
 * apilamiento. Cada punto pertenece a la capa cuyo intervalo acumulado
 * {@code (c[m-1], c[m]]} lo contiene; un punto exactamente sobre una frontera
 * pertenece a la capa anterior.
 */
public final class PositionGrid {

    @Getter
    private final double step;
    private final double[] positions;
    private final double[] localDepths;
    private final int[] layerIndex;
    private final int[][] indicesByLayer;

    private PositionGrid(double step, double[] positions, double[] localDepths, int[] layerIndex, int[][] indicesByLayer) {
        this.step = step;
        this.positions = positions;
        this.localDepths = localDepths;
        this.layerIndex = layerIndex;
        this.indicesByLayer = indicesByLayer;
    }

    /**
     * Construye la rejilla para un apilamiento dado.
     *
     * @param stack El apilamiento de capas.
     * @param step  Separación entre puntos [nm] (> 0).
     * @return La rejilla con la asignación punto → capa.
     */
    public static PositionGrid create(LayerStack stack, double step) {
        Objects.requireNonNull(stack, "El apilamiento no puede ser nulo.");
        if (!(step > 0) || !Double.isFinite(step)) {
            throw new InvalidGeometryException("El paso de posición debe ser positivo, se recibió " + step);
        }

        final double total = stack.getTotalDepth();
        final int count = total >= step / 2.0
                ? (int) Math.floor((total - step / 2.0) / step + 1e-9) + 1
                : 0;
        final int layerCount = stack.getLayerCount();
        final double[] boundaries = stack.cloneCumulativeBoundaries();

        double[] positions = new double[count];
        double[] localDepths = new double[count];
        int[] layerIndex = new int[count];
        int[] perLayer = new int[layerCount];

        for (int i = 0; i < count; i++) {
            double x = step / 2.0 + i * step;
            // Número de fronteras estrictamente por debajo de x: la frontera de la capa 0 es 0
            int m = 0;
            while (m < layerCount && x > boundaries[m]) {
                m++;
            }
            // Un punto redondeado por encima de la profundidad total se queda en la última capa
            m = Math.min(m, layerCount - 1);
            positions[i] = x;
            layerIndex[i] = m;
            localDepths[i] = x - boundaries[m - 1];
            perLayer[m]++;
        }

        int[][] indicesByLayer = new int[layerCount][];
        int[] cursor = new int[layerCount];
        for (int m = 0; m < layerCount; m++) {
            indicesByLayer[m] = new int[perLayer[m]];
        }
        for (int i = 0; i < count; i++) {
            int m = layerIndex[i];
            indicesByLayer[m][cursor[m]++] = i;
        }

        return new PositionGrid(step, positions, localDepths, layerIndex, indicesByLayer);
    }

    public int size() {
        return positions.length;
    }

    public double getPosition(int index) {
        return positions[index];
    }

    public double[] clonePositions() {
        return positions.clone();
    }

    /**
     * Capa a la que pertenece el punto {@code index}.
     */
    public int getLayerIndexAt(int index) {
        return layerIndex[index];
    }

    /**
     * Distancia del punto a la interfaz con la capa anterior [nm].
     */
    public double getLocalDepth(int index) {
        return localDepths[index];
    }

    /**
     * Índices de los puntos contenidos en una capa, en orden creciente de profundidad.
     */
    public int[] getIndicesInLayer(int layer) {
        if (layer < 0 || layer >= indicesByLayer.length) {
            throw new IndexOutOfBoundsException("El índice de capa " + layer + " está fuera de los límites [0, " + (indicesByLayer.length - 1) + "].");
        }
        return indicesByLayer[layer].clone();
    }

    public int countInLayer(int layer) {
        return indicesByLayer[layer].length;
    }

    @Override
    public String toString() {
        return String.format("PositionGrid[%d puntos, paso %.3f nm]", positions.length, step);
    }
}
