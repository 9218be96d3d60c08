package projectphoton.domain.stack;

import lombok.Getter;
import projectphoton.domain.exception.InvalidGeometryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Apilamiento ordenado e inmutable de capas. La luz incide sobre la capa 0.
 * <p>
 * La capa 0 es un superestrato grueso e incoherente: su espesor cuenta como cero a
 * efectos de profundidad. Las capas interiores (1..N-2) deben tener espesor positivo.
 * La última capa es el medio de salida; su espesor declarado (que puede ser cero) es
 * la profundidad sobre la que se muestrea el campo transmitido.
 */
public final class LayerStack {

    private final List<Layer> layers;
    private final double[] effectiveThickness;
    private final double[] cumulativeBoundary;
    @Getter
    private final double totalDepth;

    public LayerStack(List<Layer> layers) {
        Objects.requireNonNull(layers, "La lista de capas no puede ser nula.");
        if (layers.size() < 2) {
            throw new InvalidGeometryException("El apilamiento necesita al menos dos capas (superestrato y medio de salida).");
        }
        for (int i = 1; i < layers.size() - 1; i++) {
            Layer layer = layers.get(i);
            if (!(layer.thickness() > 0)) {
                throw new InvalidGeometryException(String.format(
                        "La capa interior %d ('%s') debe tener espesor positivo, se recibió %s nm",
                        i, layer.name(), layer.thickness()));
            }
        }

        this.layers = List.copyOf(layers);
        int count = layers.size();
        this.effectiveThickness = new double[count];
        this.cumulativeBoundary = new double[count];

        // La capa 0 no aporta profundidad
        double accumulated = 0.0;
        for (int i = 1; i < count; i++) {
            effectiveThickness[i] = layers.get(i).thickness();
            accumulated += effectiveThickness[i];
            cumulativeBoundary[i] = accumulated;
        }
        this.totalDepth = accumulated;
    }

    public static LayerStack of(Layer... layers) {
        return new LayerStack(List.of(layers));
    }

    public int getLayerCount() {
        return layers.size();
    }

    public Layer getLayer(int index) {
        validateLayerIndex(index);
        return layers.get(index);
    }

    public List<Layer> getLayers() {
        return layers;
    }

    public List<String> getMaterialNames() {
        List<String> names = new ArrayList<>(layers.size());
        for (Layer layer : layers) {
            names.add(layer.name());
        }
        return names;
    }

    public int getExitLayerIndex() {
        return layers.size() - 1;
    }

    public boolean isInterior(int index) {
        return index > 0 && index < layers.size() - 1;
    }

    /**
     * Espesor usado en el cálculo [nm]: el declarado, salvo la capa 0 que vale cero.
     */
    public double getEffectiveThickness(int index) {
        validateLayerIndex(index);
        return effectiveThickness[index];
    }

    public double[] cloneEffectiveThicknesses() {
        return effectiveThickness.clone();
    }

    public double[] cloneCumulativeBoundaries() {
        return cumulativeBoundary.clone();
    }

    /**
     * Devuelve una copia del apilamiento con el espesor de una capa reemplazado.
     */
    public LayerStack withLayerThickness(int index, double thickness) {
        validateLayerIndex(index);
        List<Layer> copy = new ArrayList<>(layers);
        copy.set(index, copy.get(index).withThickness(thickness));
        return new LayerStack(copy);
    }

    private void validateLayerIndex(int index) {
        if (index < 0 || index >= layers.size()) {
            throw new IndexOutOfBoundsException("El índice de capa " + index + " está fuera de los límites [0, " + (layers.size() - 1) + "].");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LayerStack[");
        for (int i = 0; i < layers.size(); i++) {
            if (i > 0) sb.append(" | ");
            Layer layer = layers.get(i);
            sb.append(layer.name());
            if (i > 0) sb.append(' ').append(layer.thickness()).append("nm");
        }
        return sb.append(']').toString();
    }
}
