package projectphoton.domain.simulation;

import java.util.Objects;

/**
 * Fracción de la potencia incidente absorbida por cada capa en cada longitud de onda.
 * La capa 0 (superestrato incoherente) no absorbe en este modelo.
 */
public final class AbsorptionSpectrum {

    private final double[][] absorption;

    /**
     * @param absorption Matriz [capa][longitud de onda].
     */
    public AbsorptionSpectrum(double[][] absorption) {
        Objects.requireNonNull(absorption, "La matriz de absorción no puede ser nula.");
        double[][] copy = new double[absorption.length][];
        for (int layer = 0; layer < absorption.length; layer++) {
            copy[layer] = absorption[layer].clone();
            if (layer > 0 && copy[layer].length != copy[0].length) {
                throw new IllegalArgumentException("Todas las capas deben tener el mismo número de longitudes de onda.");
            }
        }
        this.absorption = copy;
    }

    public int getLayerCount() {
        return absorption.length;
    }

    public int getWavelengthCount() {
        return absorption.length == 0 ? 0 : absorption[0].length;
    }

    public double get(int layer, int wavelengthIndex) {
        return absorption[layer][wavelengthIndex];
    }

    public double[] getLayerSpectrum(int layer) {
        return absorption[layer].clone();
    }

    /**
     * Absorción sumada de todas las capas en una longitud de onda.
     */
    public double getTotalAt(int wavelengthIndex) {
        double total = 0.0;
        for (double[] layer : absorption) {
            total += layer[wavelengthIndex];
        }
        return total;
    }
}
