package projectphoton.domain.optics;

import org.apache.commons.math3.complex.Complex;
import projectphoton.domain.exception.InvalidGeometryException;

import java.util.Objects;

/**
 * Índices de refracción complejos de cada capa en cada longitud de onda de la rejilla.
 * <p>
 * Inmutable. Está definida para todas las combinaciones (capa, longitud de onda), ya
 * sea por interpolación o por extrapolación en el proveedor.
 */
public final class RefractiveIndexTable {

    private final Complex[][] indices;

    /**
     * @param indices Matriz [capa][longitud de onda]. Todas las filas deben tener la misma longitud.
     */
    public RefractiveIndexTable(Complex[][] indices) {
        Objects.requireNonNull(indices, "La tabla de índices no puede ser nula.");
        if (indices.length == 0) {
            throw new InvalidGeometryException("La tabla de índices no contiene capas.");
        }
        int wavelengthCount = indices[0].length;
        Complex[][] copy = new Complex[indices.length][];
        for (int layer = 0; layer < indices.length; layer++) {
            if (indices[layer] == null || indices[layer].length != wavelengthCount) {
                throw new InvalidGeometryException("La capa " + layer + " no tiene índices para las " + wavelengthCount + " longitudes de onda.");
            }
            for (int l = 0; l < wavelengthCount; l++) {
                Objects.requireNonNull(indices[layer][l], "Índice nulo en la capa " + layer + ", longitud de onda " + l);
            }
            copy[layer] = indices[layer].clone();
        }
        this.indices = copy;
    }

    public int getLayerCount() {
        return indices.length;
    }

    public int getWavelengthCount() {
        return indices[0].length;
    }

    public Complex get(int layer, int wavelengthIndex) {
        return indices[layer][wavelengthIndex];
    }

    /**
     * Espectro n + ik de una capa.
     */
    public Complex[] getLayerSpectrum(int layer) {
        return indices[layer].clone();
    }

    /**
     * Índices de todas las capas en una longitud de onda, en orden de apilamiento.
     */
    public Complex[] getColumn(int wavelengthIndex) {
        Complex[] column = new Complex[indices.length];
        for (int layer = 0; layer < indices.length; layer++) {
            column[layer] = indices[layer][wavelengthIndex];
        }
        return column;
    }

    /**
     * Copia de la tabla con el espectro de una capa reemplazado.
     */
    public RefractiveIndexTable withLayerSpectrum(int layer, Complex[] spectrum) {
        Complex[][] copy = indices.clone();
        copy[layer] = spectrum;
        return new RefractiveIndexTable(copy);
    }
}
