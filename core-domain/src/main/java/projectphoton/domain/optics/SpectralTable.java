package projectphoton.domain.optics;

import projectphoton.domain.exception.InvalidGeometryException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Tabla espectral tabulada: longitudes de onda estrictamente crecientes y una o varias
 * columnas de valores (n y k de un material, o la irradiancia solar).
 *
 * @param name        Nombre de la tabla (material o espectro).
 * @param wavelengths Longitudes de onda tabuladas [nm], estrictamente crecientes.
 * @param columns     Columnas de datos, cada una de la misma longitud que {@code wavelengths}.
 */
public record SpectralTable(String name, double[] wavelengths, double[][] columns) {

    public SpectralTable {
        Objects.requireNonNull(name, "El nombre de la tabla no puede ser nulo.");
        Objects.requireNonNull(wavelengths, "Las longitudes de onda tabuladas no pueden ser nulas.");
        Objects.requireNonNull(columns, "Las columnas de la tabla no pueden ser nulas.");
        if (wavelengths.length == 0) {
            throw new InvalidGeometryException("La tabla '" + name + "' está vacía.");
        }
        for (int i = 1; i < wavelengths.length; i++) {
            if (wavelengths[i] <= wavelengths[i - 1]) {
                throw new InvalidGeometryException("Las longitudes de onda de la tabla '" + name + "' deben ser estrictamente crecientes.");
            }
        }
        double[][] copy = new double[columns.length][];
        for (int c = 0; c < columns.length; c++) {
            if (columns[c].length != wavelengths.length) {
                throw new InvalidGeometryException("La columna " + c + " de la tabla '" + name + "' no tiene la misma longitud que las longitudes de onda.");
            }
            copy[c] = columns[c].clone();
        }
        wavelengths = wavelengths.clone();
        columns = copy;
    }

    public int size() {
        return wavelengths.length;
    }

    public double[] column(int index) {
        return columns[index].clone();
    }

    @Override
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    @Override
    public double[][] columns() {
        double[][] copy = new double[columns.length][];
        for (int c = 0; c < columns.length; c++) {
            copy[c] = columns[c].clone();
        }
        return copy;
    }

    public double getMinWavelength() {
        return wavelengths[0];
    }

    public double getMaxWavelength() {
        return wavelengths[wavelengths.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpectralTable that = (SpectralTable) o;
        return name.equals(that.name) && Arrays.equals(wavelengths, that.wavelengths) && Arrays.deepEquals(columns, that.columns);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + Arrays.hashCode(wavelengths);
        result = 31 * result + Arrays.deepHashCode(columns);
        return result;
    }

    @Override
    public String toString() {
        return String.format("SpectralTable[%s, %d filas, %.1f-%.1f nm]", name, wavelengths.length, getMinWavelength(), getMaxWavelength());
    }
}
