package projectphoton.domain.stack;

import projectphoton.domain.exception.InvalidGeometryException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Rejilla ordenada de longitudes de onda [nm] sobre la que se evalúa todo el cálculo espectral.
 * <p>
 * Debe ser no vacía y estrictamente creciente. La integración espectral usa el paso
 * uniforme cuando la rejilla lo es y el espaciado real en caso contrario.
 */
public final class WavelengthGrid {

    private static final double UNIFORMITY_TOLERANCE = 1e-9;

    private final double[] wavelengths;

    private WavelengthGrid(double[] wavelengths) {
        Objects.requireNonNull(wavelengths, "El array de longitudes de onda no puede ser nulo.");
        if (wavelengths.length == 0) {
            throw new InvalidGeometryException("La rejilla de longitudes de onda no puede estar vacía.");
        }
        for (int i = 0; i < wavelengths.length; i++) {
            if (!Double.isFinite(wavelengths[i]) || wavelengths[i] <= 0) {
                throw new InvalidGeometryException("Longitud de onda no válida en la posición " + i + ": " + wavelengths[i]);
            }
            if (i > 0 && wavelengths[i] <= wavelengths[i - 1]) {
                throw new InvalidGeometryException("La rejilla de longitudes de onda debe ser estrictamente creciente (índice " + i + ").");
            }
        }
        this.wavelengths = wavelengths.clone();
    }

    public static WavelengthGrid of(double... wavelengths) {
        return new WavelengthGrid(wavelengths);
    }

    /**
     * Rejilla uniforme de {@code start} a {@code stop} (inclusivo) con paso {@code step}.
     */
    public static WavelengthGrid uniform(double start, double stop, double step) {
        if (!(step > 0) || stop < start) {
            throw new InvalidGeometryException(String.format(
                    "Rango espectral inválido: inicio=%s, fin=%s, paso=%s", start, stop, step));
        }
        int count = (int) Math.floor((stop - start) / step + 1e-9) + 1;
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        return new WavelengthGrid(values);
    }

    public int size() {
        return wavelengths.length;
    }

    public double get(int index) {
        return wavelengths[index];
    }

    public double[] toArray() {
        return wavelengths.clone();
    }

    public double getMin() {
        return wavelengths[0];
    }

    public double getMax() {
        return wavelengths[wavelengths.length - 1];
    }

    public boolean isUniform() {
        if (wavelengths.length < 3) {
            return true;
        }
        double step = getStep();
        for (int i = 1; i < wavelengths.length; i++) {
            double delta = wavelengths[i] - wavelengths[i - 1];
            if (Math.abs(delta - step) > UNIFORMITY_TOLERANCE * Math.max(1.0, step)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Paso medio (max - min) / (n - 1). Con una sola longitud de onda vale 1.
     */
    public double getStep() {
        if (wavelengths.length == 1) {
            return 1.0;
        }
        return (getMax() - getMin()) / (wavelengths.length - 1);
    }

    /**
     * Pesos de integración espectral por longitud de onda.
     * <p>
     * Rejilla uniforme: todos valen el paso. Rejilla no uniforme: semisuma de los intervalos
     * adyacentes en los puntos interiores y el intervalo completo en los extremos, de modo que
     * ambas reglas coinciden cuando el espaciado es constante.
     */
    public double[] integrationWeights() {
        int n = wavelengths.length;
        double[] weights = new double[n];
        if (n == 1 || isUniform()) {
            Arrays.fill(weights, getStep());
            return weights;
        }
        weights[0] = wavelengths[1] - wavelengths[0];
        weights[n - 1] = wavelengths[n - 1] - wavelengths[n - 2];
        for (int i = 1; i < n - 1; i++) {
            weights[i] = 0.5 * (wavelengths[i + 1] - wavelengths[i - 1]);
        }
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(wavelengths, ((WavelengthGrid) o).wavelengths);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(wavelengths);
    }

    @Override
    public String toString() {
        return String.format("WavelengthGrid[%d puntos, %.1f-%.1f nm]", wavelengths.length, getMin(), getMax());
    }
}
