package projectphoton.domain.simulation;

import lombok.Getter;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * Campo eléctrico normalizado E(x, λ) sobre la rejilla de posiciones y longitudes de onda.
 * <p>
 * Almacenamiento plano ordenado por longitud de onda: el elemento (p, l) vive en
 * {@code l * positionCount + p}. Así cada longitud de onda ocupa un tramo contiguo y el
 * simulador puede rellenarlo en streaming. La instancia toma posesión de los arrays
 * recibidos (no se copian por su tamaño).
 */
public final class FieldMap {

    @Getter
    private final int positionCount;
    @Getter
    private final int wavelengthCount;
    private final double[] real;
    private final double[] imag;

    public FieldMap(int positionCount, int wavelengthCount, double[] real, double[] imag) {
        Objects.requireNonNull(real, "La parte real del campo no puede ser nula.");
        Objects.requireNonNull(imag, "La parte imaginaria del campo no puede ser nula.");
        long expected = (long) positionCount * wavelengthCount;
        if (real.length != expected || imag.length != expected) {
            throw new IllegalArgumentException("Los arrays del campo deben tener " + expected + " elementos.");
        }
        this.positionCount = positionCount;
        this.wavelengthCount = wavelengthCount;
        this.real = real;
        this.imag = imag;
    }

    private int offset(int positionIndex, int wavelengthIndex) {
        if (positionIndex < 0 || positionIndex >= positionCount || wavelengthIndex < 0 || wavelengthIndex >= wavelengthCount) {
            throw new IndexOutOfBoundsException("Elemento (" + positionIndex + ", " + wavelengthIndex + ") fuera del mapa de campo "
                    + positionCount + "x" + wavelengthCount + ".");
        }
        return wavelengthIndex * positionCount + positionIndex;
    }

    public Complex getField(int positionIndex, int wavelengthIndex) {
        int i = offset(positionIndex, wavelengthIndex);
        return new Complex(real[i], imag[i]);
    }

    /**
     * |E|² en un punto.
     */
    public double getIntensity(int positionIndex, int wavelengthIndex) {
        int i = offset(positionIndex, wavelengthIndex);
        return real[i] * real[i] + imag[i] * imag[i];
    }

    /**
     * Perfil |E|² a lo largo de todo el dispositivo para una longitud de onda.
     */
    public double[] getIntensityProfile(int wavelengthIndex) {
        double[] profile = new double[positionCount];
        if (positionCount == 0) {
            return profile;
        }
        int base = offset(0, wavelengthIndex);
        for (int p = 0; p < positionCount; p++) {
            double re = real[base + p];
            double im = imag[base + p];
            profile[p] = re * re + im * im;
        }
        return profile;
    }
}
