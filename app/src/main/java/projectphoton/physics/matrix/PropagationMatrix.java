package projectphoton.physics.matrix;

import org.apache.commons.math3.complex.Complex;
import projectphoton.domain.exception.InvalidGeometryException;

/**
 * Matriz de propagación L a través de una capa homogénea:
 * {@code diag(exp(-i·ξ·d), exp(i·ξ·d))} con {@code ξ = 2π·n/λ}.
 */
public final class PropagationMatrix {

    private static final double TWO_PI = 2.0 * Math.PI;

    /**
     * Prohibido construir esta clase utilidad
     */
    private PropagationMatrix() {
    }

    /**
     * @param n          Índice complejo de la capa.
     * @param thickness  Espesor [nm] (>= 0). Con espesor cero la matriz es la identidad.
     * @param wavelength Longitud de onda [nm] (> 0).
     */
    public static TransferMatrix of(Complex n, double thickness, double wavelength) {
        if (!(thickness >= 0)) {
            throw new InvalidGeometryException("El espesor de propagación no puede ser negativo: " + thickness);
        }
        final Complex phase = waveNumber(n, wavelength).multiply(thickness);
        return TransferMatrix.diagonal(
                Complex.I.multiply(phase).negate().exp(),
                Complex.I.multiply(phase).exp());
    }

    /**
     * Número de onda complejo ξ = 2π·n/λ [nm⁻¹].
     */
    public static Complex waveNumber(Complex n, double wavelength) {
        if (!(wavelength > 0)) {
            throw new InvalidGeometryException("La longitud de onda debe ser positiva: " + wavelength);
        }
        return n.multiply(TWO_PI / wavelength);
    }
}
