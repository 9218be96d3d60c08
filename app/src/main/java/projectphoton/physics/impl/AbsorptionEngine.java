package projectphoton.physics.impl;

import org.apache.commons.math3.complex.Complex;
import projectphoton.domain.stack.PositionGrid;

import static projectphoton.physics.PhysicalConstants.NM_TO_CM;

/**
 * Absorción por capa a partir del perfil de intensidad |E|².
 * <p>
 * α = 4π·k / λ [cm⁻¹] y A(m, λ) = Σ_{x ∈ m} α·Re(n)·|E(x)|²·Δx.
 * Es una suma de Riemann sobre los puntos de la capa, no una integral exacta.
 */
public final class AbsorptionEngine {

    /**
     * Prohibido construir esta clase utilidad
     */
    private AbsorptionEngine() {
    }

    /**
     * Coeficiente de absorción α = 4π·Im(n) / (λ·1e-7) [cm⁻¹].
     *
     * @param n          Índice complejo.
     * @param wavelength Longitud de onda [nm].
     */
    public static double absorptionCoefficient(Complex n, double wavelength) {
        return 4.0 * Math.PI * n.getImaginary() / (wavelength * NM_TO_CM);
    }

    /**
     * Fracción de la potencia incidente absorbida en una capa.
     *
     * @param layer      Capa (1..N-1).
     * @param n          Índice de la capa en esta longitud de onda.
     * @param wavelength Longitud de onda [nm].
     * @param intensity  |E|² en todos los puntos de la rejilla.
     * @param grid       Rejilla de posiciones.
     * @return La absorción de la capa; 0 si no contiene puntos.
     */
    public static double layerAbsorption(int layer, Complex n, double wavelength, double[] intensity, PositionGrid grid) {
        final double factor = absorptionCoefficient(n, wavelength) * n.getReal() * grid.getStep() * NM_TO_CM;
        double sum = 0.0;
        for (int p : grid.getIndicesInLayer(layer)) {
            sum += intensity[p];
        }
        return factor * sum;
    }

    /**
     * Absorción parásita: todo lo que ni se refleja ni absorbe la capa activa, 1 - R - A_activa.
     */
    public static double[] parasiticAbsorption(double[] reflection, double[] activeAbsorption) {
        if (reflection.length != activeAbsorption.length) {
            throw new IllegalArgumentException("Reflexión y absorción activa deben tener la misma longitud.");
        }
        double[] out = new double[reflection.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = 1.0 - reflection[i] - activeAbsorption[i];
        }
        return out;
    }
}
