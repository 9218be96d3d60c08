package projectphoton.physics.impl;

import org.apache.commons.math3.complex.Complex;

import static projectphoton.physics.PhysicalConstants.ELEMENTARY_CHARGE;
import static projectphoton.physics.PhysicalConstants.MILLI;
import static projectphoton.physics.PhysicalConstants.NM_TO_CM;
import static projectphoton.physics.PhysicalConstants.NM_TO_M;
import static projectphoton.physics.PhysicalConstants.PLANCK;
import static projectphoton.physics.PhysicalConstants.SPEED_OF_LIGHT;

/**
 * Tasa de generación de excitones en la capa activa y densidad de corriente de cortocircuito
 * suponiendo eficiencia cuántica interna del 100 %.
 * <pre>
 * Q(x, λ) = α·Re(n)·AM(λ)·|E(x, λ)|²
 * G(x, λ) = Q·1e-3·λ·1e-9 / (h·c)
 * G(x)    = Σ_λ G(x, λ)·w_λ
 * Jsc     = Σ_x G(x)·Δx·1e-7·q·1e3      [mA/cm²]
 * </pre>
 */
public final class GenerationEngine {

    /**
     * Prohibido construir esta clase utilidad
     */
    private GenerationEngine() {
    }

    /**
     * Acumula en {@code rates} la contribución de una longitud de onda sobre los puntos de la capa activa.
     *
     * @param rates       Acumulador G(x), alineado con {@code activePoints}.
     * @param activePoints Índices de la rejilla que pertenecen a la capa activa.
     * @param intensity   |E|² en todos los puntos de la rejilla.
     * @param n           Índice de la capa activa.
     * @param wavelength  Longitud de onda [nm].
     * @param irradiance  Irradiancia espectral del espectro solar en esta longitud de onda.
     * @param weight      Peso de integración espectral w_λ.
     */
    public static void accumulate(double[] rates, int[] activePoints, double[] intensity,
                                  Complex n, double wavelength, double irradiance, double weight) {
        final double factor = spectralFactor(n, wavelength, irradiance) * weight;
        for (int i = 0; i < activePoints.length; i++) {
            rates[i] += factor * intensity[activePoints[i]];
        }
    }

    /**
     * G(x, λ) / |E|²: todo lo que no depende de la posición.
     */
    public static double spectralFactor(Complex n, double wavelength, double irradiance) {
        final double q = AbsorptionEngine.absorptionCoefficient(n, wavelength) * n.getReal() * irradiance;
        return q * MILLI * wavelength * NM_TO_M / (PLANCK * SPEED_OF_LIGHT);
    }

    /**
     * Densidad de corriente de cortocircuito [mA/cm²].
     *
     * @param rates        G(x) en los puntos de la capa activa.
     * @param positionStep Paso de la rejilla de posiciones [nm].
     */
    public static double shortCircuitCurrent(double[] rates, double positionStep) {
        double sum = 0.0;
        for (double rate : rates) {
            sum += rate;
        }
        return sum * positionStep * NM_TO_CM * ELEMENTARY_CHARGE / MILLI;
    }
}
