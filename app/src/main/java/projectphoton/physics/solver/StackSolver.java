package projectphoton.physics.solver;

import org.apache.commons.math3.complex.Complex;
import projectphoton.domain.exception.DegenerateInterfaceException;
import projectphoton.physics.i.IPartialMatrixCalculator;
import projectphoton.physics.matrix.TransferMatrix;

/**
 * Resuelve el apilamiento en una longitud de onda: reflexión incoherente del sustrato,
 * matriz del sistema, reflectancia coherente y amplitud de campo transmitida.
 * <p>
 * La capa 0 es un sustrato grueso iluminado desde aire (n = 1) y se trata de forma
 * incoherente; sus reflexiones múltiples se suman en intensidad.
 */
public final class StackSolver {

    /**
     * Prohibido construir esta clase utilidad
     */
    private StackSolver() {
    }

    /**
     * @param indices     Índices complejos de las N capas en esta longitud de onda.
     * @param thicknesses Espesores efectivos [nm] (el de la capa 0 se ignora).
     * @param wavelength  Longitud de onda [nm].
     * @param calculator  Estrategia de cálculo de S' y S''.
     * @throws DegenerateInterfaceException si alguna interfaz, incluida la de aire/sustrato, es degenerada.
     */
    public static WavelengthSolution solve(Complex[] indices, double[] thicknesses, double wavelength,
                                           IPartialMatrixCalculator calculator) {
        if (indices.length != thicknesses.length) {
            throw new IllegalArgumentException("Índices (" + indices.length + ") y espesores (" + thicknesses.length + ") no coinciden.");
        }
        final Complex substrate = indices[0];
        validateAmbientInterface(substrate);
        final double rGlass = substrateReflectance(substrate);
        final double tGlass = substrateTransmittance(substrate);

        final PartialMatrices partials = calculator.calculate(indices, thicknesses, wavelength);
        final TransferMatrix system = partials.getSystemMatrix();

        final double rCoherent = coherentReflectance(system);
        final double denominator = 1.0 - rGlass * rCoherent;

        final double fieldTransmission = Complex.ONE.add(substrate).reciprocal().multiply(2.0).abs() / Math.sqrt(denominator);
        final double reflection = rGlass + tGlass * tGlass * rCoherent / denominator;
        final double tCoherent = coherentTransmittance(system, substrate, indices[indices.length - 1]);
        final double transmission = tGlass * tCoherent / denominator;

        return new WavelengthSolution(wavelength, rGlass, tGlass, rCoherent, fieldTransmission,
                reflection, transmission, partials);
    }

    /**
     * La interfaz aire/sustrato divide por (1 + n0): si se anula, la longitud de onda no tiene solución.
     *
     * @throws DegenerateInterfaceException si 1 + n0 = 0.
     */
    static void validateAmbientInterface(Complex n0) {
        final Complex sum = Complex.ONE.add(n0);
        if (sum.getReal() == 0.0 && sum.getImaginary() == 0.0) {
            throw new DegenerateInterfaceException(Complex.ONE, n0);
        }
    }

    /**
     * Reflectancia aire/sustrato, |(1 - n0) / (1 + n0)|².
     */
    public static double substrateReflectance(Complex n0) {
        double r = Complex.ONE.subtract(n0).divide(Complex.ONE.add(n0)).abs();
        return r * r;
    }

    /**
     * Transmitancia aire/sustrato, |4·n0 / (1 + n0)²|.
     */
    public static double substrateTransmittance(Complex n0) {
        Complex onePlus = Complex.ONE.add(n0);
        return n0.multiply(4.0).divide(onePlus.multiply(onePlus)).abs();
    }

    /**
     * Reflectancia coherente |S21 / S11|².
     */
    public static double coherentReflectance(TransferMatrix system) {
        double r = system.m21().divide(system.m11()).abs();
        return r * r;
    }

    /**
     * Transmitancia coherente del sustrato al medio de salida, Re(n_salida)/Re(n0)·|1/S11|².
     * Exacta para medios extremos sin pérdidas.
     */
    public static double coherentTransmittance(TransferMatrix system, Complex n0, Complex nExit) {
        double t = system.m11().reciprocal().abs();
        return nExit.getReal() / n0.getReal() * t * t;
    }
}
