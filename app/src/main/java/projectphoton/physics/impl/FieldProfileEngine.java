package projectphoton.physics.impl;

import org.apache.commons.math3.complex.Complex;
import projectphoton.domain.stack.PositionGrid;
import projectphoton.physics.matrix.PropagationMatrix;
import projectphoton.physics.matrix.TransferMatrix;
import projectphoton.physics.solver.PartialMatrices;
import projectphoton.physics.solver.WavelengthSolution;

/**
 * Evalúa el campo eléctrico normalizado a la onda incidente en cada punto de la rejilla.
 * <pre>
 *            S''11·e^{-iξ(d-x)} + S''21·e^{iξ(d-x)}
 * E(x) = T · ---------------------------------------
 *            S'11·S''11·e^{-iξd} + S'12·S''21·e^{iξd}
 * </pre>
 * con ξ = 2π·n/λ, d el espesor de la capa y x la profundidad local dentro de ella.
 */
public final class FieldProfileEngine {

    private static final Complex MINUS_I = Complex.I.negate();

    /**
     * Prohibido construir esta clase utilidad
     */
    private FieldProfileEngine() {
    }

    /**
     * @param solution    Solución del sistema en esta longitud de onda.
     * @param indices     Índices complejos de las capas.
     * @param thicknesses Espesores efectivos [nm].
     * @param grid        Rejilla de posiciones.
     * @return El campo en cada punto de la rejilla.
     */
    public static FieldProfile evaluate(WavelengthSolution solution, Complex[] indices, double[] thicknesses,
                                        PositionGrid grid) {
        final int size = grid.size();
        final double[] real = new double[size];
        final double[] imag = new double[size];
        final PartialMatrices partials = solution.partialMatrices();
        final double wavelength = solution.wavelength();
        final double t = solution.fieldTransmission();

        for (int m = 1; m < indices.length; m++) {
            int[] points = grid.getIndicesInLayer(m);
            if (points.length == 0) {
                continue;
            }
            final TransferMatrix sPrime = partials.getPrime(m);
            final TransferMatrix sDoublePrime = partials.getDoublePrime(m);
            final Complex xi = PropagationMatrix.waveNumber(indices[m], wavelength);
            final double d = thicknesses[m];

            final Complex denominator = sPrime.m11().multiply(sDoublePrime.m11()).multiply(MINUS_I.multiply(xi).multiply(d).exp())
                    .add(sPrime.m12().multiply(sDoublePrime.m21()).multiply(Complex.I.multiply(xi).multiply(d).exp()));
            final Complex scale = denominator.reciprocal().multiply(t);

            for (int p : points) {
                double remaining = d - grid.getLocalDepth(p);
                Complex numerator = sDoublePrime.m11().multiply(MINUS_I.multiply(xi).multiply(remaining).exp())
                        .add(sDoublePrime.m21().multiply(Complex.I.multiply(xi).multiply(remaining).exp()));
                Complex field = numerator.multiply(scale);
                real[p] = field.getReal();
                imag[p] = field.getImaginary();
            }
        }
        return new FieldProfile(real, imag);
    }
}
