package projectphoton.physics.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectphoton.physics.matrix.InterfaceMatrix;
import projectphoton.physics.matrix.PropagationMatrix;
import projectphoton.physics.matrix.TransferMatrix;
import projectphoton.physics.solver.PartialMatrices;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Compara la estrategia acumulada contra el recálculo literal de S' y S''.
 */
@Slf4j
class PartialMatrixCalculatorAccuracyTest {

    private static final double RELATIVE_TOLERANCE = 1e-10;

    // Vidrio | ITO | PEDOT | absorbente | Ca | Al | aire
    private static final Complex[] INDICES = {
            new Complex(1.46, 0),
            new Complex(1.9, 0.02),
            new Complex(1.5, 0.05),
            new Complex(2.0, 0.35),
            new Complex(0.3, 2.5),
            new Complex(0.8, 5.0),
            new Complex(1.0, 0)
    };
    private static final double[] THICKNESSES = {0, 110, 35, 220, 7, 100, 0};

    private final LiteralPartialMatrixCalculator literal = new LiteralPartialMatrixCalculator();
    private final CumulativePartialMatrixCalculator cumulative = new CumulativePartialMatrixCalculator();

    private static double relativeDifference(TransferMatrix a, TransferMatrix b) {
        return a.maxDifference(b) / Math.max(1.0, a.maxNorm());
    }

    @Test
    @DisplayName("LITERAL y CUMULATIVE coinciden en todas las capas y longitudes de onda")
    void strategies_agreeForEveryLayer() {
        double worst = 0.0;
        for (double lambda = 350; lambda <= 800; lambda += 25) {
            // ACT
            PartialMatrices a = literal.calculate(INDICES, THICKNESSES, lambda);
            PartialMatrices b = cumulative.calculate(INDICES, THICKNESSES, lambda);

            // ASSERT
            for (int m = 1; m < INDICES.length; m++) {
                double dPrime = relativeDifference(a.getPrime(m), b.getPrime(m));
                double dDoublePrime = relativeDifference(a.getDoublePrime(m), b.getDoublePrime(m));
                worst = Math.max(worst, Math.max(dPrime, dDoublePrime));
                assertTrue(dPrime < RELATIVE_TOLERANCE, "S' capa " + m + " λ=" + lambda + ": " + dPrime);
                assertTrue(dDoublePrime < RELATIVE_TOLERANCE, "S'' capa " + m + " λ=" + lambda + ": " + dDoublePrime);
            }
        }
        log.info("Máxima diferencia relativa LITERAL vs CUMULATIVE: {}", worst);
    }

    @Test
    @DisplayName("S' de la capa de salida es la matriz del sistema y S'' la identidad")
    void exitLayer_partialsAreSystemAndIdentity() {
        // ARRANGE: producto directo I(0,1)·Π L(k)·I(k,k+1)
        double lambda = 520;
        TransferMatrix expected = InterfaceMatrix.of(INDICES[0], INDICES[1]);
        for (int k = 1; k < INDICES.length - 1; k++) {
            expected = expected
                    .multiply(PropagationMatrix.of(INDICES[k], THICKNESSES[k], lambda))
                    .multiply(InterfaceMatrix.of(INDICES[k], INDICES[k + 1]));
        }

        // ACT
        PartialMatrices partials = cumulative.calculate(INDICES, THICKNESSES, lambda);

        // ASSERT
        int exit = INDICES.length - 1;
        assertTrue(relativeDifference(expected, partials.getSystemMatrix()) < RELATIVE_TOLERANCE);
        assertEquals(TransferMatrix.identity(), partials.getDoublePrime(exit));
        assertEquals(partials.getSystemMatrix(), partials.getPrime(exit));
    }

    @Test
    @DisplayName("Para cualquier capa, S'·L(m)·S'' reconstruye la matriz del sistema")
    void partials_recomposeSystemMatrix() {
        double lambda = 610;
        PartialMatrices partials = cumulative.calculate(INDICES, THICKNESSES, lambda);
        TransferMatrix system = partials.getSystemMatrix();

        for (int m = 1; m < INDICES.length; m++) {
            TransferMatrix recomposed = partials.getPrime(m)
                    .multiply(PropagationMatrix.of(INDICES[m], m == INDICES.length - 1 ? 0 : THICKNESSES[m], lambda))
                    .multiply(partials.getDoublePrime(m));
            assertTrue(relativeDifference(system, recomposed) < RELATIVE_TOLERANCE, "Capa " + m);
        }
    }

    @Test
    @DisplayName("Cada estrategia se identifica por su nombre")
    void names() {
        assertEquals("TMM-Literal", literal.getName());
        assertEquals("TMM-Cumulative", cumulative.getName());
    }
}
