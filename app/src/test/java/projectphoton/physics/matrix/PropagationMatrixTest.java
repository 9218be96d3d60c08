package projectphoton.physics.matrix;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectphoton.domain.exception.InvalidGeometryException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PropagationMatrixTest {

    private static final double EPSILON = 1e-12;

    @Test
    @DisplayName("Espesor cero da la identidad")
    void zeroThickness_isIdentity() {
        TransferMatrix matrix = PropagationMatrix.of(new Complex(1.8, 0.4), 0.0, 500);

        assertTrue(matrix.maxDifference(TransferMatrix.identity()) < EPSILON);
    }

    @Test
    @DisplayName("En un medio sin pérdidas solo cambia la fase")
    void lossless_preservesModulus() {
        // ξ·d = 2π·1.5·100/600 = π/2
        TransferMatrix matrix = PropagationMatrix.of(new Complex(1.5, 0), 100, 600);

        assertEquals(1.0, matrix.m11().abs(), EPSILON);
        assertEquals(1.0, matrix.m22().abs(), EPSILON);
        assertEquals(-1.0, matrix.m11().getImaginary(), EPSILON);
        assertEquals(1.0, matrix.m22().getImaginary(), EPSILON);
        assertEquals(0.0, matrix.m12().abs());
    }

    @Test
    @DisplayName("En un medio absorbente los módulos son exp(±2πkd/λ)")
    void absorbing_scalesByExtinction() {
        double k = 0.3;
        double d = 50;
        double lambda = 500;
        double expected = Math.exp(2 * Math.PI * k * d / lambda);

        TransferMatrix matrix = PropagationMatrix.of(new Complex(2.0, k), d, lambda);

        assertEquals(expected, matrix.m11().abs(), 1e-10);
        assertEquals(1.0 / expected, matrix.m22().abs(), 1e-10);
    }

    @Test
    @DisplayName("Espesor negativo o longitud de onda no positiva son inválidos")
    void invalidArguments_shouldThrow() {
        assertThatThrownBy(() -> PropagationMatrix.of(Complex.ONE, -1, 500)).isInstanceOf(InvalidGeometryException.class);
        assertThatThrownBy(() -> PropagationMatrix.of(Complex.ONE, 10, 0)).isInstanceOf(InvalidGeometryException.class);
    }
}
