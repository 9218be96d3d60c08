package projectphoton.physics.matrix;

import org.apache.commons.math3.complex.Complex;
import projectphoton.domain.exception.DegenerateInterfaceException;

/**
 * Matriz de interfaz I entre dos medios de índices complejos n1 y n2 (incidencia normal).
 * <pre>
 * r = (n1 - n2) / (n1 + n2)
 * t = 2·n1 / (n1 + n2)
 * I = [[1, r], [r, 1]] / t
 * </pre>
 * Si n1 + n2 = 0 la matriz no existe: se lanza {@link DegenerateInterfaceException} en
 * lugar de devolver una matriz con NaN o infinitos. Lo mismo ocurre si t = 0 (n1 = 0).
 */
public final class InterfaceMatrix {

    /**
     * Prohibido construir esta clase utilidad
     */
    private InterfaceMatrix() {
    }

    /**
     * Construye la matriz de interfaz. Esta clase es Thread safe.
     *
     * @param n1 Índice del medio de procedencia.
     * @param n2 Índice del medio de destino.
     * @return La matriz I. Si n1 = n2 es la identidad.
     * @throws DegenerateInterfaceException si n1 + n2 = 0 o t = 0.
     */
    public static TransferMatrix of(Complex n1, Complex n2) {
        final Complex sum = n1.add(n2);
        if (sum.getReal() == 0.0 && sum.getImaginary() == 0.0) {
            throw new DegenerateInterfaceException(n1, n2);
        }
        final Complex r = reflectionCoefficient(n1, n2);
        final Complex t = transmissionCoefficient(n1, n2);
        if (t.getReal() == 0.0 && t.getImaginary() == 0.0) {
            throw new DegenerateInterfaceException(n1, n2);
        }

        final Complex inverseT = Complex.ONE.divide(t);
        final Complex offDiagonal = r.multiply(inverseT);
        return TransferMatrix.of(inverseT, offDiagonal, offDiagonal, inverseT);
    }

    /**
     * Coeficiente de reflexión de Fresnel en amplitud, r = (n1 - n2) / (n1 + n2).
     */
    public static Complex reflectionCoefficient(Complex n1, Complex n2) {
        return n1.subtract(n2).divide(n1.add(n2));
    }

    /**
     * Coeficiente de transmisión de Fresnel en amplitud, t = 2·n1 / (n1 + n2).
     */
    public static Complex transmissionCoefficient(Complex n1, Complex n2) {
        return n1.multiply(2.0).divide(n1.add(n2));
    }
}
