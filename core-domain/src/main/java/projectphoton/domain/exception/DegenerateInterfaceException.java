package projectphoton.domain.exception;

import org.apache.commons.math3.complex.Complex;

/**
 * Interfaz óptica sin solución: n1 + n2 = 0 (o coeficiente de transmisión nulo).
 * <p>
 * Los coeficientes de Fresnel dividen por (n1 + n2), así que no existe una matriz
 * de interfaz finita. No se corrige el caso: se informa como error de cálculo.
 */
public class DegenerateInterfaceException extends InvalidGeometryException {

    public DegenerateInterfaceException(Complex n1, Complex n2) {
        super(String.format("Interfaz degenerada entre n1=(%g%+gi) y n2=(%g%+gi): n1 + n2 = 0 o t = 0",
                n1.getReal(), n1.getImaginary(), n2.getReal(), n2.getImaginary()));
    }
}
