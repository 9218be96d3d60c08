package projectphoton.physics.impl;

import org.apache.commons.math3.complex.Complex;
import projectphoton.physics.i.IPartialMatrixCalculator;
import projectphoton.physics.matrix.InterfaceMatrix;
import projectphoton.physics.matrix.PropagationMatrix;
import projectphoton.physics.matrix.TransferMatrix;
import projectphoton.physics.solver.PartialMatrices;

/**
 * Recalcula S' y S'' de cada capa con el producto completo, de izquierda a derecha.
 * Coste O(capas²) por longitud de onda. Sirve de referencia para la versión acumulada.
 */
public class LiteralPartialMatrixCalculator implements IPartialMatrixCalculator {

    @Override
    public String getName() {
        return "TMM-Literal";
    }

    @Override
    public String getDescription() {
        return "Productos S' y S'' recalculados por capa: O(capas²) por longitud de onda";
    }

    @Override
    public PartialMatrices calculate(Complex[] n, double[] d, double wavelength) {
        final int layerCount = n.length;
        TransferMatrix[] prime = new TransferMatrix[layerCount];
        TransferMatrix[] doublePrime = new TransferMatrix[layerCount];

        for (int m = 1; m < layerCount; m++) {
            // S'_m = I(0,1) · Π_{k=1..m-1} L(k) · I(k,k+1)
            TransferMatrix sPrime = InterfaceMatrix.of(n[0], n[1]);
            for (int k = 1; k <= m - 1; k++) {
                sPrime = sPrime
                        .multiply(PropagationMatrix.of(n[k], d[k], wavelength))
                        .multiply(InterfaceMatrix.of(n[k], n[k + 1]));
            }

            // S''_m = Π_{k=m..N-2} I(k,k+1) · L(k+1)
            TransferMatrix sDoublePrime = TransferMatrix.identity();
            for (int k = m; k <= layerCount - 2; k++) {
                sDoublePrime = sDoublePrime
                        .multiply(InterfaceMatrix.of(n[k], n[k + 1]))
                        .multiply(PropagationMatrix.of(n[k + 1], d[k + 1], wavelength));
            }

            prime[m] = sPrime;
            doublePrime[m] = sDoublePrime;
        }
        return new PartialMatrices(prime, doublePrime);
    }
}
