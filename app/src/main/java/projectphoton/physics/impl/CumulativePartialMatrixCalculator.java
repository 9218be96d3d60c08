package projectphoton.physics.impl;

import org.apache.commons.math3.complex.Complex;
import projectphoton.physics.i.IPartialMatrixCalculator;
import projectphoton.physics.matrix.InterfaceMatrix;
import projectphoton.physics.matrix.PropagationMatrix;
import projectphoton.physics.matrix.TransferMatrix;
import projectphoton.physics.solver.PartialMatrices;

/**
 * Obtiene S' y S'' con productos prefijo y sufijo acumulados: O(capas) por longitud de onda.
 * <p>
 * S'_{m+1} = S'_m · L(m) · I(m, m+1) y S''_m = I(m, m+1) · L(m+1) · S''_{m+1}.
 * Solo cambia la asociatividad respecto a {@link LiteralPartialMatrixCalculator}, por lo
 * que las diferencias quedan en el nivel del redondeo.
 */
public class CumulativePartialMatrixCalculator implements IPartialMatrixCalculator {

    @Override
    public String getName() {
        return "TMM-Cumulative";
    }

    @Override
    public String getDescription() {
        return "Productos prefijo/sufijo acumulados: O(capas) por longitud de onda";
    }

    @Override
    public PartialMatrices calculate(Complex[] n, double[] d, double wavelength) {
        final int layerCount = n.length;
        TransferMatrix[] prime = new TransferMatrix[layerCount];
        TransferMatrix[] doublePrime = new TransferMatrix[layerCount];

        // Interfaces compartidas por los dos barridos
        TransferMatrix[] interfaces = new TransferMatrix[layerCount - 1];
        for (int k = 0; k < layerCount - 1; k++) {
            interfaces[k] = InterfaceMatrix.of(n[k], n[k + 1]);
        }

        // 1. Prefijos
        prime[1] = interfaces[0];
        for (int m = 1; m < layerCount - 1; m++) {
            prime[m + 1] = prime[m]
                    .multiply(PropagationMatrix.of(n[m], d[m], wavelength))
                    .multiply(interfaces[m]);
        }

        // 2. Sufijos
        doublePrime[layerCount - 1] = TransferMatrix.identity();
        for (int m = layerCount - 2; m >= 1; m--) {
            doublePrime[m] = interfaces[m]
                    .multiply(PropagationMatrix.of(n[m + 1], d[m + 1], wavelength))
                    .multiply(doublePrime[m + 1]);
        }

        return new PartialMatrices(prime, doublePrime);
    }
}
