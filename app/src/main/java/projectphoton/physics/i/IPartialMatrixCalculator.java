package projectphoton.physics.i;

import org.apache.commons.math3.complex.Complex;
import projectphoton.physics.solver.PartialMatrices;

/**
 * Calcula, para una longitud de onda, las matrices parciales S' (desde el superestrato
 * hasta la capa anterior) y S'' (desde la capa hasta el final) de cada capa.
 */
public interface IPartialMatrixCalculator extends ISolverComponent {

    /**
     * @param indices     Índice complejo de cada capa en esta longitud de onda.
     * @param thicknesses Espesor efectivo de cada capa [nm] (la capa 0 vale cero).
     * @param wavelength  Longitud de onda [nm].
     * @return Matrices parciales de las capas 1..N-1.
     */
    PartialMatrices calculate(Complex[] indices, double[] thicknesses, double wavelength);
}
