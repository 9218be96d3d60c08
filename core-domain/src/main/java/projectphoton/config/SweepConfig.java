package projectphoton.config;

import lombok.Builder;
import projectphoton.domain.exception.InvalidGeometryException;

/**
 * Barrido del espesor de una capa interior.
 *
 * @param layerIndex Índice (base 0) de la capa cuyo espesor se varía.
 * @param start      Espesor inicial [nm] (> 0).
 * @param stop       Espesor final, inclusivo [nm].
 * @param step       Incremento [nm] (> 0).
 */
@Builder
public record SweepConfig(int layerIndex, double start, double stop, double step) {

    public SweepConfig {
        if (layerIndex < 1) {
            throw new InvalidGeometryException("Solo se puede barrer el espesor de una capa interior (índice >= 1).");
        }
        if (!(start > 0) || !(step > 0) || stop < start) {
            throw new InvalidGeometryException(String.format(
                    "Barrido inválido: inicio=%s, fin=%s, paso=%s (se requiere 0 < inicio <= fin y paso > 0)",
                    start, stop, step));
        }
    }

    /**
     * Espesores del barrido, de {@code start} a {@code stop} ambos incluidos.
     */
    public double[] thicknesses() {
        int count = (int) Math.floor((stop - start) / step + 1e-9) + 1;
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        return values;
    }
}
