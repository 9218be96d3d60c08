package projectphoton.domain.simulation;

import java.util.Arrays;
import java.util.Objects;

/**
 * Jsc obtenida para cada espesor de un barrido sobre una capa.
 *
 * @param layerIndex  Capa cuyo espesor se varió.
 * @param thicknesses Espesores evaluados [nm].
 * @param jsc         Densidad de corriente de cortocircuito para cada espesor [mA/cm²].
 */
public record ThicknessSweepResult(int layerIndex, double[] thicknesses, double[] jsc) {

    public ThicknessSweepResult {
        Objects.requireNonNull(thicknesses, "Los espesores no pueden ser nulos.");
        Objects.requireNonNull(jsc, "Los valores de Jsc no pueden ser nulos.");
        if (thicknesses.length != jsc.length) {
            throw new IllegalArgumentException("Espesores y Jsc deben tener la misma longitud.");
        }
        thicknesses = thicknesses.clone();
        jsc = jsc.clone();
    }

    @Override
    public double[] thicknesses() {
        return thicknesses.clone();
    }

    @Override
    public double[] jsc() {
        return jsc.clone();
    }

    public int size() {
        return jsc.length;
    }

    /**
     * Espesor con la mayor Jsc del barrido.
     */
    public double getOptimalThickness() {
        int best = 0;
        for (int i = 1; i < jsc.length; i++) {
            if (jsc[i] > jsc[best]) {
                best = i;
            }
        }
        return thicknesses[best];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ThicknessSweepResult that = (ThicknessSweepResult) o;
        return layerIndex == that.layerIndex && Arrays.equals(thicknesses, that.thicknesses) && Arrays.equals(jsc, that.jsc);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(layerIndex);
        result = 31 * result + Arrays.hashCode(thicknesses);
        result = 31 * result + Arrays.hashCode(jsc);
        return result;
    }
}
