package projectphoton.physics.impl;

import lombok.extern.slf4j.Slf4j;
import projectphoton.domain.simulation.AbsorptionSpectrum;
import projectphoton.domain.stack.WavelengthGrid;

import java.util.ArrayList;
import java.util.List;

/**
 * Comprueba el balance energético por longitud de onda: la absorción parásita no puede ser
 * negativa ni R + ΣA superar la unidad más allá de la tolerancia. Las violaciones se registran
 * como aviso y no interrumpen la simulación.
 */
@Slf4j
public class EnergyBalanceValidator {

    private final double tolerance;

    public EnergyBalanceValidator(double tolerance) {
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("La tolerancia del balance energético debe ser >= 0: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    /**
     * @param wavelengths Rejilla espectral.
     * @param reflection  Reflexión total por longitud de onda.
     * @param absorption  Absorción por capa.
     * @param parasitic   Absorción parásita, o null si no hay capa activa.
     * @return Índices de las longitudes de onda que violan el balance. Las que valen NaN se ignoran.
     */
    public int[] validate(WavelengthGrid wavelengths, double[] reflection, AbsorptionSpectrum absorption, double[] parasitic) {
        List<Integer> violations = new ArrayList<>();
        for (int l = 0; l < wavelengths.size(); l++) {
            if (Double.isNaN(reflection[l])) {
                continue;
            }
            double total = reflection[l] + absorption.getTotalAt(l);
            boolean overUnity = total > 1.0 + tolerance;
            boolean negativeParasitic = parasitic != null && parasitic[l] < -tolerance;
            if (overUnity || negativeParasitic) {
                log.warn("Balance energético violado en λ = {} nm: R + ΣA = {}, parásita = {}",
                        wavelengths.get(l), total, parasitic == null ? "n/a" : parasitic[l]);
                violations.add(l);
            }
        }
        return violations.stream().mapToInt(Integer::intValue).toArray();
    }
}
