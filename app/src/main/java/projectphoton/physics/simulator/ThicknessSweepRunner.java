package projectphoton.physics.simulator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import projectphoton.config.SweepConfig;
import projectphoton.domain.exception.InvalidGeometryException;
import projectphoton.domain.simulation.OpticalSimulationResult;
import projectphoton.domain.simulation.ThicknessSweepResult;

/**
 * Barre el espesor de una capa interior y registra Jsc en cada punto.
 * Los índices de refracción y el espectro solar se calculan una sola vez: solo cambia la geometría.
 */
@Slf4j
@RequiredArgsConstructor
public class ThicknessSweepRunner {

    private final TransferMatrixSimulator simulator;

    public ThicknessSweepResult run(OpticalProblem baseProblem, SweepConfig sweep) {
        if (!baseProblem.hasGeneration()) {
            throw new IllegalArgumentException("El barrido de espesor necesita capa activa y espectro solar para calcular Jsc.");
        }
        int layer = sweep.layerIndex();
        if (layer >= baseProblem.stack().getExitLayerIndex()) {
            throw new InvalidGeometryException("La capa " + layer + " no es interior: solo se barren capas 1.."
                    + (baseProblem.stack().getExitLayerIndex() - 1) + ".");
        }

        double[] thicknesses = sweep.thicknesses();
        double[] jsc = new double[thicknesses.length];
        log.info("Barrido de espesor de la capa {} ('{}'): {} puntos entre {} y {} nm.",
                layer, baseProblem.stack().getLayer(layer).name(), thicknesses.length, sweep.start(), sweep.stop());

        for (int i = 0; i < thicknesses.length; i++) {
            OpticalProblem problem = baseProblem.withStack(baseProblem.stack().withLayerThickness(layer, thicknesses[i]));
            OpticalSimulationResult result = simulator.run(problem);
            jsc[i] = result.getShortCircuitCurrent().orElse(Double.NaN);
            log.debug("Espesor {} nm -> Jsc = {} mA/cm²", thicknesses[i], jsc[i]);
        }
        return new ThicknessSweepResult(layer, thicknesses, jsc);
    }
}
