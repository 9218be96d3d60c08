package projectphoton.physics.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectphoton.domain.stack.Layer;
import projectphoton.domain.stack.LayerStack;
import projectphoton.domain.stack.PositionGrid;
import projectphoton.physics.matrix.TransferMatrix;
import projectphoton.physics.solver.StackSolver;
import projectphoton.physics.solver.WavelengthSolution;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Slf4j
class FieldProfileEngineTest {

    private static final Complex AIR = Complex.ONE;

    private static FieldProfile solveSlab(LayerStack stack, Complex[] n, double lambda, double step) {
        WavelengthSolution solution = StackSolver.solve(n, stack.cloneEffectiveThicknesses(), lambda, new CumulativePartialMatrixCalculator());
        return FieldProfileEngine.evaluate(solution, n, stack.cloneEffectiveThicknesses(), PositionGrid.create(stack, step));
    }

    @Test
    @DisplayName("Lámina sin pérdidas: la onda estacionaria tiene periodo λ/(2n)")
    void losslessSlab_standingWavePeriod() {
        // ARRANGE: λ = 600 nm, n = 1.5 -> periodo 200 nm = 200 puntos
        LayerStack stack = LayerStack.of(Layer.of("Air", 0), Layer.of("Slab", 1000), Layer.of("Air", 0));
        Complex[] n = {AIR, new Complex(1.5, 0), AIR};

        // ACT
        double[] intensity = solveSlab(stack, n, 600, 1.0).intensity();

        // ASSERT
        assertEquals(1000, intensity.length);
        for (int i = 0; i + 200 < intensity.length; i++) {
            assertEquals(intensity[i], intensity[i + 200], 1e-9, "Punto " + i);
        }
    }

    @Test
    @DisplayName("Justo tras la interfaz de entrada el campo vale 1 + r (continuidad)")
    void fieldAtEntrance_equalsIncidentPlusReflected() {
        // ARRANGE
        LayerStack stack = LayerStack.of(Layer.of("Air", 0), Layer.of("Film", 100), Layer.of("Air", 0));
        Complex[] n = {AIR, new Complex(1.8, 0.2), AIR};
        double lambda = 500;
        WavelengthSolution solution = StackSolver.solve(n, stack.cloneEffectiveThicknesses(), lambda, new CumulativePartialMatrixCalculator());
        TransferMatrix system = solution.partialMatrices().getSystemMatrix();
        Complex expected = Complex.ONE.add(system.m21().divide(system.m11()));

        // ACT: primer punto en x = 0.005 nm
        FieldProfile field = FieldProfileEngine.evaluate(solution, n, stack.cloneEffectiveThicknesses(), PositionGrid.create(stack, 0.01));

        // ASSERT
        log.info("E(0+) = {} + {}i, esperado {}", field.real()[0], field.imag()[0], expected);
        assertEquals(expected.getReal(), field.real()[0], 1e-3);
        assertEquals(expected.getImaginary(), field.imag()[0], 1e-3);
    }

    @Test
    @DisplayName("En la capa de salida la intensidad es constante e igual a la transmitancia")
    void exitLayer_carriesTransmittedWave() {
        // ARRANGE: la capa de salida declara 50 nm, así que recibe puntos
        LayerStack stack = LayerStack.of(Layer.of("Air", 0), Layer.of("Slab", 100), Layer.of("Air", 50));
        Complex[] n = {AIR, new Complex(2.0, 0), AIR};
        double lambda = 550;
        WavelengthSolution solution = StackSolver.solve(n, stack.cloneEffectiveThicknesses(), lambda, new CumulativePartialMatrixCalculator());
        PositionGrid grid = PositionGrid.create(stack, 1.0);

        // ACT
        double[] intensity = FieldProfileEngine.evaluate(solution, n, stack.cloneEffectiveThicknesses(), grid).intensity();

        // ASSERT
        int[] exitPoints = grid.getIndicesInLayer(2);
        assertEquals(50, exitPoints.length);
        for (int p : exitPoints) {
            assertEquals(solution.transmission(), intensity[p], 1e-10);
        }
    }

    @Test
    @DisplayName("Sin interfaces reales (todo aire) el campo es la onda incidente de módulo 1")
    void uniformMedium_hasUnitIntensity() {
        LayerStack stack = LayerStack.of(Layer.of("Air", 0), Layer.of("Air", 30), Layer.of("Air", 0));
        Complex[] n = {AIR, AIR, AIR};

        double[] intensity = solveSlab(stack, n, 500, 1.0).intensity();

        for (double value : intensity) {
            assertEquals(1.0, value, 1e-12);
        }
    }
}
