package projectphoton.physics.simulator;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import projectphoton.config.StackConfig;
import projectphoton.config.StackConfig.PartialMatrixStrategy;
import projectphoton.domain.exception.DegenerateInterfaceException;
import projectphoton.domain.exception.InvalidGeometryException;
import projectphoton.domain.optics.IRefractiveIndexProvider;
import projectphoton.domain.optics.ISolarSpectrumProvider;
import projectphoton.domain.simulation.AbsorptionSpectrum;
import projectphoton.domain.simulation.FieldMap;
import projectphoton.domain.simulation.GenerationProfile;
import projectphoton.domain.simulation.OpticalSimulationResult;
import projectphoton.domain.stack.LayerStack;
import projectphoton.domain.stack.PositionGrid;
import projectphoton.domain.stack.WavelengthGrid;
import projectphoton.factory.OpticalStackFactory;
import projectphoton.physics.i.IPartialMatrixCalculator;
import projectphoton.physics.impl.AbsorptionEngine;
import projectphoton.physics.impl.CumulativePartialMatrixCalculator;
import projectphoton.physics.impl.EnergyBalanceValidator;
import projectphoton.physics.impl.FieldProfile;
import projectphoton.physics.impl.FieldProfileEngine;
import projectphoton.physics.impl.GenerationEngine;
import projectphoton.physics.impl.LiteralPartialMatrixCalculator;
import projectphoton.physics.solver.StackSolver;
import projectphoton.physics.solver.WavelengthSolution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Orquesta la simulación óptica del apilamiento.
 * Facade de alto nivel sobre {@link StackSolver}, {@link FieldProfileEngine},
 * {@link AbsorptionEngine} y {@link GenerationEngine}.
 * <p>
 * Las longitudes de onda se procesan de una en una y su campo se vuelca directamente
 * en el mapa plano del resultado. Una longitud de onda con interfaz degenerada queda
 * marcada con NaN y fuera de la integración espectral; el resto se calcula igual.
 */
@Slf4j
public class TransferMatrixSimulator {

    private final OpticalStackFactory factory;

    public TransferMatrixSimulator(IRefractiveIndexProvider indexProvider, ISolarSpectrumProvider spectrumProvider) {
        this(new OpticalStackFactory(indexProvider, spectrumProvider));
    }

    public TransferMatrixSimulator(OpticalStackFactory factory) {
        this.factory = factory;
    }

    public OpticalSimulationResult run(StackConfig config) {
        return run(factory.createProblem(config));
    }

    public OpticalSimulationResult run(OpticalProblem problem) {
        final long startTime = System.currentTimeMillis();

        final LayerStack stack = problem.stack();
        final WavelengthGrid wavelengths = problem.wavelengths();
        final PositionGrid grid = PositionGrid.create(stack, problem.positionStep());
        final IPartialMatrixCalculator calculator = selectCalculator(problem.strategy());

        final int layerCount = stack.getLayerCount();
        final int wavelengthCount = wavelengths.size();
        final int positionCount = grid.size();
        final double[] thicknesses = stack.cloneEffectiveThicknesses();

        log.info("Simulación TMM: {} capas, {} longitudes de onda, {} posiciones, estrategia {}.",
                layerCount, wavelengthCount, positionCount, calculator.getName());

        double[] reflection = new double[wavelengthCount];
        double[] coherentReflection = new double[wavelengthCount];
        double[] transmission = new double[wavelengthCount];
        double[][] absorption = new double[layerCount][wavelengthCount];
        final int fieldSize = fieldMapSize(positionCount, wavelengthCount);
        double[] fieldReal = new double[fieldSize];
        double[] fieldImag = new double[fieldSize];

        // Generación: solo si hay capa activa y espectro solar
        final Integer activeLayer = problem.activeLayer();
        final boolean computeGeneration = problem.hasGeneration();
        final int[] activePoints = activeLayer != null ? grid.getIndicesInLayer(activeLayer) : new int[0];
        final double[] rates = computeGeneration ? new double[activePoints.length] : null;
        final double[] irradiance = computeGeneration ? problem.irradiance() : null;
        final double[] weights = wavelengths.integrationWeights();

        List<Integer> failed = new ArrayList<>();

        for (int l = 0; l < wavelengthCount; l++) {
            final double lambda = wavelengths.get(l);
            final Complex[] n = problem.indices().getColumn(l);

            WavelengthSolution solution;
            try {
                solution = StackSolver.solve(n, thicknesses, lambda, calculator);
            } catch (DegenerateInterfaceException e) {
                log.warn("Longitud de onda {} nm omitida: {}", lambda, e.getMessage());
                failed.add(l);
                markFailed(l, positionCount, reflection, coherentReflection, transmission, absorption, fieldReal, fieldImag);
                continue;
            }

            reflection[l] = solution.reflection();
            coherentReflection[l] = solution.coherentReflectance();
            transmission[l] = solution.transmission();

            FieldProfile field = FieldProfileEngine.evaluate(solution, n, thicknesses, grid);
            System.arraycopy(field.real(), 0, fieldReal, l * positionCount, positionCount);
            System.arraycopy(field.imag(), 0, fieldImag, l * positionCount, positionCount);

            double[] intensity = field.intensity();
            for (int m = 1; m < layerCount; m++) {
                absorption[m][l] = AbsorptionEngine.layerAbsorption(m, n[m], lambda, intensity, grid);
            }

            if (computeGeneration) {
                GenerationEngine.accumulate(rates, activePoints, intensity, n[activeLayer], lambda, irradiance[l], weights[l]);
            }
        }

        if (failed.size() == wavelengthCount) {
            throw new InvalidGeometryException("Ninguna longitud de onda pudo resolverse: todas presentan una interfaz degenerada.");
        }

        double[] parasitic = activeLayer != null
                ? AbsorptionEngine.parasiticAbsorption(reflection, absorption[activeLayer])
                : null;
        AbsorptionSpectrum absorptionSpectrum = new AbsorptionSpectrum(absorption);
        int[] imbalance = new EnergyBalanceValidator(problem.energyBalanceTolerance())
                .validate(wavelengths, reflection, absorptionSpectrum, parasitic);

        GenerationProfile generation = null;
        Double jsc = null;
        if (computeGeneration) {
            double[] activePositions = new double[activePoints.length];
            for (int i = 0; i < activePoints.length; i++) {
                activePositions[i] = grid.getPosition(activePoints[i]);
            }
            generation = new GenerationProfile(activeLayer, activePositions, rates);
            jsc = GenerationEngine.shortCircuitCurrent(rates, grid.getStep());
        }

        long elapsed = System.currentTimeMillis() - startTime;
        if (jsc != null) {
            log.info("Simulación completada en {} ms. Jsc = {} mA/cm²", elapsed, String.format("%.4f", jsc));
        } else {
            log.info("Simulación completada en {} ms.", elapsed);
        }
        if (!failed.isEmpty()) {
            log.warn("{} de {} longitudes de onda fallaron por interfaz degenerada.", failed.size(), wavelengthCount);
        }

        return OpticalSimulationResult.builder()
                .stack(stack)
                .wavelengths(wavelengths)
                .positions(grid)
                .reflection(reflection)
                .coherentReflection(coherentReflection)
                .transmission(transmission)
                .parasiticAbsorption(parasitic)
                .absorption(absorptionSpectrum)
                .field(new FieldMap(positionCount, wavelengthCount, fieldReal, fieldImag))
                .generation(generation)
                .shortCircuitCurrent(jsc)
                .failedWavelengths(failed.stream().mapToInt(Integer::intValue).toArray())
                .energyImbalanceWavelengths(imbalance)
                .simulationTime(elapsed)
                .build();
    }

    /**
     * Mapea el Enum de configuración a la implementación del cálculo de matrices parciales.
     */
    static IPartialMatrixCalculator selectCalculator(PartialMatrixStrategy strategy) {
        if (strategy == null) {
            return new CumulativePartialMatrixCalculator();
        }
        switch (strategy) {
            case LITERAL:
                return new LiteralPartialMatrixCalculator();
            case CUMULATIVE:
            default:
                return new CumulativePartialMatrixCalculator();
        }
    }

    /**
     * Tamaño de los arrays planos del mapa de campo.
     *
     * @throws InvalidGeometryException si posiciones x longitudes de onda no cabe en un array.
     */
    static int fieldMapSize(int positionCount, int wavelengthCount) {
        try {
            return Math.multiplyExact(positionCount, wavelengthCount);
        } catch (ArithmeticException e) {
            throw new InvalidGeometryException(String.format(
                    "El mapa de campo (%d posiciones x %d longitudes de onda) supera el tamaño máximo de un array. "
                            + "Aumente el paso de posiciones o de longitudes de onda.", positionCount, wavelengthCount), e);
        }
    }

    private static void markFailed(int l, int positionCount, double[] reflection, double[] coherentReflection,
                                   double[] transmission, double[][] absorption, double[] fieldReal, double[] fieldImag) {
        reflection[l] = Double.NaN;
        coherentReflection[l] = Double.NaN;
        transmission[l] = Double.NaN;
        for (double[] layer : absorption) {
            layer[l] = Double.NaN;
        }
        Arrays.fill(fieldReal, l * positionCount, (l + 1) * positionCount, Double.NaN);
        Arrays.fill(fieldImag, l * positionCount, (l + 1) * positionCount, Double.NaN);
    }
}
