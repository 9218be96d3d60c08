package projectphoton.benchmark;

import org.apache.commons.math3.complex.Complex;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import projectphoton.physics.i.IPartialMatrixCalculator;
import projectphoton.physics.impl.CumulativePartialMatrixCalculator;
import projectphoton.physics.impl.LiteralPartialMatrixCalculator;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Microbenchmark JMH que compara el cálculo literal de las matrices parciales
 * (productos completos por capa) con el acumulado (prefijos y sufijos).
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
public class PartialMatrixBenchmark {

    // Número de capas del apilamiento, incluidos superestrato y medio final.
    @Param({"6", "20", "60", "200"})
    private int layers;

    private final double wavelength = 550.0;

    private Complex[] indices;
    private double[] thicknesses;

    private IPartialMatrixCalculator literal;
    private IPartialMatrixCalculator cumulative;

    @Setup(Level.Trial)
    public void setup() {
        indices = new Complex[layers];
        thicknesses = new double[layers];
        Random rand = new Random(42); // Semilla fija para reproducibilidad

        for (int i = 0; i < layers; i++) {
            // n entre 1.3 y 2.5, k entre 0 y 0.3
            indices[i] = new Complex(1.3 + rand.nextDouble() * 1.2, rand.nextDouble() * 0.3);
            thicknesses[i] = 5.0 + rand.nextDouble() * 150.0;
        }
        thicknesses[0] = 0.0;

        literal = new LiteralPartialMatrixCalculator();
        cumulative = new CumulativePartialMatrixCalculator();
    }

    /**
     * Recalcula S' y S'' desde cero para cada capa.
     */
    @Benchmark
    public void testLiteral(Blackhole bh) {
        bh.consume(literal.calculate(indices, thicknesses, wavelength));
    }

    /**
     * Reutiliza los productos de la capa anterior.
     */
    @Benchmark
    public void testCumulative(Blackhole bh) {
        bh.consume(cumulative.calculate(indices, thicknesses, wavelength));
    }
}
