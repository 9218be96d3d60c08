package projectphoton.domain.simulation;

import lombok.Builder;
import lombok.Getter;
import projectphoton.domain.stack.LayerStack;
import projectphoton.domain.stack.PositionGrid;
import projectphoton.domain.stack.WavelengthGrid;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Resultado completo de una simulación óptica de matrices de transferencia.
 * <p>
 * Contiene los espectros de reflexión y transmisión del dispositivo, la absorción por
 * capa, el mapa de campo y, si había capa activa y espectro solar, el perfil de
 * generación y la densidad de corriente de cortocircuito. Las longitudes de onda que
 * fallaron (interfaz degenerada) aparecen con NaN y se listan en {@link #getFailedWavelengths()}.
 */
public class OpticalSimulationResult {

    @Getter
    private final LayerStack stack;
    @Getter
    private final WavelengthGrid wavelengths;
    @Getter
    private final PositionGrid positions;

    private final double[] reflection;
    private final double[] coherentReflection;
    private final double[] transmission;
    private final double[] parasiticAbsorption;

    @Getter
    private final AbsorptionSpectrum absorption;
    @Getter
    private final FieldMap field;

    private final GenerationProfile generation;
    private final Double shortCircuitCurrent;

    private final int[] failedWavelengths;
    private final int[] energyImbalanceWavelengths;

    /**
     * Tiempo de cálculo en milisegundos.
     */
    @Getter
    private final long simulationTime;

    @Builder
    public OpticalSimulationResult(LayerStack stack,
                                   WavelengthGrid wavelengths,
                                   PositionGrid positions,
                                   double[] reflection,
                                   double[] coherentReflection,
                                   double[] transmission,
                                   double[] parasiticAbsorption,
                                   AbsorptionSpectrum absorption,
                                   FieldMap field,
                                   GenerationProfile generation,
                                   Double shortCircuitCurrent,
                                   int[] failedWavelengths,
                                   int[] energyImbalanceWavelengths,
                                   long simulationTime) {
        this.stack = Objects.requireNonNull(stack, "El apilamiento no puede ser nulo.");
        this.wavelengths = Objects.requireNonNull(wavelengths, "La rejilla espectral no puede ser nula.");
        this.positions = Objects.requireNonNull(positions, "La rejilla de posiciones no puede ser nula.");
        this.absorption = Objects.requireNonNull(absorption, "El espectro de absorción no puede ser nulo.");
        this.field = Objects.requireNonNull(field, "El mapa de campo no puede ser nulo.");

        int count = wavelengths.size();
        this.reflection = checkedCopy(reflection, count, "reflection");
        this.coherentReflection = checkedCopy(coherentReflection, count, "coherentReflection");
        this.transmission = checkedCopy(transmission, count, "transmission");
        this.parasiticAbsorption = parasiticAbsorption == null ? null : checkedCopy(parasiticAbsorption, count, "parasiticAbsorption");

        this.generation = generation;
        this.shortCircuitCurrent = shortCircuitCurrent;
        this.failedWavelengths = failedWavelengths == null ? new int[0] : failedWavelengths.clone();
        this.energyImbalanceWavelengths = energyImbalanceWavelengths == null ? new int[0] : energyImbalanceWavelengths.clone();
        this.simulationTime = simulationTime;
    }

    private static double[] checkedCopy(double[] values, int expected, String name) {
        Objects.requireNonNull(values, "El array '" + name + "' no puede ser nulo.");
        if (values.length != expected) {
            throw new IllegalArgumentException("El array '" + name + "' debe tener " + expected + " elementos, tiene " + values.length);
        }
        return values.clone();
    }

    /**
     * Reflexión total del dispositivo, incluyendo la reflexión incoherente de la primera superficie.
     */
    public double[] getReflection() {
        return reflection.clone();
    }

    /**
     * Reflectancia coherente del sistema multicapa visto desde el superestrato.
     */
    public double[] getCoherentReflection() {
        return coherentReflection.clone();
    }

    /**
     * Transmisión total hacia el medio de salida.
     */
    public double[] getTransmission() {
        return transmission.clone();
    }

    /**
     * 1 - Reflexión - Absorción(capa activa). Vacío si no hay capa activa.
     */
    public Optional<double[]> getParasiticAbsorption() {
        return parasiticAbsorption == null ? Optional.empty() : Optional.of(parasiticAbsorption.clone());
    }

    public Optional<GenerationProfile> getGeneration() {
        return Optional.ofNullable(generation);
    }

    /**
     * Densidad de corriente de cortocircuito [mA/cm²] suponiendo IQE del 100%.
     */
    public OptionalDouble getShortCircuitCurrent() {
        return shortCircuitCurrent == null ? OptionalDouble.empty() : OptionalDouble.of(shortCircuitCurrent);
    }

    public int[] getFailedWavelengths() {
        return failedWavelengths.clone();
    }

    public int[] getEnergyImbalanceWavelengths() {
        return energyImbalanceWavelengths.clone();
    }

    public boolean hasFailures() {
        return failedWavelengths.length > 0;
    }
}
