package projectphoton.physics.simulator;

import lombok.Builder;
import projectphoton.config.StackConfig.PartialMatrixStrategy;
import projectphoton.domain.exception.InvalidGeometryException;
import projectphoton.domain.optics.RefractiveIndexTable;
import projectphoton.domain.stack.LayerStack;
import projectphoton.domain.stack.WavelengthGrid;

import java.util.Objects;

/**
 * Problema óptico ya resuelto en datos: geometría, rejillas e índices tabulados.
 * Lo construye {@link projectphoton.factory.OpticalStackFactory}; el simulador no vuelve
 * a consultar a los proveedores.
 *
 * @param stack                  Apilamiento de capas.
 * @param wavelengths            Rejilla espectral.
 * @param indices                Índices [capa][longitud de onda].
 * @param positionStep           Paso de la rejilla de posiciones [nm].
 * @param activeLayer            Capa activa, o null.
 * @param irradiance             Irradiancia solar por longitud de onda, o null si no se calcula la generación.
 * @param strategy               Estrategia de matrices parciales.
 * @param energyBalanceTolerance Tolerancia del balance energético.
 */
@Builder
public record OpticalProblem(
        LayerStack stack,
        WavelengthGrid wavelengths,
        RefractiveIndexTable indices,
        double positionStep,
        Integer activeLayer,
        double[] irradiance,
        PartialMatrixStrategy strategy,
        double energyBalanceTolerance
) {

    public OpticalProblem {
        Objects.requireNonNull(stack, "El apilamiento no puede ser nulo.");
        Objects.requireNonNull(wavelengths, "La rejilla espectral no puede ser nula.");
        Objects.requireNonNull(indices, "La tabla de índices no puede ser nula.");
        Objects.requireNonNull(strategy, "La estrategia de matrices parciales no puede ser nula.");
        if (indices.getLayerCount() != stack.getLayerCount() || indices.getWavelengthCount() != wavelengths.size()) {
            throw new InvalidGeometryException(String.format(
                    "La tabla de índices (%d capas x %d λ) no encaja con el problema (%d capas x %d λ).",
                    indices.getLayerCount(), indices.getWavelengthCount(), stack.getLayerCount(), wavelengths.size()));
        }
        if (activeLayer != null) {
            validateActiveLayer(stack, activeLayer);
        }
        if (irradiance != null) {
            if (irradiance.length != wavelengths.size()) {
                throw new InvalidGeometryException("El espectro solar tiene " + irradiance.length + " valores, se esperaban " + wavelengths.size());
            }
            irradiance = irradiance.clone();
        }
    }

    static void validateActiveLayer(LayerStack stack, int activeLayer) {
        if (activeLayer < 1 || activeLayer >= stack.getLayerCount()) {
            throw new InvalidGeometryException("La capa activa " + activeLayer + " debe estar entre 1 y " + (stack.getLayerCount() - 1) + ".");
        }
        if (!(stack.getEffectiveThickness(activeLayer) > 0)) {
            throw new InvalidGeometryException("La capa activa " + activeLayer + " no tiene espesor.");
        }
    }

    public boolean hasGeneration() {
        return activeLayer != null && irradiance != null;
    }

    @Override
    public double[] irradiance() {
        return irradiance == null ? null : irradiance.clone();
    }

    /**
     * Mismo problema con otra geometría (mismos materiales en el mismo orden).
     */
    public OpticalProblem withStack(LayerStack newStack) {
        return new OpticalProblem(newStack, wavelengths, indices, positionStep, activeLayer, irradiance,
                strategy, energyBalanceTolerance);
    }
}
