package projectphoton.domain.dto;

import lombok.Builder;
import projectphoton.domain.simulation.GenerationProfile;
import projectphoton.domain.simulation.OpticalSimulationResult;
import projectphoton.domain.stack.LayerStack;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resumen exportable (JSON) de una simulación óptica. Omite el mapa de campo completo.
 *
 * @param layers              Descripción de las capas ("nombre espesor").
 * @param wavelengths         Rejilla espectral [nm].
 * @param reflection          Reflexión total del dispositivo.
 * @param transmission        Transmisión total.
 * @param absorption          Absorción por capa, indexada por "índice:material".
 * @param parasiticAbsorption 1 - R - A(activa), o null sin capa activa.
 * @param generationPositions Posiciones de la capa activa [nm], o null.
 * @param generationRates     G(x) [s⁻¹·cm⁻³], o null.
 * @param jsc                 Jsc [mA/cm²], o null.
 * @param failedWavelengths   Índices de longitudes de onda con interfaz degenerada.
 */
@Builder
public record OpticalResultSummaryDTO(
        List<String> layers,
        double[] wavelengths,
        double[] reflection,
        double[] transmission,
        Map<String, double[]> absorption,
        double[] parasiticAbsorption,
        double[] generationPositions,
        double[] generationRates,
        Double jsc,
        int[] failedWavelengths
) {

    public static OpticalResultSummaryDTO from(OpticalSimulationResult result) {
        LayerStack stack = result.getStack();
        Map<String, double[]> absorption = new LinkedHashMap<>();
        for (int m = 1; m < stack.getLayerCount(); m++) {
            absorption.put(m + ":" + stack.getLayer(m).name(), result.getAbsorption().getLayerSpectrum(m));
        }
        List<String> layers = stack.getLayers().stream()
                .map(layer -> layer.name() + " " + layer.thickness())
                .toList();

        GenerationProfile generation = result.getGeneration().orElse(null);
        return OpticalResultSummaryDTO.builder()
                .layers(layers)
                .wavelengths(result.getWavelengths().toArray())
                .reflection(result.getReflection())
                .transmission(result.getTransmission())
                .absorption(absorption)
                .parasiticAbsorption(result.getParasiticAbsorption().orElse(null))
                .generationPositions(generation == null ? null : generation.clonePositions())
                .generationRates(generation == null ? null : generation.cloneRates())
                .jsc(result.getShortCircuitCurrent().isPresent() ? result.getShortCircuitCurrent().getAsDouble() : null)
                .failedWavelengths(result.getFailedWavelengths())
                .build();
    }
}
