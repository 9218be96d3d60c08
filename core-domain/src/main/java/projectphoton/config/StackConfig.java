package projectphoton.config;

import lombok.Builder;
import lombok.With;
import projectphoton.domain.stack.Layer;

import java.util.List;
import java.util.Objects;

/**
 * Objeto de valor inmutable con todos los parámetros de una simulación óptica
 * de un apilamiento de capas finas.
 * <p>
 * Puede construirse con el builder de Lombok o deserializarse desde JSON. Los campos
 * opcionales que llegan nulos se sustituyen por sus valores por defecto.
 *
 * @param layers                 Capas en orden físico, empezando por la cara de incidencia.
 * @param wavelengthStart        Primera longitud de onda [nm].
 * @param wavelengthStop         Última longitud de onda, inclusiva [nm].
 * @param wavelengthStep         Paso de la rejilla espectral [nm].
 * @param positionStep           Paso de la rejilla de posiciones en el dispositivo [nm]. Por defecto 1 nm.
 * @param activeLayer            Índice (base 0) de la capa activa, o null si no se calcula la fotocorriente.
 * @param partialMatrixStrategy  Estrategia de cálculo de las matrices parciales. Por defecto CUMULATIVE.
 * @param energyBalanceTolerance Tolerancia del balance energético. Por defecto 1e-3.
 */
@Builder
@With
public record StackConfig(
        List<Layer> layers,

        // --- Rejilla espectral ---
        double wavelengthStart,
        double wavelengthStop,
        double wavelengthStep,

        // --- Rejilla espacial ---
        Double positionStep,

        // --- Fotocorriente ---
        Integer activeLayer,

        // --- Numérica ---
        PartialMatrixStrategy partialMatrixStrategy,
        Double energyBalanceTolerance
) {
    public static final double DEFAULT_POSITION_STEP = 1.0;
    public static final double DEFAULT_ENERGY_BALANCE_TOLERANCE = 1e-3;

    public StackConfig {
        Objects.requireNonNull(layers, "La lista de capas no puede ser nula.");
        layers = List.copyOf(layers);
        if (positionStep == null) {
            positionStep = DEFAULT_POSITION_STEP;
        }
        if (partialMatrixStrategy == null) {
            partialMatrixStrategy = PartialMatrixStrategy.CUMULATIVE;
        }
        if (energyBalanceTolerance == null) {
            energyBalanceTolerance = DEFAULT_ENERGY_BALANCE_TOLERANCE;
        }
    }

    public boolean hasActiveLayer() {
        return activeLayer != null;
    }

    /**
     * Célula orgánica de referencia (vidrio / ITO / PEDOT:PSS / P3HT:PCBM / Ca / Al)
     * entre 350 y 800 nm, con la mezcla P3HT:PCBM como capa activa.
     */
    public static StackConfig getReferenceDevice() {
        return StackConfig.builder()
                .layers(List.of(
                        Layer.of("SiO2", 0),
                        Layer.of("ITO", 110),
                        Layer.of("PEDOT", 35),
                        Layer.of("P3HTPCBM", 220),
                        Layer.of("Ca", 7),
                        Layer.of("Al", 200)))
                .wavelengthStart(350)
                .wavelengthStop(800)
                .wavelengthStep(1)
                .positionStep(1.0)
                .activeLayer(3)
                .build();
    }

    /**
     * Forma de obtener las matrices parciales S' y S'' de cada capa.
     */
    public enum PartialMatrixStrategy {
        /**
         * Recalcula los productos completos para cada capa: O(capas²).
         */
        LITERAL,
        /**
         * Acumula productos prefijo y sufijo: O(capas).
         */
        CUMULATIVE
    }
}
