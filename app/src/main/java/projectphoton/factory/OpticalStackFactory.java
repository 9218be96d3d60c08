package projectphoton.factory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import projectphoton.config.StackConfig;
import projectphoton.domain.exception.InvalidGeometryException;
import projectphoton.domain.optics.IRefractiveIndexProvider;
import projectphoton.domain.optics.ISolarSpectrumProvider;
import projectphoton.domain.optics.RefractiveIndexTable;
import projectphoton.domain.stack.LayerStack;
import projectphoton.domain.stack.WavelengthGrid;
import projectphoton.physics.simulator.OpticalProblem;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Construye el {@link OpticalProblem} a partir de la configuración: valida la geometría,
 * genera la rejilla espectral y consulta a los proveedores una sola vez por material.
 */
@Slf4j
@RequiredArgsConstructor
public class OpticalStackFactory {

    private final IRefractiveIndexProvider indexProvider;
    /**
     * Puede ser null: entonces no se calcula la generación ni Jsc.
     */
    private final ISolarSpectrumProvider spectrumProvider;

    public LayerStack createStack(StackConfig config) {
        return new LayerStack(config.layers());
    }

    public WavelengthGrid createWavelengthGrid(StackConfig config) {
        return WavelengthGrid.uniform(config.wavelengthStart(), config.wavelengthStop(), config.wavelengthStep());
    }

    /**
     * Índices de cada capa en cada longitud de onda. Un material repetido se consulta una vez.
     *
     * @throws projectphoton.domain.exception.UnknownMaterialException si el proveedor no conoce un material.
     * @throws InvalidGeometryException si el proveedor devuelve un número de valores incorrecto.
     */
    public RefractiveIndexTable createIndexTable(LayerStack stack, WavelengthGrid grid) {
        double[] wavelengths = grid.toArray();
        List<String> materials = stack.getMaterialNames();
        Map<String, Complex[]> cache = new HashMap<>();
        Complex[][] indices = new Complex[materials.size()][];

        for (int layer = 0; layer < materials.size(); layer++) {
            String material = materials.get(layer);
            Complex[] spectrum = cache.get(material);
            if (spectrum == null) {
                spectrum = indexProvider.lookupIndex(material, wavelengths);
                if (spectrum == null || spectrum.length != wavelengths.length) {
                    throw new InvalidGeometryException(String.format(
                            "El proveedor devolvió %s índices para '%s', se esperaban %d.",
                            spectrum == null ? "null" : spectrum.length, material, wavelengths.length));
                }
                cache.put(material, spectrum);
            }
            indices[layer] = spectrum;
        }
        log.debug("Tabla de índices construida: {} capas, {} materiales distintos, {} longitudes de onda.",
                materials.size(), cache.size(), wavelengths.length);
        return new RefractiveIndexTable(indices);
    }

    public OpticalProblem createProblem(StackConfig config) {
        LayerStack stack = createStack(config);
        WavelengthGrid grid = createWavelengthGrid(config);
        RefractiveIndexTable indices = createIndexTable(stack, grid);

        double[] irradiance = null;
        if (config.hasActiveLayer()) {
            if (spectrumProvider != null) {
                irradiance = spectrumProvider.lookupIrradiance(grid.toArray());
            } else {
                log.info("Capa activa {} sin espectro solar: se omite la generación y Jsc.", config.activeLayer());
            }
        }

        return OpticalProblem.builder()
                .stack(stack)
                .wavelengths(grid)
                .indices(indices)
                .positionStep(config.positionStep())
                .activeLayer(config.activeLayer())
                .irradiance(irradiance)
                .strategy(config.partialMatrixStrategy())
                .energyBalanceTolerance(config.energyBalanceTolerance())
                .build();
    }
}
