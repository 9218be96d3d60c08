package projectphoton.physics.model;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;
import projectphoton.domain.exception.UnknownMaterialException;
import projectphoton.domain.optics.IRefractiveIndexProvider;
import projectphoton.domain.optics.SpectralTable;
import projectphoton.utils.LinearInterpolator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Proveedor de índices n + ik a partir de tablas por material (columnas n y k).
 * Interpola linealmente entre filas y extrapola fuera del rango tabulado con un aviso.
 */
@Slf4j
public class TabulatedRefractiveIndexProvider implements IRefractiveIndexProvider {

    private static final int N_COLUMN = 0;
    private static final int K_COLUMN = 1;

    private final Map<String, SpectralTable> materials;

    public TabulatedRefractiveIndexProvider(Map<String, SpectralTable> materials) {
        Objects.requireNonNull(materials, "La librería de materiales no puede ser nula.");
        materials.forEach((name, table) -> {
            if (table.columns().length < 2) {
                throw new IllegalArgumentException("La tabla del material '" + name + "' necesita columnas n y k.");
            }
        });
        this.materials = Collections.unmodifiableMap(new LinkedHashMap<>(materials));
    }

    @Override
    public Complex[] lookupIndex(String materialName, double[] wavelengths) {
        SpectralTable table = materials.get(materialName);
        if (table == null) {
            throw new UnknownMaterialException(materialName);
        }
        double[] xs = table.wavelengths();
        int outside = LinearInterpolator.countOutOfRange(xs, wavelengths);
        if (outside > 0) {
            log.warn("Material '{}': {} longitudes de onda fuera del rango tabulado [{}, {}] nm, se extrapola linealmente.",
                    materialName, outside, table.getMinWavelength(), table.getMaxWavelength());
        }

        double[] n = LinearInterpolator.interpolate(xs, table.column(N_COLUMN), wavelengths);
        double[] k = LinearInterpolator.interpolate(xs, table.column(K_COLUMN), wavelengths);
        Complex[] out = new Complex[wavelengths.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = new Complex(n[i], k[i]);
        }
        return out;
    }

    public boolean hasMaterial(String materialName) {
        return materials.containsKey(materialName);
    }

    public Set<String> getMaterialNames() {
        return materials.keySet();
    }
}
