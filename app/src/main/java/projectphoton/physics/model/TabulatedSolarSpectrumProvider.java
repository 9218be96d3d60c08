package projectphoton.physics.model;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import projectphoton.domain.optics.ISolarSpectrumProvider;
import projectphoton.domain.optics.SpectralTable;
import projectphoton.utils.LinearInterpolator;

/**
 * Espectro solar tabulado (primera columna: irradiancia), interpolado linealmente.
 */
@Slf4j
@RequiredArgsConstructor
public class TabulatedSolarSpectrumProvider implements ISolarSpectrumProvider {

    private final SpectralTable spectrum;

    @Override
    public double[] lookupIrradiance(double[] wavelengths) {
        double[] xs = spectrum.wavelengths();
        int outside = LinearInterpolator.countOutOfRange(xs, wavelengths);
        if (outside > 0) {
            log.warn("Espectro '{}': {} longitudes de onda fuera del rango tabulado [{}, {}] nm, se extrapola linealmente.",
                    spectrum.name(), outside, spectrum.getMinWavelength(), spectrum.getMaxWavelength());
        }
        return LinearInterpolator.interpolate(xs, spectrum.column(0), wavelengths);
    }
}
