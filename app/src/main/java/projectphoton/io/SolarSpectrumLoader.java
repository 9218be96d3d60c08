package projectphoton.io;

import lombok.extern.slf4j.Slf4j;
import projectphoton.domain.optics.SpectralTable;
import projectphoton.physics.model.TabulatedSolarSpectrumProvider;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Carga un espectro solar (p. ej. AM1.5G) de un CSV de dos columnas: longitud de onda e irradiancia.
 */
@Slf4j
public class SolarSpectrumLoader {

    private final CsvSpectrumReader reader = new CsvSpectrumReader(1);

    public TabulatedSolarSpectrumProvider load(Path file) throws IOException {
        String name = file.getFileName().toString().replaceFirst("\\.csv$", "");
        SpectralTable table = reader.read(name, file);
        log.info("Espectro solar '{}' cargado: {} puntos entre {} y {} nm.",
                name, table.size(), table.getMinWavelength(), table.getMaxWavelength());
        return new TabulatedSolarSpectrumProvider(table);
    }
}
