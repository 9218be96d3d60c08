package projectphoton;

import lombok.extern.slf4j.Slf4j;
import projectphoton.config.StackConfig;
import projectphoton.domain.dto.OpticalResultSummaryDTO;
import projectphoton.domain.optics.ISolarSpectrumProvider;
import projectphoton.domain.simulation.OpticalSimulationResult;
import projectphoton.io.JsonFileHandler;
import projectphoton.io.MaterialLibraryLoader;
import projectphoton.io.SolarSpectrumLoader;
import projectphoton.physics.model.TabulatedRefractiveIndexProvider;
import projectphoton.physics.simulator.TransferMatrixSimulator;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Punto de entrada por línea de comandos.
 * <pre>
 * OpticalSimulationLauncher &lt;config.json | -&gt; &lt;directorio_materiales&gt; &lt;AM15G.csv | -&gt; &lt;salida.json&gt;
 * </pre>
 * Con {@code -} como configuración se usa el dispositivo de referencia; con {@code -} como
 * espectro solar no se calcula la generación.
 */
@Slf4j
public class OpticalSimulationLauncher {

    public static final String NONE = "-";

    private final JsonFileHandler jsonFileHandler = new JsonFileHandler();
    private final MaterialLibraryLoader materialLoader = new MaterialLibraryLoader();
    private final SolarSpectrumLoader spectrumLoader = new SolarSpectrumLoader();

    public static void main(String[] args) {
        if (args.length != 4) {
            System.err.println("Uso: OpticalSimulationLauncher <config.json|-> <directorio_materiales> <AM15G.csv|-> <salida.json>");
            System.exit(2);
        }
        try {
            OpticalResultSummaryDTO summary = new OpticalSimulationLauncher().run(args[0], args[1], args[2], args[3]);
            if (summary.jsc() != null) {
                System.out.printf("Jsc = %.4f mA/cm²%n", summary.jsc());
            }
        } catch (IOException | RuntimeException e) {
            log.error("La simulación ha fallado: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Carga los datos, simula y escribe el resumen JSON.
     *
     * @return El resumen escrito en {@code outputJson}.
     */
    public OpticalResultSummaryDTO run(String configJson, String materialDir, String solarCsv, String outputJson) throws IOException {
        StackConfig config = NONE.equals(configJson)
                ? StackConfig.getReferenceDevice()
                : jsonFileHandler.readConfig(configJson);

        TabulatedRefractiveIndexProvider indexProvider = materialLoader.load(Paths.get(materialDir));
        ISolarSpectrumProvider spectrumProvider = NONE.equals(solarCsv) ? null : spectrumLoader.load(Path.of(solarCsv));

        OpticalSimulationResult result = new TransferMatrixSimulator(indexProvider, spectrumProvider).run(config);
        OpticalResultSummaryDTO summary = OpticalResultSummaryDTO.from(result);
        jsonFileHandler.writeSummary(summary, outputJson);
        return summary;
    }
}
