package projectphoton;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectphoton.domain.dto.OpticalResultSummaryDTO;
import projectphoton.domain.exception.UnknownMaterialException;
import projectphoton.io.JsonFileHandler;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpticalSimulationLauncherTest {

    private static String resource(String name) throws Exception {
        return Paths.get(OpticalSimulationLauncherTest.class.getResource(name).toURI()).toString();
    }

    @Test
    @DisplayName("Ejecuta la simulación completa desde archivos y escribe el resumen")
    void run_fromFiles(@TempDir Path tempDir) throws Exception {
        // ARRANGE
        Path config = tempDir.resolve("device.json");
        new JsonFileHandler().writeConfig(OpticalTestFixtures.getTestingDevice(), config.toString());
        Path output = tempDir.resolve("out/summary.json");

        // ACT
        OpticalResultSummaryDTO summary = new OpticalSimulationLauncher()
                .run(config.toString(), resource("/matdata"), resource("/matdata/AM15G.csv"), output.toString());

        // ASSERT
        assertThat(output).exists();
        assertThat(summary.jsc()).isNotNull().isPositive();
        assertThat(summary.wavelengths()).hasSize(31);
        assertThat(summary.absorption()).containsKeys("1:Spacer", "2:Absorber", "3:Metal", "4:Air");
        assertThat(summary.failedWavelengths()).isEmpty();
    }

    @Test
    @DisplayName("Sin espectro solar no se calcula Jsc")
    void run_withoutSpectrum(@TempDir Path tempDir) throws Exception {
        Path config = tempDir.resolve("device.json");
        new JsonFileHandler().writeConfig(OpticalTestFixtures.getTestingDevice(), config.toString());

        OpticalResultSummaryDTO summary = new OpticalSimulationLauncher()
                .run(config.toString(), resource("/matdata"), OpticalSimulationLauncher.NONE, tempDir.resolve("s.json").toString());

        assertThat(summary.jsc()).isNull();
        assertThat(summary.parasiticAbsorption()).isNotNull();
    }

    @Test
    @DisplayName("El dispositivo de referencia necesita materiales que la librería de prueba no tiene")
    void referenceDevice_withTestLibrary_failsOnUnknownMaterial(@TempDir Path tempDir) {
        assertThatThrownBy(() -> new OpticalSimulationLauncher()
                .run(OpticalSimulationLauncher.NONE, resource("/matdata"), OpticalSimulationLauncher.NONE, tempDir.resolve("s.json").toString()))
                .isInstanceOf(UnknownMaterialException.class)
                .hasMessageContaining("SiO2");
    }
}
