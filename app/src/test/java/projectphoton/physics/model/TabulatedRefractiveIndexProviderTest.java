package projectphoton.physics.model;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectphoton.domain.exception.UnknownMaterialException;
import projectphoton.domain.optics.SpectralTable;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TabulatedRefractiveIndexProviderTest {

    private TabulatedRefractiveIndexProvider provider;

    @BeforeEach
    void setUp() {
        SpectralTable ito = new SpectralTable("ITO",
                new double[]{400, 600},
                new double[][]{{2.0, 1.8}, {0.02, 0.0}});
        provider = new TabulatedRefractiveIndexProvider(Map.of("ITO", ito));
    }

    @Test
    @DisplayName("Interpola n y k por separado")
    void lookupIndex_interpolatesBothColumns() {
        Complex[] values = provider.lookupIndex("ITO", new double[]{400, 500});

        assertEquals(new Complex(2.0, 0.02), values[0]);
        assertEquals(1.9, values[1].getReal(), 1e-12);
        assertEquals(0.01, values[1].getImaginary(), 1e-12);
    }

    @Test
    @DisplayName("Fuera del rango extrapola en lugar de fallar")
    void lookupIndex_extrapolates() {
        Complex[] values = provider.lookupIndex("ITO", new double[]{700});

        assertEquals(1.7, values[0].getReal(), 1e-12);
        assertEquals(-0.01, values[0].getImaginary(), 1e-12);
    }

    @Test
    @DisplayName("Un material que no está en la librería lanza UnknownMaterialException con su nombre")
    void lookupIndex_unknownMaterial() {
        assertThatThrownBy(() -> provider.lookupIndex("Unobtainium", new double[]{500}))
                .isInstanceOf(UnknownMaterialException.class)
                .hasMessageContaining("Unobtainium")
                .extracting("materialName").isEqualTo("Unobtainium");
        assertThat(provider.hasMaterial("ITO")).isTrue();
    }

    @Test
    @DisplayName("El espectro solar se interpola sobre la primera columna")
    void solarSpectrum_interpolates() {
        TabulatedSolarSpectrumProvider spectrum = new TabulatedSolarSpectrumProvider(
                new SpectralTable("AM15G", new double[]{300, 500}, new double[][]{{0.1, 0.2}}));

        assertThat(spectrum.lookupIrradiance(new double[]{400})[0]).isCloseTo(0.15, within(1e-12));
    }
}
