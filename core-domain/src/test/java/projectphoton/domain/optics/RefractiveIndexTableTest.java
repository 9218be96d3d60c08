package projectphoton.domain.optics;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectphoton.domain.exception.InvalidGeometryException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RefractiveIndexTableTest {

    @Test
    @DisplayName("getColumn devuelve los índices de todas las capas en una longitud de onda")
    void getColumn_returnsStackOrder() {
        // ARRANGE
        Complex[][] data = {
                {new Complex(1.5, 0), new Complex(1.5, 0)},
                {new Complex(2.0, 0.1), new Complex(2.1, 0.2)},
                {new Complex(1.0, 0), new Complex(1.0, 0)}
        };

        // ACT
        RefractiveIndexTable table = new RefractiveIndexTable(data);
        data[1][1] = Complex.NaN;

        // ASSERT
        assertEquals(3, table.getLayerCount());
        assertEquals(2, table.getWavelengthCount());
        assertThat(table.getColumn(1)).containsExactly(new Complex(1.5, 0), new Complex(2.1, 0.2), new Complex(1.0, 0));
    }

    @Test
    @DisplayName("Filas de distinta longitud son una geometría inválida")
    void raggedRows_shouldThrow() {
        Complex[][] data = {
                {Complex.ONE, Complex.ONE},
                {Complex.ONE}
        };
        assertThatThrownBy(() -> new RefractiveIndexTable(data)).isInstanceOf(InvalidGeometryException.class);
    }

    @Test
    @DisplayName("withLayerSpectrum no modifica la tabla original")
    void withLayerSpectrum_returnsCopy() {
        RefractiveIndexTable table = new RefractiveIndexTable(new Complex[][]{{Complex.ONE}, {Complex.ONE}});

        RefractiveIndexTable modified = table.withLayerSpectrum(1, new Complex[]{new Complex(3, 1)});

        assertEquals(Complex.ONE, table.get(1, 0));
        assertEquals(new Complex(3, 1), modified.get(1, 0));
    }

    @Test
    @DisplayName("La tabla espectral exige longitudes de onda estrictamente crecientes y columnas alineadas")
    void spectralTable_validatesShape() {
        assertThatThrownBy(() -> new SpectralTable("X", new double[]{400, 400}, new double[][]{{1, 1}}))
                .isInstanceOf(InvalidGeometryException.class);
        assertThatThrownBy(() -> new SpectralTable("X", new double[]{400, 500}, new double[][]{{1}}))
                .isInstanceOf(InvalidGeometryException.class);

        SpectralTable table = new SpectralTable("X", new double[]{400, 500}, new double[][]{{1.5, 1.6}, {0, 0.1}});
        table.columns()[0][0] = 99;
        assertEquals(1.5, table.column(0)[0]);
        assertEquals(500.0, table.getMaxWavelength());
    }
}
