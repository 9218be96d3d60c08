package projectphoton.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import projectphoton.domain.optics.SpectralTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lee tablas espectrales en CSV: una línea de cabecera y después filas numéricas
 * {@code longitud_de_onda, valor1, valor2, ...}. Las filas se ordenan por longitud de onda.
 */
@Slf4j
public class CsvSpectrumReader {

    private static final CsvMapper csvMapper = createConfiguredCsvMapper();

    private static CsvMapper createConfiguredCsvMapper() {
        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        return mapper;
    }

    private final int valueColumns;

    /**
     * @param valueColumns Número de columnas de datos tras la longitud de onda (2 para n,k; 1 para irradiancia).
     */
    public CsvSpectrumReader(int valueColumns) {
        if (valueColumns < 1) {
            throw new IllegalArgumentException("Se necesita al menos una columna de datos.");
        }
        this.valueColumns = valueColumns;
    }

    /**
     * @param name Nombre que recibirá la tabla.
     * @param file Archivo CSV.
     * @throws IOException si no se puede leer, está vacío o contiene celdas no numéricas.
     */
    public SpectralTable read(String name, Path file) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withSkipFirstDataRow(true);
        List<double[]> rows = new ArrayList<>();

        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class).with(schema).readValues(file.toFile())) {
            // La cabecera es la línea 1
            int line = 1;
            while (it.hasNextValue()) {
                String[] record = it.nextValue();
                line++;
                rows.add(parseRow(record, file, line));
            }
        } catch (IOException e) {
            log.error("Error al leer la tabla espectral {}", file, e);
            throw e;
        }

        if (rows.isEmpty()) {
            throw new IOException("La tabla " + file + " no contiene filas de datos.");
        }
        rows.sort(Comparator.comparingDouble(r -> r[0]));

        double[] wavelengths = new double[rows.size()];
        double[][] columns = new double[valueColumns][rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            double[] row = rows.get(i);
            if (i > 0 && row[0] == wavelengths[i - 1]) {
                throw new IOException("Longitud de onda repetida (" + row[0] + " nm) en " + file);
            }
            wavelengths[i] = row[0];
            for (int c = 0; c < valueColumns; c++) {
                columns[c][i] = row[c + 1];
            }
        }
        log.debug("Tabla '{}' leída de {}: {} filas.", name, file, wavelengths.length);
        return new SpectralTable(name, wavelengths, columns);
    }

    private double[] parseRow(String[] record, Path file, int line) throws IOException {
        if (record.length < valueColumns + 1) {
            throw new IOException(String.format("%s, línea %d: se esperaban %d columnas y hay %d.",
                    file, line, valueColumns + 1, record.length));
        }
        double[] row = new double[valueColumns + 1];
        for (int c = 0; c <= valueColumns; c++) {
            try {
                row[c] = Double.parseDouble(record[c].trim());
            } catch (NumberFormatException e) {
                throw new IOException(String.format("%s, línea %d: valor no numérico '%s' en la columna %d.",
                        file, line, record[c], c + 1), e);
            }
            if (!Double.isFinite(row[c])) {
                throw new IOException(String.format("%s, línea %d: valor no finito en la columna %d.", file, line, c + 1));
            }
        }
        return row;
    }
}
