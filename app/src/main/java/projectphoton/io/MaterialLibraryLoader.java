package projectphoton.io;

import lombok.extern.slf4j.Slf4j;
import projectphoton.domain.optics.SpectralTable;
import projectphoton.physics.model.TabulatedRefractiveIndexProvider;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Carga una librería de materiales desde un directorio con archivos {@code nk_<Material>.csv}
 * (cabecera y columnas longitud de onda, n, k). El nombre del material es el del archivo sin
 * prefijo ni extensión.
 */
@Slf4j
public class MaterialLibraryLoader {

    public static final String MATERIAL_PREFIX = "nk_";
    public static final String EXTENSION = ".csv";

    private final CsvSpectrumReader reader = new CsvSpectrumReader(2);

    public Map<String, SpectralTable> loadTables(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("El directorio de materiales no existe: " + directory.toAbsolutePath());
        }
        Map<String, SpectralTable> tables = new TreeMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, MATERIAL_PREFIX + "*" + EXTENSION)) {
            for (Path file : files) {
                String fileName = file.getFileName().toString();
                String material = fileName.substring(MATERIAL_PREFIX.length(), fileName.length() - EXTENSION.length());
                tables.put(material, reader.read(material, file));
            }
        }
        log.info("Librería de materiales cargada desde {}: {} materiales {}", directory.toAbsolutePath(), tables.size(), tables.keySet());
        return tables;
    }

    public TabulatedRefractiveIndexProvider load(Path directory) throws IOException {
        return new TabulatedRefractiveIndexProvider(loadTables(directory));
    }
}
