package xregrid.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xregrid.config.RegridConfig;
import xregrid.domain.operator.RegridMethod;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas unitarias para la clase {@link JsonFileHandler}.
 * Verifican la serialización y deserialización de objetos a/desde archivos JSON.
 */
class JsonFileHandlerTest {

    private JsonFileHandler jsonFileHandler;

    // JUnit 5 inyecta un directorio temporal fresco antes de cada test.
    @TempDir
    Path tempDir;

    private record TestData(String name, int value, List<String> items) {}

    @BeforeEach
    void setUp() {
        this.jsonFileHandler = new JsonFileHandler();
    }

    @Test
    @DisplayName("Debería serializar un objeto a un archivo JSON creando los directorios intermedios")
    void writeToFile_shouldCreateAndWriteToJsonFile() throws IOException {
        // --- 1. Arrange (Preparación) ---
        TestData originalData = new TestData("TestObject", 123, List.of("A", "B", "C"));
        Path outputFile = tempDir.resolve("nested").resolve("output.json");

        // --- 2. Act (Actuación) ---
        jsonFileHandler.writeToFile(originalData, outputFile);

        // --- 3. Assert (Verificación) ---
        assertThat(outputFile).exists();
        String fileContent = Files.readString(outputFile);
        assertThat(fileContent)
                .contains("\"name\" : \"TestObject\"")
                .contains("\"value\" : 123")
                .contains("\"items\" : [ \"A\", \"B\", \"C\" ]");
    }

    @Test
    @DisplayName("Debería completar un ciclo de escritura y lectura de una configuración de regridding")
    void writeAndRead_shouldRoundTripRegridConfig() throws IOException {
        // --- 1. Arrange ---
        RegridConfig original = RegridConfig.getDefault()
                .withMethod(RegridMethod.NEAREST_S2D)
                .withPeriodic(true)
                .withCacheDirectory("weights");
        Path file = tempDir.resolve("config.json");

        // --- 2. Act ---
        jsonFileHandler.writeToFile(original, file);
        RegridConfig read = jsonFileHandler.readFromFile(file, RegridConfig.class);

        // --- 3. Assert ---
        assertThat(Files.readString(file)).contains("\"method\" : \"nearest_s2d\"");
        assertThat(read).isEqualTo(original);
    }

    @Test
    @DisplayName("Debería leer una configuración escrita a mano con el nombre externo del método")
    void readFromFile_shouldParseHandWrittenConfig() throws IOException {
        // --- 1. Arrange ---
        String jsonContent = """
        {
          "method": "conservative",
          "skipNa": true,
          "workerCount": 4
        }
        """;
        Path inputFile = tempDir.resolve("input.json");
        Files.writeString(inputFile, jsonContent);

        // --- 2. Act ---
        RegridConfig config = jsonFileHandler.readFromFile(inputFile, RegridConfig.class);

        // --- 3. Assert ---
        assertThat(config.method()).isEqualTo(RegridMethod.CONSERVATIVE);
        assertThat(config.skipNa()).isTrue();
        assertThat(config.periodic()).isNull();
        assertThat(config.isParallel()).isTrue();
    }

    @Test
    @DisplayName("Debería lanzar IOException al intentar leer un archivo que no existe")
    void readFromFile_whenFileDoesNotExist_shouldThrowIOException() {
        // --- 1. Arrange ---
        Path nonExistentFile = tempDir.resolve("imaginary.json");

        // --- 2. Act & 3. Assert ---
        IOException exception = assertThrows(IOException.class,
                () -> jsonFileHandler.readFromFile(nonExistentFile, TestData.class));
        assertThat(exception.getMessage()).contains("El archivo especificado no existe");
        assertThrows(IOException.class, () -> jsonFileHandler.readTree(nonExistentFile));
    }

    @Test
    @DisplayName("Debería rechazar JSON mal formado o con campos desconocidos")
    void readFromFile_whenJsonIsMalformedOrUnknown_shouldThrowIOException() throws IOException {
        // --- 1. Arrange ---
        Path malformed = tempDir.resolve("malformed.json");
        Files.writeString(malformed, """
        {
          "name": "Malformed",
          "value": 100,
        }
        """);
        Path unknown = tempDir.resolve("unknown.json");
        Files.writeString(unknown, """
        { "name": "X", "value": 1, "items": [], "extra": true }
        """);

        // --- 2. Act & 3. Assert ---
        assertThrows(IOException.class, () -> jsonFileHandler.readFromFile(malformed, TestData.class));
        assertThrows(IOException.class, () -> jsonFileHandler.readFromFile(unknown, TestData.class));
    }
}
