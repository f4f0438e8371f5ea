package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.analysis.domain.python.PythonSourceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ProjectScanner against real directory trees.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ProjectScannerTest {

    private ProjectScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new ProjectScanner(new PythonSourceParser(),
                List.of("__pycache__", "venv", "node_modules"));
    }

    // -- traversal ---------------------------------------------------------

    @Test
    void whenScanning_givenNestedDirectories_shouldListFilesBeforeSubdirectories(
            @TempDir final Path root) throws IOException {
        write(root, "zeta.py", "x = 1\n");
        write(root, "alpha/beta.py", "y = 2\n");
        write(root, "alpha/aardvark/deep.py", "z = 3\n");
        write(root, "alpha/omega.py", "w = 4\n");
        write(root, "main.py", "pass\n");

        final ScanResult result = scanner.scan(root);

        assertEquals(List.of("main.py", "zeta.py", "alpha/beta.py",
                "alpha/omega.py", "alpha/aardvark/deep.py"),
                paths(result.modules()));
    }

    @Test
    void whenScanning_givenHiddenAndExcludedEntries_shouldSkipThem(
            @TempDir final Path root) throws IOException {
        write(root, "app.py", "pass\n");
        write(root, ".git/hooks.py", "pass\n");
        write(root, ".secret.py", "pass\n");
        write(root, "__pycache__/app.py", "pass\n");
        write(root, "venv/lib/site.py", "pass\n");
        write(root, "web/node_modules/tool.py", "pass\n");
        write(root, "web/view.py", "pass\n");
        write(root, "README.md", "# readme\n");
        write(root, "setup.cfg", "[metadata]\n");

        final ScanResult result = scanner.scan(root);

        assertEquals(List.of("app.py", "web/view.py"),
                paths(result.modules()));
    }

    @Test
    void whenScanning_givenEmptyDirectory_shouldReturnNoModules(
            @TempDir final Path root) {
        final ScanResult result = scanner.scan(root);

        assertTrue(result.modules().isEmpty());
        assertEquals(0, result.symbols().size());
    }

    // -- fault isolation ---------------------------------------------------

    @Test
    void whenScanning_givenOneBrokenFile_shouldFlagItAndKeepTheOthers(
            @TempDir final Path root) throws IOException {
        write(root, "broken.py", "def f(:\n    pass\n");
        write(root, "good.py", "def ok():\n    return 1\n");

        final ScanResult result = scanner.scan(root);

        assertEquals(2, result.modules().size());

        final ModuleRecord broken = result.modules().get(0);
        assertEquals("broken.py", broken.path());
        assertEquals(ModuleRecord.PARSE_ERROR, broken.error());
        assertTrue(broken.functions().isEmpty());

        final ModuleRecord good = result.modules().get(1);
        assertFalse(good.hasError());
        assertNull(good.error());
        assertEquals("ok", good.functions().get(0).name());
    }

    @Test
    void whenScanningFile_givenMissingFile_shouldReturnReadError(
            @TempDir final Path root) {
        final ModuleRecord module = scanner.scanFile(
                root.resolve("pkg/gone.py"), root);

        assertEquals("pkg/gone.py", module.path());
        assertEquals(ModuleRecord.READ_ERROR, module.error());
    }

    @Test
    void whenScanning_givenUnlistableDirectories_shouldSkipThemAndKeepTheOthers(
            @TempDir final Path root) throws IOException {
        write(root, "app.py", "def run():\n    pass\n");
        write(root, "locked/secret.py", "def hidden():\n    pass\n");
        write(root, "flaky/partial.py", "def lost():\n    pass\n");
        write(root, "web/view.py", "def show():\n    pass\n");

        final ProjectScanner failing = new ProjectScanner(
                new PythonSourceParser(), List.of()) {
            @Override
            protected DirectoryStream<Path> openDirectory(final Path directory)
                    throws IOException {
                final String name = directory.getFileName().toString();
                if (name.equals("locked")) {
                    throw new AccessDeniedException(directory.toString());
                }
                final DirectoryStream<Path> entries =
                        super.openDirectory(directory);
                return name.equals("flaky")
                        ? failAfterFirstEntry(entries) : entries;
            }
        };

        final ScanResult result = failing.scan(root);

        assertEquals(List.of("app.py", "web/view.py"),
                paths(result.modules()));
        assertTrue(result.symbols().owner("hidden").isEmpty());
        assertTrue(result.symbols().owner("lost").isEmpty());
        assertEquals("web/view.py",
                result.symbols().owner("show").orElseThrow());
    }

    // -- symbol index ------------------------------------------------------

    @Test
    void whenScanning_givenSameFunctionInTwoModules_shouldKeepLastScanned(
            @TempDir final Path root) throws IOException {
        write(root, "caller.py", "f()\n");
        write(root, "x.py", "def f():\n    pass\n");
        write(root, "sub/y.py", "def f():\n    pass\n");

        final ScanResult result = scanner.scan(root);

        assertEquals("sub/y.py", result.symbols().owner("f").orElseThrow());

        final List<Edge> edges = new NameOnlyCallResolver().resolve(
                result.modules(), result.symbols());
        assertEquals(List.of(new Edge("caller.py", "sub/y.py", "f")), edges);
    }

    @Test
    void whenScanning_givenMethods_shouldIndexThemAsFunctions(
            @TempDir final Path root) throws IOException {
        write(root, "models.py", "class Order:\n"
                + "    def total(self):\n"
                + "        return 0\n");

        final ScanResult result = scanner.scan(root);

        assertEquals("models.py",
                result.symbols().owner("total").orElseThrow());
        assertTrue(result.symbols().owner("Order").isEmpty());
    }

    private static void write(final Path root, final String relative,
            final String content) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static DirectoryStream<Path> failAfterFirstEntry(
            final DirectoryStream<Path> entries) {
        final Iterator<Path> delegate = entries.iterator();
        return new DirectoryStream<>() {
            @Override
            public Iterator<Path> iterator() {
                return new Iterator<>() {
                    private boolean served;

                    @Override
                    public boolean hasNext() {
                        if (served) {
                            throw new DirectoryIteratorException(
                                    new IOException("Entry read failed"));
                        }
                        return delegate.hasNext();
                    }

                    @Override
                    public Path next() {
                        served = true;
                        return delegate.next();
                    }
                };
            }

            @Override
            public void close() throws IOException {
                entries.close();
            }
        };
    }

    private static List<String> paths(final List<ModuleRecord> modules) {
        return modules.stream()
                .map(ModuleRecord::path)
                .collect(Collectors.toList());
    }

}
