package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Walks a project directory and extracts every eligible source file.
 *
 * <p>At every level below the root, entries whose name starts with a dot
 * or matches the excluded directory names are skipped. The files of a
 * directory are processed in name order before its subdirectories, which
 * are also visited in name order; this order is the module order of the
 * resulting graph.</p>
 *
 * <p>Failures never abort the walk: a directory that cannot be listed
 * contributes nothing, and a file that cannot be read or parsed
 * contributes an error-flagged module.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ProjectScanner {

    private static final Logger LOG = LoggerFactory.getLogger(
            ProjectScanner.class);

    private static final String HIDDEN_PREFIX = ".";

    private static final Comparator<Path> BY_NAME =
            Comparator.comparing(p -> p.getFileName().toString());

    private final SourceParser parser;

    private final Set<String> excludedNames;

    /**
     * Creates a new scanner.
     *
     * @param theParser the language parser applied to each file
     * @param theExcludedNames directory names never descended into
     */
    public ProjectScanner(final SourceParser theParser,
            final Collection<String> theExcludedNames) {
        this.parser = Preconditions.requireNonNull(theParser,
                "Parser is required");
        this.excludedNames = Set.copyOf(Preconditions.requireNonNull(
                theExcludedNames, "Excluded names are required"));
    }

    /**
     * Scans a project directory.
     *
     * @param projectRoot the directory to scan
     * @return the modules in traversal order and their symbol index
     */
    public ScanResult scan(final Path projectRoot) {
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        final Path root = projectRoot.toAbsolutePath().normalize();

        LOG.info("Scanning {} sources under {}", parser.language(), root);

        final List<ModuleRecord> modules = new ArrayList<>();
        final SymbolIndex symbols = new SymbolIndex();
        walk(root, root, modules, symbols);

        LOG.info("Scanned {} modules, {} distinct function names",
                modules.size(), symbols.size());

        return new ScanResult(modules, symbols);
    }

    /**
     * Extracts a single file, converting read failures into an
     * error-flagged module.
     *
     * @param file the file to extract
     * @param projectRoot the root the module path is made relative to
     * @return the module record
     */
    public ModuleRecord scanFile(final Path file, final Path projectRoot) {
        try {
            final ModuleRecord module = parser.parse(file, projectRoot);
            if (module.hasError()) {
                LOG.warn("Could not parse {}: {}", module.path(),
                        module.error());
            }
            return module;
        } catch (final IOException e) {
            final String path = SourceReader.relativePath(file, projectRoot);
            LOG.warn("Could not read {}: {}", path, e.getMessage());
            return ModuleRecord.failed(path, ModuleRecord.READ_ERROR);
        }
    }

    private void walk(final Path directory, final Path root,
            final List<ModuleRecord> modules, final SymbolIndex symbols) {

        final List<Path> files = new ArrayList<>();
        final List<Path> directories = new ArrayList<>();

        try (DirectoryStream<Path> entries = openDirectory(directory)) {
            for (final Path entry : entries) {
                final String name = entry.getFileName().toString();
                if (isSkipped(name)) {
                    continue;
                }
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    directories.add(entry);
                } else if (Files.isRegularFile(entry)
                        && parser.accepts(name)) {
                    files.add(entry);
                }
            }
        } catch (final IOException | DirectoryIteratorException
                | SecurityException e) {
            LOG.warn("Could not list directory {}: {}", directory,
                    e.getMessage());
            return;
        }

        files.sort(BY_NAME);
        directories.sort(BY_NAME);

        for (final Path file : files) {
            final ModuleRecord module = scanFile(file, root);
            modules.add(module);
            symbols.registerAll(module);
        }
        for (final Path child : directories) {
            walk(child, root, modules, symbols);
        }
    }

    /**
     * Opens the entries of one directory.
     *
     * <p>Iterating the returned stream may fail with a
     * {@link DirectoryIteratorException}; the walk treats that like a
     * failure to open the directory.</p>
     *
     * @param directory the directory to list
     * @return the directory entries, never null
     * @throws IOException if the directory cannot be opened
     */
    protected DirectoryStream<Path> openDirectory(final Path directory)
            throws IOException {
        return Files.newDirectoryStream(directory);
    }

    private boolean isSkipped(final String name) {
        return name.startsWith(HIDDEN_PREFIX) || excludedNames.contains(name);
    }

}
