package org.caseview.reader;

import org.caseview.api.CaseNotFoundException;
import org.caseview.api.CaseStoreAccessException;
import org.caseview.api.CaseStoreException;
import org.caseview.api.ICaseReader;
import org.caseview.api.InvalidStoreException;
import org.caseview.api.SourceNotFoundException;
import org.caseview.codec.FormatVersion;
import org.caseview.codec.ValueDecoder;
import org.caseview.coordinate.CaseKey;
import org.caseview.coordinate.CoordinateHierarchy;
import org.caseview.coordinate.IterationCoordinate;
import org.caseview.coordinate.SourceNames;
import org.caseview.metadata.MetadataCatalog;
import org.caseview.model.Case;
import org.caseview.model.CaseTree;
import org.caseview.model.Category;
import org.caseview.model.SourceVariables;
import org.caseview.store.CategoryStore;
import org.caseview.store.DriverCaseStore;
import org.caseview.store.DriverDerivativeCaseStore;
import org.caseview.store.ProblemCaseStore;
import org.caseview.store.SolverCaseStore;
import org.caseview.store.SystemCaseStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads a SQLite case store.
 * <p>
 * Opening validates the file, reads the format version, builds the metadata
 * catalog and loads the key lists of every category. Cases are materialised on
 * demand. Single-threaded; the store must not be written while the reader is open.
 */
public class SqliteCaseReader implements ICaseReader {

    private static final Logger log = LoggerFactory.getLogger(SqliteCaseReader.class);

    private static final byte[] SQLITE_HEADER = "SQLite format 3\0".getBytes(StandardCharsets.US_ASCII);

    /** Lookup order of {@link #getCase(String, boolean)}. */
    private static final Category[] LOOKUP_ORDER = {
        Category.DRIVER, Category.SOLVER, Category.SYSTEM, Category.PROBLEM, Category.DRIVER_DERIVATIVE
    };

    private final Path file;
    private final Connection connection;
    private final FormatVersion formatVersion;
    private final MetadataCatalog catalog;
    private final CaseReaderOptions options;
    private final Map<Category, CategoryStore> stores;
    private final CoordinateHierarchy hierarchy;
    private final Map<String, List<CaseKey>> locations;
    private boolean closed = false;

    private SqliteCaseReader(Path file, Connection connection, FormatVersion formatVersion,
                             MetadataCatalog catalog, CaseReaderOptions options,
                             Map<Category, CategoryStore> stores) {
        this.file = file;
        this.connection = connection;
        this.formatVersion = formatVersion;
        this.catalog = catalog;
        this.options = options;
        this.stores = stores;
        this.hierarchy = new CoordinateHierarchy(
            stores.get(Category.DRIVER).keys(),
            stores.get(Category.SOLVER).keys(),
            stores.get(Category.SYSTEM).keys());
        this.locations = indexLocations();
    }

    /**
     * Opens a store with the options from the classpath config.
     *
     * @throws InvalidStoreException if the file is missing or not a readable case store.
     * @throws org.caseview.api.UnsupportedFormatVersionException if the format version is not supported.
     */
    public static SqliteCaseReader open(Path file) throws CaseStoreException {
        return open(file, CaseReaderOptions.defaults());
    }

    /**
     * Opens a store.
     *
     * @throws InvalidStoreException if the file is missing or not a readable case store.
     * @throws org.caseview.api.UnsupportedFormatVersionException if the format version is not supported.
     */
    public static SqliteCaseReader open(Path file, CaseReaderOptions options) throws CaseStoreException {
        checkSqliteFile(file);

        Connection connection;
        try {
            SQLiteConfig config = new SQLiteConfig();
            config.setReadOnly(true);
            config.setBusyTimeout(options.busyTimeoutMs());
            connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath(), config.toProperties());
        } catch (SQLException e) {
            throw new InvalidStoreException("Cannot open case store " + file + ": " + e.getMessage(), e);
        }

        try {
            FormatVersion version = FormatVersion.of(MetadataCatalog.readFormatVersion(connection));
            MetadataCatalog catalog = MetadataCatalog.build(connection, version);
            ValueDecoder decoder = new ValueDecoder(version, catalog);

            DriverDerivativeCaseStore derivatives = new DriverDerivativeCaseStore(connection, decoder);
            Map<Category, CategoryStore> stores = new EnumMap<>(Category.class);
            stores.put(Category.DRIVER, new DriverCaseStore(connection, decoder, derivatives));
            stores.put(Category.DRIVER_DERIVATIVE, derivatives);
            stores.put(Category.SYSTEM, new SystemCaseStore(connection, decoder));
            stores.put(Category.SOLVER, new SolverCaseStore(connection, decoder));
            stores.put(Category.PROBLEM, new ProblemCaseStore(connection, decoder));
            for (CategoryStore store : stores.values()) {
                store.loadKeys();
            }

            SqliteCaseReader reader = new SqliteCaseReader(file, connection, version, catalog, options, stores);
            log.info("Opened case store {} (format {}, {} driver, {} system, {} solver, {} problem cases)",
                file, version.tag(),
                stores.get(Category.DRIVER).keys().size(),
                stores.get(Category.SYSTEM).keys().size(),
                stores.get(Category.SOLVER).keys().size(),
                stores.get(Category.PROBLEM).keys().size());
            if (options.preLoad()) {
                reader.loadCases();
            }
            return reader;
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new InvalidStoreException("Cannot read case store " + file + ": " + e.getMessage(), e);
        } catch (CaseStoreException | RuntimeException e) {
            closeQuietly(connection);
            throw e;
        }
    }

    private static void checkSqliteFile(Path file) throws InvalidStoreException {
        if (!Files.isRegularFile(file)) {
            throw new InvalidStoreException("Case store file not found: " + file);
        }
        byte[] header = new byte[SQLITE_HEADER.length];
        try (InputStream in = Files.newInputStream(file)) {
            int read = in.readNBytes(header, 0, header.length);
            if (read < header.length || !Arrays.equals(header, SQLITE_HEADER)) {
                throw new InvalidStoreException("File is not a SQLite database: " + file);
            }
        } catch (IOException e) {
            throw new InvalidStoreException("Cannot read case store file " + file + ": " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Ignoring failure to close connection after a failed open", e);
        }
    }

    private Map<String, List<CaseKey>> indexLocations() {
        Map<String, List<CaseKey>> index = new LinkedHashMap<>();
        for (CaseKey key : hierarchy.keys(Category.SYSTEM)) {
            index.computeIfAbsent(SourceNames.systemSource(key.coordinate()), s -> new ArrayList<>()).add(key);
        }
        for (CaseKey key : hierarchy.keys(Category.SOLVER)) {
            index.computeIfAbsent(SourceNames.solverSource(key.coordinate()), s -> new ArrayList<>()).add(key);
        }
        return index;
    }

    public Path file() {
        return file;
    }

    public CaseReaderOptions options() {
        return options;
    }

    @Override
    public FormatVersion formatVersion() {
        return formatVersion;
    }

    @Override
    public MetadataCatalog catalog() {
        return catalog;
    }

    /**
     * @return the store of one category.
     */
    public CategoryStore store(Category category) {
        return stores.get(category);
    }

    @Override
    public List<String> listSources() {
        ensureNotClosed();
        List<String> sources = new ArrayList<>();
        if (!stores.get(Category.DRIVER).keys().isEmpty()) {
            sources.add(SourceNames.DRIVER);
        }
        if (!stores.get(Category.PROBLEM).keys().isEmpty()) {
            sources.add(SourceNames.PROBLEM);
        }
        sources.addAll(locations.keySet());
        return sources;
    }

    @Override
    public List<String> listCases(String source) throws SourceNotFoundException {
        return listCases(source, false);
    }

    @Override
    public List<String> listCases(String source, boolean recurse) throws SourceNotFoundException {
        ensureNotClosed();
        ResolvedSource resolved = resolve(source, recurse);
        return ids(hierarchy.flatten(resolved.items(), resolved.depth()));
    }

    @Override
    public Map<String, CaseTree<String>> listCaseTree(String source, boolean recurse) throws SourceNotFoundException {
        ensureNotClosed();
        ResolvedSource resolved = resolve(source, recurse);
        return hierarchy.tree(resolved.items(), resolved.depth(), CaseKey::id);
    }

    @Override
    public Case getCase(String id) throws SQLException, CaseNotFoundException {
        return getCase(id, options.cacheByDefault());
    }

    @Override
    public Case getCase(String id, boolean cache) throws SQLException, CaseNotFoundException {
        ensureNotClosed();
        for (Category category : LOOKUP_ORDER) {
            CategoryStore store = stores.get(category);
            if (store.contains(id)) {
                return store.get(id, cache);
            }
        }
        throw new CaseNotFoundException("Case not found: " + id);
    }

    @Override
    public Iterable<Case> getCases(String source, boolean recurse) throws SourceNotFoundException {
        ensureNotClosed();
        ResolvedSource resolved = resolve(source, recurse);
        return new CaseSequence(hierarchy.flatten(resolved.items(), resolved.depth()), this::load);
    }

    @Override
    public Map<String, CaseTree<Case>> getCaseTree(String source, boolean recurse) throws SourceNotFoundException {
        ensureNotClosed();
        ResolvedSource resolved = resolve(source, recurse);
        return hierarchy.tree(resolved.items(), resolved.depth(), this::load);
    }

    @Override
    public Map<String, CaseTree<Case>> getCaseTree() throws SourceNotFoundException {
        return getCaseTree(SourceNames.PROBLEM, true);
    }

    @Override
    public SourceVariables listSourceVars(String source) throws SQLException, SourceNotFoundException {
        ensureNotClosed();
        ResolvedSource resolved = resolve(source, false);
        if (resolved.items().isEmpty()) {
            return new SourceVariables(List.of(), List.of());
        }
        CaseKey first = resolved.items().get(0);
        Case sample;
        try {
            sample = stores.get(first.category()).get(first.id(), options.cacheByDefault());
        } catch (CaseNotFoundException e) {
            throw new IllegalStateException("Case listed at open is missing from the store: " + first.id(), e);
        }
        List<String> inputs = sample.inputs() == null ? List.of() : List.copyOf(sample.inputs().names());
        List<String> outputs = sample.outputs() == null ? List.of() : List.copyOf(sample.outputs().names());
        return new SourceVariables(inputs, outputs);
    }

    @Override
    public void loadCases() {
        ensureNotClosed();
        for (Category category : new Category[] {Category.DRIVER, Category.SOLVER, Category.SYSTEM, Category.PROBLEM}) {
            stores.get(category).loadCases();
        }
    }

    /**
     * Resolves a source to its top-level items.
     * <p>
     * Literal sources and location names expand to all descendants only when
     * {@code recurse} is set; an explicit coordinate always includes at least its
     * direct children.
     */
    ResolvedSource resolve(String source, boolean recurse) throws SourceNotFoundException {
        int listDepth = recurse ? CoordinateHierarchy.ALL_DESCENDANTS : CoordinateHierarchy.ITEMS_ONLY;
        if (source == null || source.isEmpty()) {
            return new ResolvedSource("", hierarchy.findChildren(IterationCoordinate.ROOT), listDepth);
        }
        if (SourceNames.DRIVER.equals(source)) {
            return new ResolvedSource(source, hierarchy.keys(Category.DRIVER), listDepth);
        }
        if (SourceNames.PROBLEM.equals(source)) {
            return new ResolvedSource(source, stores.get(Category.PROBLEM).keys(), CoordinateHierarchy.ITEMS_ONLY);
        }
        List<CaseKey> located = locations.get(source);
        if (located != null) {
            return new ResolvedSource(source, located, listDepth);
        }
        Optional<CaseKey> key = hierarchy.find(source);
        if (key.isPresent()) {
            int depth = recurse ? CoordinateHierarchy.ALL_DESCENDANTS : CoordinateHierarchy.DIRECT_CHILDREN;
            return new ResolvedSource(source, List.of(key.get()), depth);
        }
        for (Category category : new Category[] {Category.PROBLEM, Category.DRIVER_DERIVATIVE}) {
            for (CaseKey candidate : stores.get(category).keys()) {
                if (candidate.id().equals(source)) {
                    return new ResolvedSource(source, List.of(candidate), CoordinateHierarchy.ITEMS_ONLY);
                }
            }
        }
        throw new SourceNotFoundException(source);
    }

    private Case load(CaseKey key) {
        try {
            return stores.get(key.category()).get(key.id(), options.cacheByDefault());
        } catch (SQLException e) {
            throw new CaseStoreAccessException("Failed to read case '" + key.id() + "'", e);
        } catch (CaseNotFoundException e) {
            throw new IllegalStateException("Case listed at open is missing from the store: " + key.id(), e);
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Reader is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
            log.debug("Closed case store {}", file);
        } catch (SQLException e) {
            log.warn("Failed to close case store {}", file, e);
        }
    }

    @Override
    public String toString() {
        return "SqliteCaseReader{" + file + ", format " + formatVersion.tag() + "}";
    }

    private static List<String> ids(List<CaseKey> keys) {
        List<String> result = new ArrayList<>(keys.size());
        for (CaseKey key : keys) {
            result.add(key.id());
        }
        return Collections.unmodifiableList(result);
    }
}
