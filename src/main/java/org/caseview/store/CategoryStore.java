package org.caseview.store;

import org.caseview.api.CaseNotFoundException;
import org.caseview.api.CaseStoreAccessException;
import org.caseview.api.InvalidStoreException;
import org.caseview.codec.ValueDecoder;
import org.caseview.coordinate.CaseKey;
import org.caseview.coordinate.IterationCoordinate;
import org.caseview.model.Case;
import org.caseview.model.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Access to the cases of one category table.
 * <p>
 * Owns the ordered key list loaded at open, fetches and decodes rows on demand
 * and keeps an optional cache of materialised cases. Subclasses map a stored row
 * to a {@link Case}.
 */
public abstract class CategoryStore {

    private static final Logger log = LoggerFactory.getLogger(CategoryStore.class);

    protected final Connection connection;
    protected final Category category;
    protected final ValueDecoder decoder;

    private final CaseCache cache = new CaseCache();
    private List<CaseKey> keys = List.of();
    private Set<String> ids = Set.of();
    private boolean present;

    protected CategoryStore(Category category, Connection connection, ValueDecoder decoder) {
        this.category = category;
        this.connection = connection;
        this.decoder = decoder;
    }

    /**
     * Maps one stored row to a case.
     *
     * @throws SQLException if a joined lookup fails.
     */
    protected abstract Case decode(StoredRow row) throws SQLException;

    /**
     * Loads the ordered key list.
     *
     * @throws InvalidStoreException if the table is missing although the store layout requires it.
     */
    public void loadKeys() throws SQLException, InvalidStoreException {
        present = SqlSupport.tableExists(connection, category.table());
        if (!present) {
            if (category.alwaysPresent() || decoder.version().guaranteesOptionalTables()) {
                throw new InvalidStoreException("Case store has no " + category.table() + " table");
            }
            log.warn("Case store has no {} table; treating it as empty", category.table());
            return;
        }

        String sql = "SELECT " + category.keyColumn() + ", counter FROM " + category.table() + " ORDER BY id ASC";
        List<CaseKey> loaded = new ArrayList<>();
        Set<String> loadedIds = new HashSet<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                String id = rs.getString(1);
                loaded.add(new CaseKey(category, IterationCoordinate.of(id), rs.getLong(2)));
                loadedIds.add(id);
            }
        }
        keys = Collections.unmodifiableList(loaded);
        ids = loadedIds;
        log.debug("Loaded {} {} keys", keys.size(), category.label());
    }

    public Category category() {
        return category;
    }

    /**
     * @return whether the category's table exists in the store.
     */
    public boolean isPresent() {
        return present;
    }

    /**
     * @return the keys in store order.
     */
    public List<CaseKey> keys() {
        return keys;
    }

    /**
     * @return the coordinates (or case names) in store order.
     */
    public List<String> ids() {
        List<String> result = new ArrayList<>(keys.size());
        for (CaseKey key : keys) {
            result.add(key.id());
        }
        return result;
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    /**
     * Returns one case.
     *
     * @param id       the coordinate, or the case name for problem cases
     * @param useCache whether to consult and populate the cache
     * @throws CaseNotFoundException if no row has this key.
     */
    public Case get(String id, boolean useCache) throws SQLException, CaseNotFoundException {
        if (useCache) {
            Case cached = cache.get(id);
            if (cached != null) {
                log.debug("Cache hit for {} case '{}'", category.label(), id);
                return cached;
            }
        }
        StoredRow row = present ? fetch(id) : null;
        if (row == null) {
            throw new CaseNotFoundException("No " + category.label() + " case found for '" + id + "'");
        }
        Case result = decode(row);
        if (useCache) {
            cache.put(result);
        }
        return result;
    }

    /**
     * Reads one row by key.
     *
     * @return the row, or {@code null} when absent.
     */
    protected StoredRow fetch(String id) throws SQLException {
        String sql = "SELECT * FROM " + category.table() + " WHERE " + category.keyColumn() + " = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? StoredRow.read(rs) : null;
            }
        }
    }

    /**
     * Returns every case of the category in store order.
     * <p>
     * Each iteration runs a fresh query, so the sequence can be traversed again.
     * Rows are read eagerly and decoded as the iterator advances; SQL failures
     * surface as {@link CaseStoreAccessException}.
     *
     * @param cached whether to reuse and populate the cache
     */
    public Iterable<Case> all(boolean cached) {
        return () -> {
            List<StoredRow> rows = readAll();
            Iterator<StoredRow> source = rows.iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return source.hasNext();
                }

                @Override
                public Case next() {
                    if (!source.hasNext()) {
                        throw new NoSuchElementException();
                    }
                    return materialise(source.next(), cached);
                }
            };
        };
    }

    /**
     * Decodes every case into the cache.
     */
    public void loadCases() {
        int before = cache.size();
        for (Case ignored : all(true)) {
            // populating the cache
        }
        log.debug("Pre-loaded {} {} cases", cache.size() - before, category.label());
    }

    /**
     * @return the number of cached cases.
     */
    public int cachedCount() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }

    private Case materialise(StoredRow row, boolean cached) {
        try {
            if (cached) {
                Case existing = cache.get(row.text(2));
                if (existing != null) {
                    return existing;
                }
            }
            Case result = decode(row);
            if (cached) {
                cache.put(result);
            }
            return result;
        } catch (SQLException e) {
            throw new CaseStoreAccessException("Failed to read " + category.label() + " case", e);
        }
    }

    private List<StoredRow> readAll() {
        if (!present) {
            return List.of();
        }
        String sql = "SELECT * FROM " + category.table() + " ORDER BY id ASC";
        List<StoredRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(StoredRow.read(rs));
            }
        } catch (SQLException e) {
            throw new CaseStoreAccessException("Failed to read " + category.table(), e);
        }
        return rows;
    }
}
