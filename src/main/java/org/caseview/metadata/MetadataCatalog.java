package org.caseview.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import org.caseview.api.CaseDecodeException;
import org.caseview.api.InvalidStoreException;
import org.caseview.api.UnknownVariableException;
import org.caseview.codec.FormatVersion;
import org.caseview.codec.Json;
import org.caseview.codec.PythonPickleDecoder;
import org.caseview.store.SqlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Variable naming and metadata tables of one case store, built once at open.
 * <p>
 * Holds the absolute-to-promoted and promoted-to-absolute name maps per
 * {@link VariableNamespace}, per-variable metadata keyed by absolute name, and the
 * auxiliary driver, system and solver records. Auxiliary records are read at
 * build time and decoded on first access.
 */
public final class MetadataCatalog {

    private static final Logger log = LoggerFactory.getLogger(MetadataCatalog.class);

    private final FormatVersion formatVersion;
    private final Map<VariableNamespace, Map<String, String>> absToProm;
    private final Map<VariableNamespace, Map<String, List<String>>> promToAbs;
    private final Map<String, VariableMetadata> variables;
    private final JsonNode variableSettings;

    private final Map<String, byte[]> rawDriverMetadata;
    private final Map<String, byte[][]> rawSystemMetadata;
    private final Map<String, byte[][]> rawSolverMetadata;

    private Map<String, JsonNode> driverMetadata;
    private Map<String, SystemMetadata> systemMetadata;
    private Map<String, SolverMetadata> solverMetadata;

    MetadataCatalog(FormatVersion formatVersion,
                    Map<VariableNamespace, Map<String, String>> absToProm,
                    Map<VariableNamespace, Map<String, List<String>>> promToAbs,
                    Map<String, VariableMetadata> variables,
                    JsonNode variableSettings,
                    Map<String, byte[]> rawDriverMetadata,
                    Map<String, byte[][]> rawSystemMetadata,
                    Map<String, byte[][]> rawSolverMetadata) {
        this.formatVersion = formatVersion;
        this.absToProm = absToProm;
        this.promToAbs = promToAbs;
        this.variables = variables;
        this.variableSettings = variableSettings;
        this.rawDriverMetadata = rawDriverMetadata;
        this.rawSystemMetadata = rawSystemMetadata;
        this.rawSolverMetadata = rawSolverMetadata;
    }

    /**
     * Reads the recorded format version tag.
     *
     * @throws InvalidStoreException if the metadata table or its row is missing.
     */
    public static int readFormatVersion(Connection connection) throws SQLException, InvalidStoreException {
        if (!SqlSupport.tableExists(connection, "metadata")) {
            throw new InvalidStoreException("Case store has no metadata table");
        }
        try (PreparedStatement stmt = connection.prepareStatement("SELECT format_version FROM metadata");
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                throw new InvalidStoreException("Case store metadata table is empty");
            }
            return rs.getInt(1);
        }
    }

    /**
     * Builds the catalog from the metadata tables of an open store.
     *
     * @param connection open connection to the store
     * @param version    the store's format version, selecting the encoding of each table
     * @return the catalog
     * @throws InvalidStoreException if the name maps or variable metadata cannot be decoded.
     */
    public static MetadataCatalog build(Connection connection, FormatVersion version)
            throws SQLException, InvalidStoreException {
        JsonNode absToPromTree;
        JsonNode promToAbsTree;
        JsonNode metaTree;
        JsonNode settingsTree = null;

        try (PreparedStatement stmt = connection.prepareStatement("SELECT * FROM metadata");
             ResultSet rs = stmt.executeQuery()) {
            if (!rs.next()) {
                throw new InvalidStoreException("Case store metadata table is empty");
            }
            absToPromTree = decodeTree(SqlSupport.rawColumn(rs, 2), version, "abs2prom");
            promToAbsTree = decodeTree(SqlSupport.rawColumn(rs, 3), version, "prom2abs");
            metaTree = decodeTree(SqlSupport.rawColumn(rs, 4), version, "abs2meta");
            if (version.hasVariableSettings() && rs.getMetaData().getColumnCount() >= 5) {
                settingsTree = decodeTree(SqlSupport.rawColumn(rs, 5), version, "var_settings");
            }
        }

        Map<VariableNamespace, Map<String, String>> absToProm = new EnumMap<>(VariableNamespace.class);
        Map<VariableNamespace, Map<String, List<String>>> promToAbs = new EnumMap<>(VariableNamespace.class);
        for (VariableNamespace ns : VariableNamespace.values()) {
            absToProm.put(ns, readAbsToProm(absToPromTree, ns));
            promToAbs.put(ns, readPromToAbs(promToAbsTree, ns));
        }

        Map<String, VariableMetadata> variables = new LinkedHashMap<>();
        if (metaTree != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = metaTree.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                try {
                    variables.put(entry.getKey(), VariableMetadata.fromJson(entry.getKey(), entry.getValue()));
                } catch (IllegalArgumentException e) {
                    throw new InvalidStoreException(
                        "Invalid metadata for variable '" + entry.getKey() + "': " + e.getMessage(), e);
                }
            }
        }

        Map<String, byte[]> driverRows = new LinkedHashMap<>();
        if (SqlSupport.tableExists(connection, "driver_metadata")) {
            try (PreparedStatement stmt = connection.prepareStatement("SELECT id, model_viewer_data FROM driver_metadata");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    driverRows.put(rs.getString(1), SqlSupport.rawColumn(rs, 2));
                }
            }
        }
        Map<String, byte[][]> systemRows = readAuxiliary(connection,
            "SELECT id, scaling_factors, component_metadata FROM system_metadata", "system_metadata");
        Map<String, byte[][]> solverRows = readAuxiliary(connection,
            "SELECT id, solver_options, solver_class FROM solver_metadata", "solver_metadata");

        log.debug("Built metadata catalog: {} variables, {} system records, {} solver records",
            variables.size(), systemRows.size(), solverRows.size());

        return new MetadataCatalog(version, absToProm, promToAbs, Collections.unmodifiableMap(variables),
            settingsTree, driverRows, systemRows, solverRows);
    }

    private static Map<String, byte[][]> readAuxiliary(Connection connection, String sql, String table)
            throws SQLException {
        Map<String, byte[][]> rows = new LinkedHashMap<>();
        if (!SqlSupport.tableExists(connection, table)) {
            return rows;
        }
        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.put(rs.getString(1), new byte[][] {SqlSupport.rawColumn(rs, 2), SqlSupport.rawColumn(rs, 3)});
            }
        }
        return rows;
    }

    private static JsonNode decodeTree(byte[] raw, FormatVersion version, String column) throws InvalidStoreException {
        if (raw == null) {
            return null;
        }
        try {
            return switch (version.encoding()) {
                case STRUCTURED_TEXT -> Json.MAPPER.readTree(new String(raw, StandardCharsets.UTF_8));
                case LEGACY_BINARY -> PythonPickleDecoder.toJsonTree(raw);
            };
        } catch (IOException | RuntimeException e) {
            throw new InvalidStoreException("Cannot decode metadata column '" + column + "': " + e.getMessage(), e);
        }
    }

    private static Map<String, String> readAbsToProm(JsonNode tree, VariableNamespace ns) {
        Map<String, String> result = new LinkedHashMap<>();
        JsonNode section = tree == null ? null : tree.get(ns.key());
        if (section != null) {
            section.fields().forEachRemaining(e -> result.put(e.getKey(), e.getValue().asText()));
        }
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, List<String>> readPromToAbs(JsonNode tree, VariableNamespace ns) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        JsonNode section = tree == null ? null : tree.get(ns.key());
        if (section != null) {
            section.fields().forEachRemaining(e -> {
                List<String> names = new ArrayList<>();
                if (e.getValue().isArray()) {
                    e.getValue().forEach(n -> names.add(n.asText()));
                } else {
                    names.add(e.getValue().asText());
                }
                result.put(e.getKey(), Collections.unmodifiableList(names));
            });
        }
        return Collections.unmodifiableMap(result);
    }

    public FormatVersion formatVersion() {
        return formatVersion;
    }

    /**
     * @return whether {@code name} is a known absolute name in the namespace.
     */
    public boolean isAbsoluteName(String name, VariableNamespace ns) {
        return absToProm.get(ns).containsKey(name);
    }

    /**
     * @return whether {@code name} is a known promoted name in the namespace.
     */
    public boolean isPromotedName(String name, VariableNamespace ns) {
        return promToAbs.get(ns).containsKey(name);
    }

    /**
     * @return the absolute names a promoted name maps to, empty when unknown.
     */
    public List<String> absoluteNames(String promotedName, VariableNamespace ns) {
        return promToAbs.get(ns).getOrDefault(promotedName, List.of());
    }

    /**
     * Resolves an absolute or promoted name to the single absolute name it denotes.
     *
     * @throws UnknownVariableException if the name is unknown or promoted to several sources.
     */
    public String absoluteName(String name, VariableNamespace ns) {
        if (isAbsoluteName(name, ns)) {
            return name;
        }
        List<String> candidates = absoluteNames(name, ns);
        if (candidates.isEmpty()) {
            throw new UnknownVariableException(name, "Unknown " + ns.key() + " variable '" + name + "'");
        }
        if (candidates.size() > 1) {
            throw new UnknownVariableException(name, "The promoted name '" + name
                + "' is ambiguous; use one of the absolute names " + candidates);
        }
        return candidates.get(0);
    }

    public Optional<String> promotedName(String absoluteName, VariableNamespace ns) {
        return Optional.ofNullable(absToProm.get(ns).get(absoluteName));
    }

    /**
     * @return the promoted names of the namespace in recorded order.
     */
    public Set<String> promotedNames(VariableNamespace ns) {
        return promToAbs.get(ns).keySet();
    }

    public Optional<VariableMetadata> findVariable(String absoluteName) {
        return Optional.ofNullable(variables.get(absoluteName));
    }

    /**
     * Looks up metadata by absolute name, then by promoted output name, then by promoted input name.
     *
     * @throws UnknownVariableException if no variable matches or a promoted name is ambiguous.
     */
    public VariableMetadata variable(String name) {
        VariableMetadata meta = variables.get(name);
        if (meta != null) {
            return meta;
        }
        for (VariableNamespace ns : new VariableNamespace[] {VariableNamespace.OUTPUT, VariableNamespace.INPUT}) {
            if (isPromotedName(name, ns)) {
                return variable(name, ns);
            }
        }
        throw new UnknownVariableException(name, "Unknown variable '" + name + "'");
    }

    /**
     * Looks up metadata of a variable in one namespace.
     *
     * @throws UnknownVariableException if no variable matches or a promoted name is ambiguous.
     */
    public VariableMetadata variable(String name, VariableNamespace ns) {
        String absolute = absoluteName(name, ns);
        VariableMetadata meta = variables.get(absolute);
        if (meta == null) {
            throw new UnknownVariableException(name, "No metadata recorded for variable '" + absolute + "'");
        }
        return meta;
    }

    /**
     * @return the recorded shape of a variable, or {@code null} when not known.
     */
    public int[] shapeOf(String absoluteName) {
        VariableMetadata meta = variables.get(absoluteName);
        return meta == null ? null : meta.shape();
    }

    public Map<String, VariableMetadata> variables() {
        return variables;
    }

    /**
     * @return variables carrying the given kind tag, in recorded order.
     */
    public List<VariableMetadata> variablesOfType(String type) {
        List<VariableMetadata> result = new ArrayList<>();
        for (VariableMetadata meta : variables.values()) {
            if (meta.hasType(type)) {
                result.add(meta);
            }
        }
        return result;
    }

    /**
     * @return the recorded variable settings; present only for stores that record them.
     */
    public Optional<JsonNode> variableSettings() {
        return Optional.ofNullable(variableSettings);
    }

    /**
     * @return decoded driver metadata records (model viewer data) keyed by driver id.
     * @throws CaseDecodeException if a record cannot be decoded.
     */
    public synchronized Map<String, JsonNode> driverMetadata() {
        if (driverMetadata == null) {
            Map<String, JsonNode> decoded = new LinkedHashMap<>();
            for (Map.Entry<String, byte[]> row : rawDriverMetadata.entrySet()) {
                decoded.put(row.getKey(), decodeAuxiliary(row.getKey(), row.getValue(),
                    formatVersion.encoding() == FormatVersion.ValueEncoding.STRUCTURED_TEXT));
            }
            driverMetadata = Collections.unmodifiableMap(decoded);
        }
        return driverMetadata;
    }

    /**
     * @return decoded system records keyed by system id.
     * @throws CaseDecodeException if a record cannot be decoded.
     */
    public synchronized Map<String, SystemMetadata> systemMetadata() {
        if (systemMetadata == null) {
            Map<String, SystemMetadata> decoded = new LinkedHashMap<>();
            for (Map.Entry<String, byte[][]> row : rawSystemMetadata.entrySet()) {
                String id = row.getKey();
                decoded.put(id, new SystemMetadata(id,
                    decodeAuxiliary(id, row.getValue()[0], false),
                    decodeAuxiliary(id, row.getValue()[1], false)));
            }
            systemMetadata = Collections.unmodifiableMap(decoded);
        }
        return systemMetadata;
    }

    /**
     * @return decoded solver records keyed by solver id.
     * @throws CaseDecodeException if a record cannot be decoded.
     */
    public synchronized Map<String, SolverMetadata> solverMetadata() {
        if (solverMetadata == null) {
            Map<String, SolverMetadata> decoded = new LinkedHashMap<>();
            for (Map.Entry<String, byte[][]> row : rawSolverMetadata.entrySet()) {
                String id = row.getKey();
                byte[] solverClass = row.getValue()[1];
                decoded.put(id, new SolverMetadata(id,
                    decodeAuxiliary(id, row.getValue()[0], false),
                    solverClass == null ? null : new String(solverClass, StandardCharsets.UTF_8)));
            }
            solverMetadata = Collections.unmodifiableMap(decoded);
        }
        return solverMetadata;
    }

    private static JsonNode decodeAuxiliary(String id, byte[] raw, boolean json) {
        if (raw == null) {
            return null;
        }
        try {
            return json
                ? Json.MAPPER.readTree(new String(raw, StandardCharsets.UTF_8))
                : PythonPickleDecoder.toJsonTree(raw);
        } catch (IOException | RuntimeException e) {
            throw new CaseDecodeException(id, "cannot decode metadata record", e);
        }
    }
}
