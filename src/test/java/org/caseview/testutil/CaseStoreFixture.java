package org.caseview.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.razorvine.pickle.Pickler;
import org.caseview.codec.JsonArrays;
import org.caseview.metadata.VariableNamespace;
import org.caseview.model.ShapedArray;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds case store files the way a recorder of a given format version lays them out.
 * <p>
 * Values are written as JSON text for format 3 and later and as numpy records
 * before that; metadata maps are JSON or pickles accordingly. Rows are written
 * in call order, so ids follow call order.
 */
public final class CaseStoreFixture {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int version;
    private boolean legacyTablesOmitted;

    private final Map<VariableNamespace, Map<String, String>> absToProm = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> absToMeta = new LinkedHashMap<>();
    private final List<Object[]> driverRows = new ArrayList<>();
    private final List<Object[]> derivativeRows = new ArrayList<>();
    private final List<Object[]> systemRows = new ArrayList<>();
    private final List<Object[]> solverRows = new ArrayList<>();
    private final List<Object[]> problemRows = new ArrayList<>();
    private final List<Object[]> systemMetadataRows = new ArrayList<>();
    private final List<Object[]> solverMetadataRows = new ArrayList<>();
    private Map<String, Object> variableSettings;

    private CaseStoreFixture(int version) {
        this.version = version;
        for (VariableNamespace ns : VariableNamespace.values()) {
            absToProm.put(ns, new LinkedHashMap<>());
        }
    }

    public static CaseStoreFixture version(int version) {
        return new CaseStoreFixture(version);
    }

    /**
     * A small constrained optimization: per driver iteration {@code i} the root
     * system runs once and its solver once. Children are recorded before their
     * parents, so solver, system and driver cases get counters {@code 3i+1},
     * {@code 3i+2} and {@code 3i+3}. A final problem case follows the last iteration.
     * <p>
     * At iteration {@code i}, {@code z = [5 - i/4, 2 + i/2]} and {@code obj = 28 - i}.
     */
    public static CaseStoreFixture optimizationRun(int version, int iterations) {
        CaseStoreFixture fixture = version(version)
            .output("pz.z", "z", new int[] {2}, "desvar")
            .output("px.x", "x", new int[] {1}, "desvar")
            .output("obj_cmp.obj", "obj", new int[] {1}, "objective")
            .output("con_cmp1.con1", "con1", new int[] {1}, "constraint")
            .output("d1.y1", "y1", new int[] {1})
            .input("obj_cmp.z", "z", new int[] {2})
            .input("obj_cmp.x", "x", new int[] {1})
            .input("d1.y2", "y2", new int[] {1});
        for (int i = 0; i < iterations; i++) {
            String driver = "rank0:SLSQP|" + i;
            String system = driver + "|root._solve_nonlinear|" + i;
            ShapedArray z = zAt(i);
            ShapedArray obj = ShapedArray.vector(28.0 - i);
            fixture.solver(system + "|NLRunOnce|0", 3L * i + 1, 1e-3, 1e-4,
                null,
                named("d1.y1", ShapedArray.vector(i + 0.5)),
                named("d1.y1", ShapedArray.vector(0.0)));
            fixture.system(system, 3L * i + 2,
                named("obj_cmp.z", z, "obj_cmp.x", ShapedArray.vector(1.0), "d1.y2", ShapedArray.vector(3.5)),
                named("pz.z", z, "d1.y1", ShapedArray.vector(i + 0.5), "obj_cmp.obj", obj),
                named("d1.y1", ShapedArray.vector(0.0)));
            fixture.driver(driver, 3L * i + 3,
                named("obj_cmp.z", z),
                named("pz.z", z, "px.x", ShapedArray.vector(1.0), "obj_cmp.obj", obj,
                    "con_cmp1.con1", ShapedArray.vector(-0.5 * i)));
            fixture.derivatives(driver, 3L * i + 3,
                named("obj,z", ShapedArray.of(new double[] {2.0 * i, 1.0}, 1, 2),
                    "obj,x", ShapedArray.of(new double[] {0.5}, 1, 1)));
        }
        return fixture.problem("final", 3L * iterations + 1,
            named("pz.z", zAt(Math.max(iterations - 1, 0)), "obj_cmp.obj", ShapedArray.vector(3.18)));
    }

    public static ShapedArray zAt(int iteration) {
        return ShapedArray.vector(5.0 - iteration * 0.25, 2.0 + iteration * 0.5);
    }

    /**
     * Leaves out the derivative and problem tables, as the earliest format-1 recorders did.
     */
    public CaseStoreFixture withoutLegacyOptionalTables() {
        this.legacyTablesOmitted = true;
        return this;
    }

    public CaseStoreFixture output(String absolute, String promoted, int[] shape, String... types) {
        return variable(VariableNamespace.OUTPUT, absolute, promoted, shape, types);
    }

    public CaseStoreFixture input(String absolute, String promoted, int[] shape) {
        return variable(VariableNamespace.INPUT, absolute, promoted, shape);
    }

    private CaseStoreFixture variable(VariableNamespace ns, String absolute, String promoted, int[] shape,
                                      String... types) {
        absToProm.get(ns).put(absolute, promoted);
        Map<String, Object> meta = new LinkedHashMap<>();
        List<Object> shapeList = new ArrayList<>();
        for (int dim : shape) {
            shapeList.add(dim);
        }
        meta.put("shape", shapeList);
        meta.put("size", ShapedArray.sizeOf(shape));
        meta.put("units", null);
        List<Object> typeList = new ArrayList<>(List.of(ns.key()));
        typeList.addAll(List.of(types));
        meta.put("type", typeList);
        if (ns == VariableNamespace.OUTPUT) {
            meta.put("explicit", true);
            meta.put("lower", null);
            meta.put("upper", null);
            meta.put("ref", 1.0);
            meta.put("ref0", 0.0);
            meta.put("res_ref", 1.0);
        }
        absToMeta.put(absolute, meta);
        return this;
    }

    /**
     * Sets an extra metadata entry of an already declared variable.
     */
    public CaseStoreFixture meta(String absolute, String key, Object value) {
        absToMeta.get(absolute).put(key, value);
        return this;
    }

    public CaseStoreFixture variableSettings(Map<String, Object> settings) {
        this.variableSettings = settings;
        return this;
    }

    public CaseStoreFixture driver(String coordinate, long counter,
                                   Map<String, ShapedArray> inputs, Map<String, ShapedArray> outputs) {
        driverRows.add(new Object[] {counter, coordinate, counter * 0.5, 1, "", values(inputs), values(outputs)});
        return this;
    }

    public CaseStoreFixture derivatives(String coordinate, long counter, Map<String, ShapedArray> blocks) {
        derivativeRows.add(new Object[] {counter, coordinate, counter * 0.5, 1, "", NpyTestWriter.record(blocks)});
        return this;
    }

    public CaseStoreFixture system(String coordinate, long counter, Map<String, ShapedArray> inputs,
                                   Map<String, ShapedArray> outputs, Map<String, ShapedArray> residuals) {
        systemRows.add(new Object[] {counter, coordinate, counter * 0.5, 1, "",
            values(inputs), values(outputs), values(residuals)});
        return this;
    }

    public CaseStoreFixture solver(String coordinate, long counter, double absError, double relError,
                                   Map<String, ShapedArray> inputs, Map<String, ShapedArray> outputs,
                                   Map<String, ShapedArray> residuals) {
        solverRows.add(new Object[] {counter, coordinate, counter * 0.5, 1, "", absError, relError,
            values(inputs), values(outputs), values(residuals)});
        return this;
    }

    public CaseStoreFixture problem(String name, long counter, Map<String, ShapedArray> outputs) {
        problemRows.add(new Object[] {counter, name, counter * 0.5, 1, "", values(outputs)});
        return this;
    }

    /**
     * Adds a problem row whose outputs column holds raw bytes, for corrupt-value tests.
     */
    public CaseStoreFixture rawProblem(String name, long counter, byte[] outputs) {
        problemRows.add(new Object[] {counter, name, counter * 0.5, 1, "", outputs});
        return this;
    }

    public CaseStoreFixture systemMetadata(String id, Map<String, Object> scalingFactors,
                                           Map<String, Object> componentOptions) {
        systemMetadataRows.add(new Object[] {id, pickle(scalingFactors), pickle(componentOptions)});
        return this;
    }

    public CaseStoreFixture solverMetadata(String id, Map<String, Object> options, String solverClass) {
        solverMetadataRows.add(new Object[] {id, pickle(options), solverClass});
        return this;
    }

    /**
     * Writes the store.
     *
     * @return {@code file}
     */
    public Path writeTo(Path file) throws SQLException {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath())) {
            String blob = version >= 3 ? "TEXT" : "BLOB";
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("CREATE TABLE metadata(format_version INT, abs2prom " + blob + ", prom2abs " + blob
                    + ", abs2meta " + blob + (version >= 4 ? ", var_settings TEXT" : "") + ")");
                stmt.execute("CREATE TABLE driver_iterations(id INTEGER PRIMARY KEY, counter INT, "
                    + "iteration_coordinate TEXT, timestamp REAL, success INT, msg TEXT, inputs " + blob
                    + ", outputs " + blob + ")");
                stmt.execute("CREATE TABLE system_iterations(id INTEGER PRIMARY KEY, counter INT, "
                    + "iteration_coordinate TEXT, timestamp REAL, success INT, msg TEXT, inputs " + blob
                    + ", outputs " + blob + ", residuals " + blob + ")");
                stmt.execute("CREATE TABLE solver_iterations(id INTEGER PRIMARY KEY, counter INT, "
                    + "iteration_coordinate TEXT, timestamp REAL, success INT, msg TEXT, abs_err REAL, "
                    + "rel_err REAL, solver_inputs " + blob + ", solver_output " + blob
                    + ", solver_residuals " + blob + ")");
                if (!legacyTablesOmitted) {
                    stmt.execute("CREATE TABLE driver_derivatives(id INTEGER PRIMARY KEY, counter INT, "
                        + "iteration_coordinate TEXT, timestamp REAL, success INT, msg TEXT, derivatives BLOB)");
                    stmt.execute("CREATE TABLE problem_cases(id INTEGER PRIMARY KEY, counter INT, "
                        + "case_name TEXT, timestamp REAL, success INT, msg TEXT, outputs " + blob + ")");
                }
                stmt.execute("CREATE TABLE driver_metadata(id TEXT PRIMARY KEY, model_viewer_data " + blob + ")");
                stmt.execute("CREATE TABLE system_metadata(id TEXT PRIMARY KEY, scaling_factors BLOB, "
                    + "component_metadata BLOB)");
                stmt.execute("CREATE TABLE solver_metadata(id TEXT PRIMARY KEY, solver_options BLOB, "
                    + "solver_class TEXT)");
            }

            writeMetadata(conn);
            insert(conn, "INSERT INTO driver_iterations(counter, iteration_coordinate, timestamp, success, msg, "
                + "inputs, outputs) VALUES (?, ?, ?, ?, ?, ?, ?)", driverRows);
            insert(conn, "INSERT INTO system_iterations(counter, iteration_coordinate, timestamp, success, msg, "
                + "inputs, outputs, residuals) VALUES (?, ?, ?, ?, ?, ?, ?, ?)", systemRows);
            insert(conn, "INSERT INTO solver_iterations(counter, iteration_coordinate, timestamp, success, msg, "
                + "abs_err, rel_err, solver_inputs, solver_output, solver_residuals) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)", solverRows);
            if (!legacyTablesOmitted) {
                insert(conn, "INSERT INTO driver_derivatives(counter, iteration_coordinate, timestamp, success, "
                    + "msg, derivatives) VALUES (?, ?, ?, ?, ?, ?)", derivativeRows);
                insert(conn, "INSERT INTO problem_cases(counter, case_name, timestamp, success, msg, outputs) "
                    + "VALUES (?, ?, ?, ?, ?, ?)", problemRows);
            }
            insert(conn, "INSERT INTO system_metadata(id, scaling_factors, component_metadata) VALUES (?, ?, ?)",
                systemMetadataRows);
            insert(conn, "INSERT INTO solver_metadata(id, solver_options, solver_class) VALUES (?, ?, ?)",
                solverMetadataRows);
        }
        return file;
    }

    private void writeMetadata(Connection conn) throws SQLException {
        Map<String, Object> abs2prom = new LinkedHashMap<>();
        Map<String, Object> prom2abs = new LinkedHashMap<>();
        for (VariableNamespace ns : VariableNamespace.values()) {
            abs2prom.put(ns.key(), absToProm.get(ns));
            Map<String, List<String>> reverse = new LinkedHashMap<>();
            absToProm.get(ns).forEach((abs, prom) -> reverse.computeIfAbsent(prom, p -> new ArrayList<>()).add(abs));
            prom2abs.put(ns.key(), reverse);
        }

        String sql = version >= 4
            ? "INSERT INTO metadata(format_version, abs2prom, prom2abs, abs2meta, var_settings) VALUES (?, ?, ?, ?, ?)"
            : "INSERT INTO metadata(format_version, abs2prom, prom2abs, abs2meta) VALUES (?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setInt(1, version);
            stmt.setObject(2, encodeMap(abs2prom));
            stmt.setObject(3, encodeMap(prom2abs));
            stmt.setObject(4, encodeMap(new LinkedHashMap<>(absToMeta)));
            if (version >= 4) {
                stmt.setString(5, json(variableSettings == null ? Map.of() : variableSettings));
            }
            stmt.executeUpdate();
        }
    }

    private Object encodeMap(Map<String, Object> map) {
        return version >= 3 ? json(map) : pickle(map);
    }

    private Object values(Map<String, ShapedArray> values) {
        if (values == null) {
            return null;
        }
        if (version >= 3) {
            ObjectNode node = MAPPER.createObjectNode();
            values.forEach((name, array) -> node.set(name, JsonArrays.toJson(array)));
            return node.toString();
        }
        return NpyTestWriter.record(values);
    }

    private static void insert(Connection conn, String sql, List<Object[]> rows) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (Object[] row : rows) {
                for (int i = 0; i < row.length; i++) {
                    stmt.setObject(i + 1, row[i]);
                }
                stmt.executeUpdate();
            }
        }
    }

    private static String json(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    static byte[] pickle(Object value) {
        try {
            return new Pickler().dumps(value);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Map<String, ShapedArray> named(Object... namesAndArrays) {
        Map<String, ShapedArray> result = new LinkedHashMap<>();
        for (int i = 0; i < namesAndArrays.length; i += 2) {
            result.put((String) namesAndArrays[i], (ShapedArray) namesAndArrays[i + 1]);
        }
        return result;
    }
}
