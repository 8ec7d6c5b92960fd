package org.caseview.store;

import org.caseview.api.CaseNotFoundException;
import org.caseview.api.CaseStoreAccessException;
import org.caseview.codec.FormatVersion;
import org.caseview.codec.ValueDecoder;
import org.caseview.coordinate.CaseKey;
import org.caseview.junit.extensions.logging.ExpectLog;
import org.caseview.junit.extensions.logging.LogLevel;
import org.caseview.junit.extensions.logging.LogWatchExtension;
import org.caseview.metadata.MetadataCatalog;
import org.caseview.model.Case;
import org.caseview.model.Category;
import org.caseview.testutil.CaseStoreFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CategoryStoreTest {

    @TempDir
    Path tempDir;

    private Connection connection;

    @AfterEach
    void tearDown() throws Exception {
        if (connection != null) {
            connection.close();
        }
    }

    private ValueDecoder decoder(CaseStoreFixture fixture, int version) throws Exception {
        final Path file = fixture.writeTo(tempDir.resolve("cases.sql"));
        connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
        final FormatVersion formatVersion = FormatVersion.of(version);
        return new ValueDecoder(formatVersion, MetadataCatalog.build(connection, formatVersion));
    }

    @Test
    void loadKeys_shouldKeepStoreOrderAndCounters() throws Exception {
        final ValueDecoder decoder = decoder(CaseStoreFixture.optimizationRun(3, 2), 3);
        final SystemCaseStore store = new SystemCaseStore(connection, decoder);
        store.loadKeys();

        assertTrue(store.isPresent());
        assertEquals(List.of("rank0:SLSQP|0|root._solve_nonlinear|0", "rank0:SLSQP|1|root._solve_nonlinear|1"),
            store.ids());
        assertThat(store.keys()).extracting(CaseKey::counter).containsExactly(2L, 5L);
        assertTrue(store.contains("rank0:SLSQP|1|root._solve_nonlinear|1"));
        assertFalse(store.contains("rank0:SLSQP|1"));
    }

    @Test
    void get_cachedAndUncached_shouldDifferInIdentityOnly() throws Exception {
        final ValueDecoder decoder = decoder(CaseStoreFixture.optimizationRun(3, 2), 3);
        final ProblemCaseStore store = new ProblemCaseStore(connection, decoder);
        store.loadKeys();

        final Case cached = store.get("final", true);

        assertSame(cached, store.get("final", true));
        assertNotSame(cached, store.get("final", false));
        assertEquals(cached, store.get("final", false));
        assertEquals(1, store.cachedCount());
        store.clearCache();
        assertEquals(0, store.cachedCount());
    }

    @Test
    void get_missingKey_shouldNameCategory() throws Exception {
        final ValueDecoder decoder = decoder(CaseStoreFixture.optimizationRun(3, 1), 3);
        final SolverCaseStore store = new SolverCaseStore(connection, decoder);
        store.loadKeys();

        assertThatThrownBy(() -> store.get("rank0:SLSQP|9", false))
            .isInstanceOf(CaseNotFoundException.class)
            .hasMessage("No solver case found for 'rank0:SLSQP|9'");
    }

    @Test
    void all_shouldDecodeEveryRowAndPopulateCacheWhenAsked() throws Exception {
        final ValueDecoder decoder = decoder(CaseStoreFixture.optimizationRun(4, 3), 4);
        final DriverCaseStore store =
            new DriverCaseStore(connection, decoder, new DriverDerivativeCaseStore(connection, decoder));
        store.loadKeys();

        assertThat(store.all(false)).extracting(Case::counter).containsExactly(3L, 6L, 9L);
        assertEquals(0, store.cachedCount());
        store.loadCases();
        assertEquals(3, store.cachedCount());
        final Case first = store.all(true).iterator().next();
        assertSame(first, store.get("rank0:SLSQP|0", true));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Case store has no problem_cases table; treating it as empty")
    void loadKeys_missingOptionalTableInEarlyStore_shouldBeEmpty() throws Exception {
        final ValueDecoder decoder = decoder(CaseStoreFixture.optimizationRun(1, 1).withoutLegacyOptionalTables(), 1);
        final ProblemCaseStore store = new ProblemCaseStore(connection, decoder);
        store.loadKeys();

        assertFalse(store.isPresent());
        assertThat(store.keys()).isEmpty();
        assertThat(store.all(false)).isEmpty();
        assertThatThrownBy(() -> store.get("final", false)).isInstanceOf(CaseNotFoundException.class);
    }

    @Test
    void all_closedConnection_shouldRaiseAccessError() throws Exception {
        final ValueDecoder decoder = decoder(CaseStoreFixture.optimizationRun(3, 1), 3);
        final SystemCaseStore store = new SystemCaseStore(connection, decoder);
        store.loadKeys();
        connection.close();

        assertThatThrownBy(() -> store.all(false).iterator())
            .isInstanceOf(CaseStoreAccessException.class)
            .hasMessageContaining(Category.SYSTEM.table());
    }
}
