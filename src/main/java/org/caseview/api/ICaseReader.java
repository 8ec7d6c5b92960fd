package org.caseview.api;

import org.caseview.codec.FormatVersion;
import org.caseview.metadata.MetadataCatalog;
import org.caseview.model.Case;
import org.caseview.model.CaseTree;
import org.caseview.model.SourceVariables;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Read access to one case store.
 * <p>
 * A source is {@code null} or {@code ""} for the implicit root, {@code driver},
 * {@code problem}, a system or solver source name as listed by {@link #listSources()},
 * or any stored iteration coordinate. Coordinate lists are a snapshot taken at open.
 * <p>
 * Holds a dedicated connection; use with try-with-resources.
 */
public interface ICaseReader extends AutoCloseable {

    /**
     * @return the format version recorded in the store.
     */
    FormatVersion formatVersion();

    /**
     * @return the variable naming and metadata tables.
     */
    MetadataCatalog catalog();

    /**
     * Lists the sources with recorded cases: {@code driver}, {@code problem}, then
     * one name per recording system and solver location.
     */
    List<String> listSources();

    /**
     * Lists the coordinates (or case names) of a source without its descendants.
     *
     * @throws SourceNotFoundException if the source matches nothing in the store
     */
    List<String> listCases(String source) throws SourceNotFoundException;

    /**
     * Lists the coordinates (or case names) of a source in execution order.
     *
     * @param recurse include all descendants of each item; for an explicit
     *                coordinate, {@code false} still includes its direct children
     * @throws SourceNotFoundException if the source matches nothing in the store
     */
    List<String> listCases(String source, boolean recurse) throws SourceNotFoundException;

    /**
     * Lists a source as a nested mapping of coordinates.
     *
     * @throws SourceNotFoundException if the source matches nothing in the store
     */
    Map<String, CaseTree<String>> listCaseTree(String source, boolean recurse) throws SourceNotFoundException;

    /**
     * Gets a case using the configured cache policy.
     *
     * @param id an iteration coordinate or a problem case name
     * @throws SQLException if the query fails
     * @throws CaseNotFoundException if no category records this id
     */
    Case getCase(String id) throws SQLException, CaseNotFoundException;

    /**
     * Gets a case.
     *
     * @param id    an iteration coordinate or a problem case name
     * @param cache {@code true} to return (and keep) the cached instance
     * @throws SQLException if the query fails
     * @throws CaseNotFoundException if no category records this id
     */
    Case getCase(String id, boolean cache) throws SQLException, CaseNotFoundException;

    /**
     * Returns the cases of a source as a lazy, restartable sequence in execution order.
     * Decode failures surface when the failing case is reached.
     *
     * @throws SourceNotFoundException if the source matches nothing in the store
     */
    Iterable<Case> getCases(String source, boolean recurse) throws SourceNotFoundException;

    /**
     * Returns the cases of a source as an eagerly built nested mapping. A failure
     * on any node fails the whole call.
     *
     * @throws SourceNotFoundException if the source matches nothing in the store
     */
    Map<String, CaseTree<Case>> getCaseTree(String source, boolean recurse) throws SourceNotFoundException;

    /**
     * Returns every problem case with its descendants.
     */
    Map<String, CaseTree<Case>> getCaseTree() throws SourceNotFoundException;

    /**
     * Lists the input and output names recorded by the first case of a source.
     *
     * @throws SQLException if the query fails
     * @throws SourceNotFoundException if the source matches nothing in the store
     */
    SourceVariables listSourceVars(String source) throws SQLException, SourceNotFoundException;

    /**
     * Materialises every case of every category into the caches.
     */
    void loadCases();

    /**
     * Closes the underlying connection.
     */
    @Override
    void close();
}
