package org.caseview.coordinate;

import org.caseview.model.CaseTree;
import org.caseview.model.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Infers parent/child relations between recorded cases from their coordinates.
 * <p>
 * A case is a direct child of a parent when the parent's coordinate is a
 * delimiter-bounded prefix of the child's AND the child's segment count is the
 * next tracked length after the parent's. Tracked lengths are the distinct
 * segment counts of all driver, solver and system coordinates plus
 * {@link IterationCoordinate#ROOT_LENGTH}. Children are discovered in category
 * order driver, solver, system and are returned in execution (counter) order.
 * <p>
 * The hierarchy is a snapshot of the keys loaded at open.
 */
public final class CoordinateHierarchy {

    /** Expansion depth yielding only the requested items. */
    public static final int ITEMS_ONLY = 0;
    /** Expansion depth yielding the items and their direct children. */
    public static final int DIRECT_CHILDREN = 1;
    /** Expansion depth yielding the items and all their descendants. */
    public static final int ALL_DESCENDANTS = Integer.MAX_VALUE;

    private static final Category[] DISCOVERY_ORDER = {Category.DRIVER, Category.SOLVER, Category.SYSTEM};
    private static final Comparator<CaseKey> EXECUTION_ORDER = Comparator.comparingLong(CaseKey::counter);

    private final Map<Category, List<CaseKey>> keys = new EnumMap<>(Category.class);
    private final Map<Category, Map<Integer, List<CaseKey>>> keysByLength = new EnumMap<>(Category.class);
    private final Map<String, CaseKey> byCoordinate = new HashMap<>();
    private final int[] coordLengths;

    /**
     * @param driverKeys driver cases in store order
     * @param solverKeys solver cases in store order
     * @param systemKeys system cases in store order
     */
    public CoordinateHierarchy(List<CaseKey> driverKeys, List<CaseKey> solverKeys, List<CaseKey> systemKeys) {
        keys.put(Category.DRIVER, List.copyOf(driverKeys));
        keys.put(Category.SOLVER, List.copyOf(solverKeys));
        keys.put(Category.SYSTEM, List.copyOf(systemKeys));

        TreeSet<Integer> lengths = new TreeSet<>();
        lengths.add(IterationCoordinate.ROOT_LENGTH);
        for (Category category : DISCOVERY_ORDER) {
            Map<Integer, List<CaseKey>> index = new HashMap<>();
            for (CaseKey key : keys.get(category)) {
                lengths.add(key.segmentCount());
                index.computeIfAbsent(key.segmentCount(), n -> new ArrayList<>()).add(key);
                byCoordinate.putIfAbsent(key.id(), key);
            }
            keysByLength.put(category, index);
        }
        this.coordLengths = lengths.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * @return the sorted distinct tracked segment counts, including the root length.
     */
    public int[] coordLengths() {
        return coordLengths.clone();
    }

    /**
     * @return the keys of a category in store order.
     */
    public List<CaseKey> keys(Category category) {
        return keys.getOrDefault(category, List.of());
    }

    /**
     * Looks up a driver, solver or system case by coordinate.
     */
    public Optional<CaseKey> find(String coordinate) {
        return Optional.ofNullable(byCoordinate.get(coordinate));
    }

    /**
     * @return the segment count direct children of {@code parent} must have, or -1 if none can exist.
     */
    public int expectedChildLength(IterationCoordinate parent) {
        int length = parent.segmentCount();
        for (int i = 0; i < coordLengths.length - 1; i++) {
            if (coordLengths[i] == length) {
                return coordLengths[i + 1];
            }
        }
        return -1;
    }

    /**
     * Finds the direct children of a coordinate.
     * <p>
     * The root's children are all driver cases when any exist; otherwise the
     * solver cases at the shallowest non-root length. The root never has system
     * children. A store holding both driver cases and driver-less solver cases
     * resolves to the driver branch.
     *
     * @param parent a coordinate, or {@link IterationCoordinate#ROOT}
     * @return the children in execution order
     */
    public List<CaseKey> findChildren(IterationCoordinate parent) {
        List<CaseKey> children = new ArrayList<>();
        if (parent.isRoot()) {
            if (!keys(Category.DRIVER).isEmpty()) {
                children.addAll(keys(Category.DRIVER));
            } else if (coordLengths.length > 1) {
                children.addAll(keysByLength.get(Category.SOLVER).getOrDefault(coordLengths[1], List.of()));
            }
        } else {
            int expected = expectedChildLength(parent);
            if (expected < 0) {
                return children;
            }
            for (Category category : DISCOVERY_ORDER) {
                for (CaseKey candidate : keysByLength.get(category).getOrDefault(expected, List.of())) {
                    if (parent.isPrefixOf(candidate.coordinate())) {
                        children.add(candidate);
                    }
                }
            }
        }
        children.sort(EXECUTION_ORDER);
        return children;
    }

    /**
     * Finds all descendants of a coordinate, depth first with each node before its own descendants.
     */
    public List<CaseKey> findDescendants(IterationCoordinate parent) {
        List<CaseKey> result = new ArrayList<>();
        collect(parent, ALL_DESCENDANTS, result);
        return result;
    }

    private void collect(IterationCoordinate parent, int depth, List<CaseKey> out) {
        if (depth <= 0) {
            return;
        }
        for (CaseKey child : findChildren(parent)) {
            out.add(child);
            collect(child.coordinate(), depth == ALL_DESCENDANTS ? depth : depth - 1, out);
        }
    }

    /**
     * Expands items into a flat sequence.
     * <p>
     * Each item contributes a block made of the item and its descendants up to
     * {@code depth}, ordered by counter. Blocks follow the order of {@code items}.
     */
    public List<CaseKey> flatten(List<CaseKey> items, int depth) {
        List<CaseKey> result = new ArrayList<>();
        for (CaseKey item : items) {
            List<CaseKey> block = new ArrayList<>();
            block.add(item);
            collect(item.coordinate(), depth, block);
            block.sort(EXECUTION_ORDER);
            result.addAll(block);
        }
        return result;
    }

    /**
     * Expands items into a nested mapping, each node holding its children down to {@code depth}.
     *
     * @param items  the top-level items
     * @param depth  how many levels of children to attach
     * @param mapper produces each node's value; exceptions propagate and abort the whole tree
     * @param <V>    the node value type
     */
    public <V> Map<String, CaseTree<V>> tree(List<CaseKey> items, int depth, Function<CaseKey, V> mapper) {
        Map<String, CaseTree<V>> result = new LinkedHashMap<>();
        for (CaseKey item : items) {
            result.put(item.id(), node(item, depth, mapper));
        }
        return Collections.unmodifiableMap(result);
    }

    private <V> CaseTree<V> node(CaseKey key, int depth, Function<CaseKey, V> mapper) {
        V value = mapper.apply(key);
        if (depth <= 0) {
            return new CaseTree<>(value, Map.of());
        }
        int next = depth == ALL_DESCENDANTS ? depth : depth - 1;
        Map<String, CaseTree<V>> children = new LinkedHashMap<>();
        for (CaseKey child : findChildren(key.coordinate())) {
            children.put(child.id(), node(child, next, mapper));
        }
        return new CaseTree<>(value, Collections.unmodifiableMap(children));
    }
}
