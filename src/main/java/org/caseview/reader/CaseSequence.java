package org.caseview.reader;

import org.caseview.coordinate.CaseKey;
import org.caseview.model.Case;

import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Lazy, restartable sequence of cases over a fixed key list. Each case is
 * materialised when the iterator reaches it.
 */
final class CaseSequence implements Iterable<Case> {

    private final List<CaseKey> keys;
    private final Function<CaseKey, Case> loader;

    CaseSequence(List<CaseKey> keys, Function<CaseKey, Case> loader) {
        this.keys = List.copyOf(keys);
        this.loader = loader;
    }

    @Override
    public Iterator<Case> iterator() {
        Iterator<CaseKey> source = keys.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public Case next() {
                return loader.apply(source.next());
            }
        };
    }
}
