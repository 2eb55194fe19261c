package io.mergekit.core;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Total order used when merged sequences are sorted.
 * <p>
 * Values of different kinds order by kind:
 *  Null &lt; Bool &lt; Num &lt; Text &lt; Sequence &lt; Mapping.
 * Inside a kind the natural order applies; sequences compare element-wise,
 * mappings entry-wise in container order (key first, then value), and a shorter
 * container that is a prefix of a longer one sorts first.
 */
public final class ValueOrdering implements Comparator<Value> {

    public static final ValueOrdering NATURAL = new ValueOrdering();

    private ValueOrdering() {
    }

    @Override
    public int compare(Value a, Value b) {
        int byKind = Integer.compare(rank(a), rank(b));
        if (byKind != 0) return byKind;

        if (a instanceof Value.Bool x && b instanceof Value.Bool y) {
            return Boolean.compare(x.value(), y.value());
        }
        if (a instanceof Value.Num x && b instanceof Value.Num y) {
            return x.value().compareTo(y.value());
        }
        if (a instanceof Value.Text x && b instanceof Value.Text y) {
            return x.value().compareTo(y.value());
        }
        if (a instanceof Value.Sequence x && b instanceof Value.Sequence y) {
            return compareLists(x.items(), y.items());
        }
        if (a instanceof Value.Mapping x && b instanceof Value.Mapping y) {
            return compareMappings(x, y);
        }
        // both Null
        return 0;
    }

    private static int rank(Value v) {
        if (v instanceof Value.Null) return 0;
        if (v instanceof Value.Bool) return 1;
        if (v instanceof Value.Num) return 2;
        if (v instanceof Value.Text) return 3;
        if (v instanceof Value.Sequence) return 4;
        return 5;
    }

    private int compareLists(List<Value> a, List<Value> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private int compareMappings(Value.Mapping a, Value.Mapping b) {
        Iterator<Map.Entry<String, Value>> ia = a.entries().entrySet().iterator();
        Iterator<Map.Entry<String, Value>> ib = b.entries().entrySet().iterator();
        while (ia.hasNext() && ib.hasNext()) {
            var ea = ia.next();
            var eb = ib.next();
            int c = ea.getKey().compareTo(eb.getKey());
            if (c != 0) return c;
            c = compare(ea.getValue(), eb.getValue());
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }
}
