package io.storylink.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Sorted two-way merge of a link's persisted history with its still
 * unconfirmed local changes.
 * <p>
 * Both inputs must be sorted by key ascending. The output contains every
 * record of both inputs exactly once, in ascending key order. Records with
 * equal keys are the same change seen through both inputs, so only one copy
 * is kept (the persisted one).
 */
public final class ChangeLogMerger {

    private ChangeLogMerger() {
        // utility
    }

    public static List<ChangeRecord> merge(List<ChangeRecord> history, List<ChangeRecord> pending) {
        var out = new ArrayList<ChangeRecord>(history.size() + pending.size());
        int h = 0;
        int p = 0;
        while (h < history.size() && p < pending.size()) {
            ChangeRecord a = history.get(h);
            ChangeRecord b = pending.get(p);
            int cmp = a.key().compareTo(b.key());
            if (cmp < 0) {
                out.add(a);
                h++;
            } else if (cmp > 0) {
                out.add(b);
                p++;
            } else {
                out.add(a);
                h++;
                p++;
            }
        }
        while (h < history.size()) out.add(history.get(h++));
        while (p < pending.size()) out.add(pending.get(p++));
        return out;
    }

    /** Check the ordering precondition of {@link #merge}. */
    public static boolean isSortedByKey(List<ChangeRecord> changes) {
        for (int i = 1; i < changes.size(); i++) {
            if (changes.get(i - 1).key().compareTo(changes.get(i).key()) > 0) {
                return false;
            }
        }
        return true;
    }
}
