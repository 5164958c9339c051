package factstore.core.triple;

import java.util.HashMap;
import java.util.Map;

/**
 * Caller-owned workspace for {@link TripleMatcher}.
 * Records the values variables took during one matching attempt so repeated
 * variables in a pattern are checked for equality. Reusing one instance across
 * many facts avoids an allocation per fact; the matcher clears it on entry.
 * Not thread-safe: use one instance per thread.
 */
public final class MatchScratch {

    private final Map<String, String> values = new HashMap<>(4);

    public void clear() {
        values.clear();
    }

    public int size() {
        return values.size();
    }

    String valueOf(String variable) {
        return values.get(variable);
    }

    void record(String variable, String value) {
        values.put(variable, value);
    }
}
