package datahandler.server.store.cache;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.hash.Hashing;

import datahandler.model.OutlierMode;

/**
 * Cache key of one retrieval: a SHA-256 over every parameter that changes the result. Measurement and field lists are
 * sorted first so their order in the request does not matter. Every name is length-prefixed, so no name can
 * reproduce a separator.
 */
public final class RetrievalFingerprint {

    private static final char SEPARATOR = '\u001f';

    private final String value;

    private RetrievalFingerprint(String value) {
        this.value = value;
    }

    public static RetrievalFingerprint of(String datasource, String experimentId, Collection<String> measurements, Collection<String> fields,
                    OutlierMode outlierMode, boolean matchSeries, Optional<String> additionalClause, long maxLagMillis, Optional<Integer> limit,
                    Optional<Integer> offset) {
        // @formatter:off
        String canonical = Joiner.on(SEPARATOR).useForNull("").join(
                prefixed(datasource),
                prefixed(experimentId),
                sortedList(measurements),
                sortedList(fields),
                outlierMode.name(),
                matchSeries,
                prefixed(additionalClause.orElse("")),
                maxLagMillis,
                limit.map(String::valueOf).orElse(""),
                offset.map(String::valueOf).orElse(""));
        // @formatter:on
        return new RetrievalFingerprint(Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString());
    }

    private static String sortedList(Collection<String> values) {
        List<String> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        StringBuilder b = new StringBuilder().append(sorted.size()).append('[');
        sorted.forEach(v -> b.append(prefixed(v)));
        return b.append(']').toString();
    }

    private static String prefixed(String value) {
        return value == null ? "-" : value.length() + ":" + value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RetrievalFingerprint)) {
            return false;
        }
        return value.equals(((RetrievalFingerprint) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
