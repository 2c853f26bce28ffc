package datahandler.server.store.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Test;

import datahandler.model.OutlierMode;

public class RetrievalFingerprintTest {

    private static RetrievalFingerprint fingerprint(List<String> measurements, List<String> fields) {
        return RetrievalFingerprint.of("uma", "42", measurements, fields, OutlierMode.NONE, false, Optional.empty(), 1000, Optional.empty(),
                        Optional.empty());
    }

    @Test
    public void testOrderIndependence() {
        RetrievalFingerprint a = fingerprint(Arrays.asList("cpu", "Throughput_Measures", "mem"), Arrays.asList("x", "y"));
        RetrievalFingerprint b = fingerprint(Arrays.asList("mem", "cpu", "Throughput_Measures"), Arrays.asList("y", "x"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(64, a.getValue().length());
    }

    @Test
    public void testEveryParameterCounts() {
        RetrievalFingerprint base = fingerprint(Arrays.asList("cpu"), Collections.emptyList());
        List<String> cpu = Arrays.asList("cpu");
        List<String> none = Collections.emptyList();
        assertNotEquals(base, RetrievalFingerprint.of("uma2", "42", cpu, none, OutlierMode.NONE, false, Optional.empty(), 1000, Optional.empty(),
                        Optional.empty()));
        assertNotEquals(base, RetrievalFingerprint.of("uma", "43", cpu, none, OutlierMode.NONE, false, Optional.empty(), 1000, Optional.empty(),
                        Optional.empty()));
        assertNotEquals(base, RetrievalFingerprint.of("uma", "42", cpu, none, OutlierMode.MAD, false, Optional.empty(), 1000, Optional.empty(),
                        Optional.empty()));
        assertNotEquals(base, RetrievalFingerprint.of("uma", "42", cpu, none, OutlierMode.NONE, true, Optional.empty(), 1000, Optional.empty(),
                        Optional.empty()));
        assertNotEquals(base, RetrievalFingerprint.of("uma", "42", cpu, none, OutlierMode.NONE, false, Optional.of("x"), 1000, Optional.empty(),
                        Optional.empty()));
        assertNotEquals(base, RetrievalFingerprint.of("uma", "42", cpu, none, OutlierMode.NONE, false, Optional.empty(), 500, Optional.empty(),
                        Optional.empty()));
        assertNotEquals(base, RetrievalFingerprint.of("uma", "42", cpu, none, OutlierMode.NONE, false, Optional.empty(), 1000, Optional.of(10),
                        Optional.empty()));
        assertNotEquals(base, RetrievalFingerprint.of("uma", "42", cpu, none, OutlierMode.NONE, false, Optional.empty(), 1000, Optional.of(10),
                        Optional.of(10)));
    }

    @Test
    public void testListBoundaries() {
        // the same characters split differently between the lists are different retrievals
        assertNotEquals(fingerprint(Arrays.asList("ab"), Arrays.asList("c")), fingerprint(Arrays.asList("a"), Arrays.asList("bc")));
        // a name holding the separator is not two names
        assertNotEquals(fingerprint(Arrays.asList("a", "b"), Collections.emptyList()),
                        fingerprint(Arrays.asList("a\u001fb"), Collections.emptyList()));
        assertNotEquals(fingerprint(Arrays.asList("a", "b"), Collections.emptyList()),
                        fingerprint(Arrays.asList("a"), Arrays.asList("b")));
    }
}
