package com.ads.signaldetection.ingestion;

import com.ads.signaldetection.model.MetricSample;
import com.ads.signaldetection.model.OverflowRecord;
import com.ads.signaldetection.testutil.TestFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.ads.signaldetection.testutil.TestFactory.BASE;
import static com.ads.signaldetection.testutil.TestFactory.sample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OverflowStoreTest {

    @TempDir
    Path tempDir;

    @Test
    public void testRecordsComeBackOldestFirst() throws Exception {
        OverflowStore store = TestFactory.overflowStore(tempDir, 100);
        List<MetricSample> first = List.of(sample("a", "cpu", 1, BASE), sample("a", "cpu", 2, BASE.plusSeconds(1)));
        List<MetricSample> second = List.of(sample("b", "cpu", 3, BASE));
        store.append("a", first);
        store.append("b", second);

        OverflowRecord oldest = store.oldest().orElseThrow();
        assertThat(oldest.sourceId()).isEqualTo("a");
        assertThat(oldest.samples()).isEqualTo(first);
        assertThat(store.recordCount()).isEqualTo(2);
        assertThat(store.sampleCount()).isEqualTo(3);

        store.delete(oldest);
        assertThat(store.oldest().orElseThrow().samples()).isEqualTo(second);
        store.close();
    }

    @Test
    public void testPendingSurvivesReopen() throws Exception {
        OverflowStore store = TestFactory.overflowStore(tempDir, 100);
        store.append("a", List.of(sample("a", "cpu", 1, BASE), sample("a", "cpu", 2, BASE)));
        store.append("b", List.of(sample("b", "cpu", 3, BASE)));
        store.close();

        OverflowStore reopened = TestFactory.overflowStore(tempDir, 100);
        assertThat(reopened.pendingBySource()).containsEntry("a", 2).containsEntry("b", 1);
        assertThat(reopened.sampleCount()).isEqualTo(3);
        reopened.close();
    }

    @Test
    public void testQuotaRejectsFurtherRecords() throws Exception {
        OverflowStore store = TestFactory.overflowStore(tempDir, 1);
        store.append("a", List.of(sample("a", "cpu", 1, BASE)));

        assertThatThrownBy(() -> store.append("a", List.of(sample("a", "cpu", 2, BASE))))
                .isInstanceOf(SpilloverFailureException.class)
                .hasMessageContaining("quota");
        store.close();
    }
}
