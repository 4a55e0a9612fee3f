package com.fuelsight.ingestion.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SyncStatusTest {

    @Test
    @DisplayName("status follows the succeeded and failed counts")
    void fromCounts() {
        assertThat(SyncStatus.of(3, 0)).isEqualTo(SyncStatus.SUCCESS);
        assertThat(SyncStatus.of(2, 1)).isEqualTo(SyncStatus.PARTIAL);
        assertThat(SyncStatus.of(0, 4)).isEqualTo(SyncStatus.ERROR);
        assertThat(SyncStatus.PARTIAL.code()).isEqualTo("partial");
    }

}
