package com.platform.drcontrol.validation;

import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.connectors.RegionalDataStore;
import com.platform.drcontrol.connectors.dynamodb.ItemKey;
import com.platform.drcontrol.error.BackendUnavailableException;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.RegionPair;
import com.platform.drcontrol.model.TableIdentifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SentinelReplicationProber")
class SentinelReplicationProberTest {

    private static final Region PRIMARY = Region.of("us-east-1");
    private static final Region SECONDARY = Region.of("us-west-2");
    private static final RegionPair REGIONS = new RegionPair(PRIMARY, SECONDARY);
    private static final TableIdentifier SENTINEL_TABLE = TableIdentifier.of("dr-sentinel-table");
    private static final Instant T0 = Instant.parse("2026-10-18T12:00:00Z");

    @Mock
    private RegionalDataStore dataStore;

    @Mock
    private Clock clock;

    private SentinelReplicationProber prober;

    @BeforeEach
    void setUp() {
        DrControlProperties properties = new DrControlProperties();
        properties.getSentinel().setPollInterval(Duration.ofMillis(1));
        properties.getSentinel().setMaxAttempts(4);
        prober = new SentinelReplicationProber(dataStore, properties, clock);
    }

    @Test
    @DisplayName("Should report whole seconds from write to first visibility and delete the marker")
    void shouldMeasureLag() {
        // Given: id generation and write at T0, visibility observed 3.7s later
        when(clock.instant()).thenReturn(T0, T0, T0.plusMillis(3700));
        when(dataStore.itemExists(eq(SECONDARY), eq(SENTINEL_TABLE), any())).thenReturn(false, true);

        // When
        Optional<Long> lag = prober.measureLag(REGIONS);

        // Then
        assertThat(lag).contains(3L);
        verify(dataStore, times(2)).itemExists(eq(SECONDARY), eq(SENTINEL_TABLE), any());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> written = ArgumentCaptor.forClass(Map.class);
        verify(dataStore).putItem(eq(PRIMARY), eq(SENTINEL_TABLE), written.capture());
        assertThat(written.getValue())
            .containsEntry("source", "us-east-1")
            .containsEntry("timestamp", T0.toString());
        assertThat(written.getValue().get("id")).startsWith("lag-test-");

        ArgumentCaptor<ItemKey> deleted = ArgumentCaptor.forClass(ItemKey.class);
        verify(dataStore).deleteItem(eq(PRIMARY), eq(SENTINEL_TABLE), deleted.capture());
        assertThat(deleted.getValue().value()).isEqualTo(written.getValue().get("id"));
    }

    @Test
    @DisplayName("Should return no signal when the marker never appears")
    void shouldReturnEmptyWhenMarkerNeverAppears() {
        // Given
        when(clock.instant()).thenReturn(T0);
        when(dataStore.itemExists(eq(SECONDARY), eq(SENTINEL_TABLE), any())).thenReturn(false);

        // When
        Optional<Long> lag = prober.measureLag(REGIONS);

        // Then
        assertThat(lag).isEmpty();
        verify(dataStore, times(4)).itemExists(eq(SECONDARY), eq(SENTINEL_TABLE), any());
        verify(dataStore).deleteItem(eq(PRIMARY), eq(SENTINEL_TABLE), any());
    }

    @Test
    @DisplayName("Should keep polling through lookup errors")
    void shouldToleratePollErrors() {
        // Given
        when(clock.instant()).thenReturn(T0);
        when(dataStore.itemExists(eq(SECONDARY), eq(SENTINEL_TABLE), any()))
            .thenThrow(BackendUnavailableException.storage("us-west-2", "getItem", new RuntimeException("throttled")))
            .thenReturn(true);

        // When
        Optional<Long> lag = prober.measureLag(REGIONS);

        // Then
        assertThat(lag).contains(0L);
    }

    @Test
    @DisplayName("Should swallow a failed marker delete")
    void shouldSwallowDeleteFailure() {
        // Given
        when(clock.instant()).thenReturn(T0);
        when(dataStore.itemExists(eq(SECONDARY), eq(SENTINEL_TABLE), any())).thenReturn(true);
        doThrow(BackendUnavailableException.storage("us-east-1", "deleteItem", new RuntimeException("denied")))
            .when(dataStore).deleteItem(eq(PRIMARY), eq(SENTINEL_TABLE), any());

        // When
        Optional<Long> lag = prober.measureLag(REGIONS);

        // Then
        assertThat(lag).contains(0L);
    }

    @Test
    @DisplayName("Should return no signal without polling when the marker cannot be written")
    void shouldReturnEmptyWhenWriteFails() {
        // Given
        when(clock.instant()).thenReturn(T0);
        doThrow(BackendUnavailableException.storage("us-east-1", "putItem", new RuntimeException("denied")))
            .when(dataStore).putItem(eq(PRIMARY), eq(SENTINEL_TABLE), anyMap());

        // When
        Optional<Long> lag = prober.measureLag(REGIONS);

        // Then
        assertThat(lag).isEmpty();
        verify(dataStore, never()).itemExists(any(), any(), any());
        verify(dataStore, never()).deleteItem(any(), any(), any());
    }
}
