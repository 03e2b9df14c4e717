package com.platform.drcontrol.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.drcontrol.config.DrControlProperties;
import com.platform.drcontrol.connectors.BlobStore;
import com.platform.drcontrol.connectors.RegionalDataStore;
import com.platform.drcontrol.error.BackendUnavailableException;
import com.platform.drcontrol.error.BackupFailedException;
import com.platform.drcontrol.model.BackupRecord;
import com.platform.drcontrol.model.BackupRecordStatus;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.TableIdentifier;
import com.platform.drcontrol.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BackupManager")
class BackupManagerTest {

    private static final Region REGION = Region.of("us-east-1");
    private static final TableIdentifier TABLE = TableIdentifier.of("dr-application-table");
    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

    @Mock
    private RegionalDataStore dataStore;

    @Mock
    private BlobStore blobStore;

    @Mock
    private BackupMetadataRepository metadataRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private BackupManager backupManager;

    @BeforeEach
    void setUp() {
        backupManager = new BackupManager(
            dataStore,
            blobStore,
            metadataRepository,
            new MetricsRegistry(new SimpleMeterRegistry()),
            objectMapper,
            new DrControlProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should upload items as a JSON array and record a completed backup")
    void shouldUploadAndRecord() throws Exception {
        // Given
        List<Map<String, Object>> items = List.of(Map.of("id", "1", "name", "a"), Map.of("id", "2"));
        when(dataStore.scanAll(REGION, TABLE)).thenReturn(items);

        // When
        BackupOutcome outcome = backupManager.runBackup(TABLE, BackupType.FULL);

        // Then
        String expectedId = "dr-application-table-full-" + NOW.getEpochSecond();
        assertThat(outcome.backupId()).isEqualTo(expectedId);
        assertThat(outcome.itemsBackedUp()).isEqualTo(2);
        assertThat(outcome.objectKey()).isEqualTo("backups/dr-application-table/" + expectedId + ".json");

        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(blobStore).putJson(eq(REGION), eq("dr-demo-backup-bucket-primary"), eq(outcome.objectKey()), body.capture());
        assertThat(objectMapper.readTree(body.getValue()).size()).isEqualTo(2);

        ArgumentCaptor<BackupRecord> record = ArgumentCaptor.forClass(BackupRecord.class);
        verify(metadataRepository).save(record.capture());
        assertThat(record.getValue().status()).isEqualTo(BackupRecordStatus.COMPLETED);
        assertThat(record.getValue().itemsCount()).isEqualTo(2);
        assertThat(record.getValue().timestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should not record metadata when the upload fails")
    void shouldNotRecordWhenUploadFails() {
        // Given
        when(dataStore.scanAll(REGION, TABLE)).thenReturn(List.of());
        doThrow(BackendUnavailableException.blobStorage("us-east-1", "putObject", new RuntimeException("denied")))
            .when(blobStore).putJson(eq(REGION), anyString(), anyString(), any());

        // When / Then
        assertThatThrownBy(() -> backupManager.runBackup(TABLE, BackupType.INCREMENTAL))
            .isInstanceOf(BackupFailedException.class)
            .hasMessageContaining("dr-application-table-incremental-");
        verify(metadataRepository, never()).save(any());
    }

    @Test
    @DisplayName("Backup type defaults to full and rejects unknown values")
    void shouldParseBackupType() {
        assertThat(BackupType.fromWireName(null)).isEqualTo(BackupType.FULL);
        assertThat(BackupType.fromWireName("incremental")).isEqualTo(BackupType.INCREMENTAL);
        assertThatThrownBy(() -> BackupType.fromWireName("differential"))
            .hasMessageContaining("backup_type");
    }
}
