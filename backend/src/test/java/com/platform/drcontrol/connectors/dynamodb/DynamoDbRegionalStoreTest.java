package com.platform.drcontrol.connectors.dynamodb;

import com.platform.drcontrol.error.BackendUnavailableException;
import com.platform.drcontrol.error.ErrorCode;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.TableIdentifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DynamoDbRegionalStore")
class DynamoDbRegionalStoreTest {

    private static final Region REGION = Region.of("us-east-1");
    private static final TableIdentifier TABLE = TableIdentifier.of("dr-application-table");

    @Mock
    private RegionalClientFactory clientFactory;

    @Mock
    private DynamoDbClient client;

    private DynamoDbRegionalStore store;

    @BeforeEach
    void setUp() {
        when(clientFactory.dynamoDb(REGION)).thenReturn(client);
        store = new DynamoDbRegionalStore(clientFactory);
    }

    @Test
    @DisplayName("Should read the approximate item count from the table description")
    void shouldReadItemCount() {
        when(client.describeTable(any(DescribeTableRequest.class))).thenReturn(DescribeTableResponse.builder()
            .table(TableDescription.builder().itemCount(42L).build())
            .build());

        assertThat(store.approximateItemCount(REGION, TABLE)).isEqualTo(42L);
    }

    @Test
    @DisplayName("Should wrap SDK failures with region and operation")
    void shouldWrapSdkFailures() {
        when(client.describeTable(any(DescribeTableRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("no such table").build());

        assertThatThrownBy(() -> store.approximateItemCount(REGION, TABLE))
            .isInstanceOfSatisfying(BackendUnavailableException.class, e -> {
                assertThat(e.getErrorCode()).isEqualTo(ErrorCode.BACKEND_UNAVAILABLE);
                assertThat(e.getRegion()).isEqualTo("us-east-1");
                assertThat(e.getOperation()).isEqualTo("describeTable:dr-application-table");
            });
    }

    @Test
    @DisplayName("Should ping with a single-table listing")
    void shouldPingWithBoundedListing() {
        store.ping(REGION);

        ArgumentCaptor<ListTablesRequest> request = ArgumentCaptor.forClass(ListTablesRequest.class);
        verify(client).listTables(request.capture());
        assertThat(request.getValue().limit()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep key types when sampling and skip items without a key")
    void shouldSampleTypedKeys() {
        when(client.scan(any(ScanRequest.class))).thenReturn(ScanResponse.builder()
            .items(
                Map.of("id", AttributeValue.fromS("a")),
                Map.of("id", AttributeValue.fromN("7")),
                Map.of("other", AttributeValue.fromS("x")))
            .build());

        List<ItemKey> keys = store.sampleKeys(REGION, TABLE, "id", 10);

        assertThat(keys).containsExactly(
            new ItemKey("id", "a", ItemKey.KeyType.STRING),
            new ItemKey("id", "7", ItemKey.KeyType.NUMBER));
    }

    @Test
    @DisplayName("Should look items up with their original key type")
    void shouldLookUpWithTypedKey() {
        when(client.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        boolean exists = store.itemExists(REGION, TABLE, new ItemKey("id", "7", ItemKey.KeyType.NUMBER));

        assertThat(exists).isFalse();
        ArgumentCaptor<GetItemRequest> request = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(client).getItem(request.capture());
        assertThat(request.getValue().key().get("id").n()).isEqualTo("7");
    }

    @Test
    @DisplayName("Should follow pagination and convert items to plain values")
    void shouldScanAllPages() {
        when(client.scan(any(ScanRequest.class)))
            .thenReturn(ScanResponse.builder()
                .items(Map.of("id", AttributeValue.fromS("1"), "qty", AttributeValue.fromN("3")))
                .lastEvaluatedKey(Map.of("id", AttributeValue.fromS("1")))
                .build())
            .thenReturn(ScanResponse.builder()
                .items(Map.of("id", AttributeValue.fromS("2"), "flag", AttributeValue.fromBool(true)))
                .build());

        List<Map<String, Object>> items = store.scanAll(REGION, TABLE);

        assertThat(items).hasSize(2);
        assertThat(items.get(0)).containsEntry("qty", new BigDecimal("3"));
        assertThat(items.get(1)).containsEntry("flag", true);
        verify(client, times(2)).scan(any(ScanRequest.class));
    }
}
