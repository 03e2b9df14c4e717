package com.platform.drcontrol.connectors.dynamodb;

import com.platform.drcontrol.connectors.RegionalDataStore;
import com.platform.drcontrol.error.BackendUnavailableException;
import com.platform.drcontrol.model.Region;
import com.platform.drcontrol.model.TableIdentifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * DynamoDB implementation of {@link RegionalDataStore}.
 * Every SDK failure is rethrown as {@link BackendUnavailableException} naming region and operation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DynamoDbRegionalStore implements RegionalDataStore {
    
    private final RegionalClientFactory clientFactory;
    
    @Override
    public void ping(Region region) {
        call(region, "listTables", () ->
            client(region).listTables(ListTablesRequest.builder().limit(1).build()));
    }
    
    @Override
    public long approximateItemCount(Region region, TableIdentifier table) {
        return call(region, "describeTable:" + table, () -> {
            Long count = client(region)
                .describeTable(DescribeTableRequest.builder().tableName(table.name()).build())
                .table()
                .itemCount();
            return count != null ? count : 0L;
        });
    }
    
    @Override
    public List<ItemKey> sampleKeys(Region region, TableIdentifier table, String keyAttribute, int limit) {
        return call(region, "scan:" + table, () -> {
            ScanResponse response = client(region).scan(ScanRequest.builder()
                .tableName(table.name())
                .limit(limit)
                .build());
            
            List<ItemKey> keys = new ArrayList<>();
            for (Map<String, AttributeValue> item : response.items()) {
                AttributeValue value = item.get(keyAttribute);
                if (value == null) {
                    log.debug("Item in {} ({}) has no {} attribute, skipping", table, region, keyAttribute);
                    continue;
                }
                toKey(keyAttribute, value).ifPresent(keys::add);
            }
            return keys;
        });
    }
    
    @Override
    public boolean itemExists(Region region, TableIdentifier table, ItemKey key) {
        return call(region, "getItem:" + table, () -> {
            GetItemResponse response = client(region).getItem(GetItemRequest.builder()
                .tableName(table.name())
                .key(Map.of(key.attribute(), toAttribute(key)))
                .build());
            return response.hasItem() && !response.item().isEmpty();
        });
    }
    
    @Override
    public void putItem(Region region, TableIdentifier table, Map<String, String> attributes) {
        Map<String, AttributeValue> item = new LinkedHashMap<>();
        attributes.forEach((name, value) -> item.put(name, AttributeValue.fromS(value)));
        
        call(region, "putItem:" + table, () ->
            client(region).putItem(PutItemRequest.builder()
                .tableName(table.name())
                .item(item)
                .build()));
    }
    
    @Override
    public void deleteItem(Region region, TableIdentifier table, ItemKey key) {
        call(region, "deleteItem:" + table, () ->
            client(region).deleteItem(DeleteItemRequest.builder()
                .tableName(table.name())
                .key(Map.of(key.attribute(), toAttribute(key)))
                .build()));
    }
    
    @Override
    public Optional<String> readAttribute(Region region, TableIdentifier table, ItemKey key, String attribute) {
        return call(region, "getItem:" + table, () -> {
            GetItemResponse response = client(region).getItem(GetItemRequest.builder()
                .tableName(table.name())
                .key(Map.of(key.attribute(), toAttribute(key)))
                .build());
            if (!response.hasItem()) {
                return Optional.<String>empty();
            }
            AttributeValue value = response.item().get(attribute);
            if (value == null) {
                return Optional.<String>empty();
            }
            return Optional.ofNullable(value.s() != null ? value.s() : value.n());
        });
    }
    
    @Override
    public List<Map<String, Object>> scanAll(Region region, TableIdentifier table) {
        return call(region, "scanAll:" + table, () -> {
            List<Map<String, Object>> items = new ArrayList<>();
            Map<String, AttributeValue> startKey = null;
            do {
                ScanRequest.Builder request = ScanRequest.builder().tableName(table.name());
                if (startKey != null) {
                    request.exclusiveStartKey(startKey);
                }
                ScanResponse page = client(region).scan(request.build());
                for (Map<String, AttributeValue> item : page.items()) {
                    items.add(AttributeValues.toPlainMap(item));
                }
                startKey = page.hasLastEvaluatedKey() && !page.lastEvaluatedKey().isEmpty()
                    ? page.lastEvaluatedKey()
                    : null;
            } while (startKey != null);
            
            log.debug("Scanned {} items from {} in {}", items.size(), table, region);
            return items;
        });
    }
    
    // ==================== Helpers ====================
    
    private DynamoDbClient client(Region region) {
        return clientFactory.dynamoDb(region);
    }
    
    private <T> T call(Region region, String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (SdkException e) {
            throw BackendUnavailableException.storage(region.id(), operation, e);
        }
    }
    
    static Optional<ItemKey> toKey(String attribute, AttributeValue value) {
        if (value.s() != null) {
            return Optional.of(new ItemKey(attribute, value.s(), ItemKey.KeyType.STRING));
        }
        if (value.n() != null) {
            return Optional.of(new ItemKey(attribute, value.n(), ItemKey.KeyType.NUMBER));
        }
        if (value.b() != null) {
            return Optional.of(new ItemKey(attribute,
                Base64.getEncoder().encodeToString(value.b().asByteArray()), ItemKey.KeyType.BINARY));
        }
        return Optional.empty();
    }
    
    static AttributeValue toAttribute(ItemKey key) {
        return switch (key.type()) {
            case STRING -> AttributeValue.fromS(key.value());
            case NUMBER -> AttributeValue.fromN(new BigDecimal(key.value()).toPlainString());
            case BINARY -> AttributeValue.fromB(SdkBytes.fromByteArray(Base64.getDecoder().decode(key.value())));
        };
    }
}
