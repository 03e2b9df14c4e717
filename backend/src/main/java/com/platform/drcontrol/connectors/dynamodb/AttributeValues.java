package com.platform.drcontrol.connectors.dynamodb;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts DynamoDB attribute values to plain Java values suitable for JSON serialization.
 */
final class AttributeValues {
    
    private AttributeValues() {
    }
    
    static Map<String, Object> toPlainMap(Map<String, AttributeValue> item) {
        Map<String, Object> result = new LinkedHashMap<>();
        item.forEach((name, value) -> result.put(name, toPlain(value)));
        return result;
    }
    
    static Object toPlain(AttributeValue value) {
        if (value.s() != null) {
            return value.s();
        }
        if (value.n() != null) {
            return new BigDecimal(value.n());
        }
        if (value.bool() != null) {
            return value.bool();
        }
        if (Boolean.TRUE.equals(value.nul())) {
            return null;
        }
        if (value.b() != null) {
            return Base64.getEncoder().encodeToString(value.b().asByteArray());
        }
        if (value.hasM()) {
            return toPlainMap(value.m());
        }
        if (value.hasL()) {
            List<Object> list = new ArrayList<>();
            value.l().forEach(element -> list.add(toPlain(element)));
            return list;
        }
        if (value.hasSs()) {
            return List.copyOf(value.ss());
        }
        if (value.hasNs()) {
            return value.ns().stream().map(BigDecimal::new).toList();
        }
        if (value.hasBs()) {
            return value.bs().stream().map(b -> Base64.getEncoder().encodeToString(b.asByteArray())).toList();
        }
        return null;
    }
}
