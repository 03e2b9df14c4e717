package com.platform.drcontrol.connectors.dynamodb;

/**
 * Identifying value of one sampled item, typed the way the store holds it.
 */
public record ItemKey(String attribute, String value, KeyType type) {
    
    public enum KeyType {
        STRING,
        NUMBER,
        BINARY
    }
    
    public static ItemKey string(String attribute, String value) {
        return new ItemKey(attribute, value, KeyType.STRING);
    }
    
    @Override
    public String toString() {
        return value;
    }
}
