package com.sandboxgate.sandbox;

import java.util.LinkedHashMap;
import java.util.Map;

public record PoolStats(int totalCreated, int inUse, int available, int maxSize) {

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("total_created", totalCreated);
        map.put("in_use", inUse);
        map.put("available", available);
        map.put("max_size", maxSize);
        return map;
    }
}
