package com.opentext.compression.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Ordered, immutable collection of item results. Iteration order is input order.
 */
public final class BatchResult implements Iterable<ItemResult> {

    private final Map<String, ItemResult> results;

    public BatchResult(List<ItemResult> ordered) {
        Map<String, ItemResult> map = new LinkedHashMap<>();
        for (ItemResult result : ordered) {
            map.put(result.id(), result);
        }
        this.results = Collections.unmodifiableMap(map);
    }

    public ItemResult get(String id) {
        ItemResult result = results.get(id);
        if (result == null) {
            throw new NoSuchElementException("No result for ID: " + id);
        }
        return result;
    }

    public boolean contains(String id) {
        return results.containsKey(id);
    }

    public ItemResult first() {
        return results.values().stream().findFirst()
                .orElseThrow(() -> new NoSuchElementException("No results available"));
    }

    public boolean allOk() {
        return results.values().stream().allMatch(ItemResult::isOk);
    }

    public List<ItemResult> successes() {
        return results.values().stream().filter(ItemResult::isOk).collect(Collectors.toList());
    }

    public List<ItemResult> failures() {
        return results.values().stream().filter(r -> !r.isOk()).collect(Collectors.toList());
    }

    public List<String> ids() {
        return List.copyOf(results.keySet());
    }

    public Map<String, ItemResult> asMap() {
        return results;
    }

    public int size() {
        return results.size();
    }

    @Override
    public Iterator<ItemResult> iterator() {
        return results.values().iterator();
    }
}
