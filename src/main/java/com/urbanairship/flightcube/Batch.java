/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.collect.Maps;

import java.util.Map;

/**
 * A set of cube cells keyed by {@link Address}. Ops put into a batch at an address it already
 * holds are combined with {@link Op#add(Op)}, so a batch is both the partial aggregation of one
 * chunk and the running total of a whole file.
 *
 * Cells keep the order in which their address was first seen. Not thread safe.
 */
public class Batch<T extends Op> {
    private final Map<Address, T> map;

    public Batch() {
        this.map = Maps.newLinkedHashMap();
    }

    /**
     * @param map some Ops to wrap in this Batch. The map is copied.
     */
    public Batch(Map<Address, T> map) {
        this.map = Maps.newLinkedHashMap(map);
    }

    /**
     * Combine one op into the cell at the given address.
     */
    @SuppressWarnings("unchecked")
    public void add(Address address, T op) {
        T alreadyExistingVal = map.get(address);
        if (alreadyExistingVal == null) {
            map.put(address, op);
        } else {
            map.put(address, (T) alreadyExistingVal.add(op));
        }
    }

    public void putAll(Batch<T> b) {
        this.putAll(b.getMap());
    }

    public void putAll(Map<Address, T> other) {
        for (Map.Entry<Address, T> entry : other.entrySet()) {
            add(entry.getKey(), entry.getValue());
        }
    }

    /**
     * @return a new batch holding the cell-wise sum of both batches. An address present in only
     * one of them keeps that side's op. Neither input is modified.
     */
    public static <T extends Op> Batch<T> merge(Batch<T> existing, Batch<T> partial) {
        Batch<T> merged = new Batch<T>(existing.getMap());
        merged.putAll(partial);
        return merged;
    }

    public Map<Address, T> getMap() {
        return map;
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public String toString() {
        return map.toString();
    }
}
