package com.chemdata.dwar.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.Value;

/**
 * Columns to run through the structure decoder, and columns to drop once decoded.
 */
@Value
public class DecodePlan {

    Set<String> toDecode;
    Set<String> toRemove;

    public DecodePlan(Set<String> toDecode, Set<String> toRemove) {
        this.toDecode = Collections.unmodifiableSet(new LinkedHashSet<>(toDecode));
        this.toRemove = Collections.unmodifiableSet(new LinkedHashSet<>(toRemove));
    }

    public static DecodePlan empty() {
        return new DecodePlan(Set.of(), Set.of());
    }

    public boolean isEmpty() {
        return toDecode.isEmpty();
    }
}
