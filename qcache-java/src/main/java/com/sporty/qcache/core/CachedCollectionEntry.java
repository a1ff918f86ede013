package com.sporty.qcache.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * What a collection fetch leaves in the store: the identifiers that matched at write time, in result order,
 * together with the suffix and criteria that produced them.
 * <p>
 * Identifiers are read back as plain JSON values and converted to the data source's identifier type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CachedCollectionEntry {
    private String suffix;
    private Map<String, Object> criteria;
    private List<?> identifiers;
}
