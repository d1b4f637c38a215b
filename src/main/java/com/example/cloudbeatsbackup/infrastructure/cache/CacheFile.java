package com.example.cloudbeatsbackup.infrastructure.cache;

import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk layout of the tag cache.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheFile {

    public static final int CURRENT_VERSION = 1;

    private int version;

    private Map<String, CacheEntry> entries = new HashMap<>();
}
