package com.example.cloudbeatsbackup.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Validity key of a cached file: size in bytes and modification time in nanoseconds since the epoch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileKey {

    private long size;

    @JsonProperty("mod_time")
    private long modTime;
}
