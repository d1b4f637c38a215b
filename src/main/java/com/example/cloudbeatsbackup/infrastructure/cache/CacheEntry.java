package com.example.cloudbeatsbackup.infrastructure.cache;

import com.example.cloudbeatsbackup.domain.model.AudioMetadata;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private FileKey key;

    private AudioMetadata meta;
}
