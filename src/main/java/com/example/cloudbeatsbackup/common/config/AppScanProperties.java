package com.example.cloudbeatsbackup.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import javax.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "app.scan")
public class AppScanProperties {

    private List<String> audioExtensions = new ArrayList<>(Arrays.asList(
            "mp3", "m4a", "flac", "ogg", "opus", "wav", "wma",
            "aac", "dsf", "aiff", "aif", "ape", "wv", "mpc"));

    /**
     * Parallel tag readers. 0 means twice the available processors.
     */
    @Min(0)
    private int workers = 0;

    /**
     * Progress is logged each time this percentage of files has been read.
     */
    @Min(1)
    private int progressLogStepPct = 10;

    public Set<String> normalizedAudioExtensions() {
        return audioExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int effectiveWorkers() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors() * 2;
    }
}
