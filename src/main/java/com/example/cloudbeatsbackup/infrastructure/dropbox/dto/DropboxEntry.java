package com.example.cloudbeatsbackup.infrastructure.dropbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DropboxEntry {

    @JsonProperty(".tag")
    private String tag;

    private String id;

    private String name;

    @JsonProperty("path_lower")
    private String pathLower;

    @JsonProperty("path_display")
    private String pathDisplay;
}
