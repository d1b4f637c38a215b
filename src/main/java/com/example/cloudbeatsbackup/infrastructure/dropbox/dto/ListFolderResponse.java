package com.example.cloudbeatsbackup.infrastructure.dropbox.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ListFolderResponse {

    private List<DropboxEntry> entries = new ArrayList<>();

    private String cursor;

    @JsonProperty("has_more")
    private boolean hasMore;
}
