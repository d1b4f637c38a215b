package com.example.cloudbeatsbackup.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Credentials {

    @JsonProperty("app_key")
    private String appKey;

    @JsonProperty("app_secret")
    private String appSecret;

    @JsonProperty("refresh_token")
    private String refreshToken;

    @JsonIgnore
    public boolean isComplete() {
        return hasText(appKey) && hasText(appSecret) && hasText(refreshToken);
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
