package com.example.cloudbeatsbackup.domain.model;

import lombok.Value;

@Value
public class AuthorizationGrant {

    String refreshToken;

    String accessToken;

    String accountId;
}
