package com.flagship.missed_call.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class AdminLoginRequest {

    @JsonProperty("password")
    String password;
}
