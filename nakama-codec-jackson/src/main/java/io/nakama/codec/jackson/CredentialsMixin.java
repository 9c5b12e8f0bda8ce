package io.nakama.codec.jackson;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.nakama.core.AuthenticateRequest;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AuthenticateRequest.Email.class, name = "email"),
        @JsonSubTypes.Type(value = AuthenticateRequest.Device.class, name = "device"),
        @JsonSubTypes.Type(value = AuthenticateRequest.Custom.class, name = "custom")
})
abstract class CredentialsMixin {}
