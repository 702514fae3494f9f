package me.golemcore.otp.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Caller-supplied attributes for a new token. Every field is optional; unset
 * fields receive their defaults during creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenCreateRequest {

    private String id;
    private String type;
    private String description;
    private String owner;
    private List<String> managedBy;
    private Boolean disabled;
    private Instant notBefore;
    private Instant notAfter;
    private String vendor;
    private String model;
    private String serial;
    private TokenKeyInput key;
    private String algorithm;
    private Integer digits;
    private Integer clockOffset;
    private Integer timeStep;
    private Long counter;
}
