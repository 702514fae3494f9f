package me.golemcore.otp.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Token as returned to callers. The key is never part of a view; {@code uri}
 * is only set on the result of a creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TokenView {

    private String id;
    private String type;
    private String uri;
    private String description;
    private String owner;
    private List<String> managedBy;
    private Boolean disabled;
    private Instant notBefore;
    private Instant notAfter;
    private String vendor;
    private String model;
    private String serial;
    private String algorithm;
    private Integer digits;
    private Integer clockOffset;
    private Integer timeStep;
    private Long counter;
    private List<String> objectClasses;
}
