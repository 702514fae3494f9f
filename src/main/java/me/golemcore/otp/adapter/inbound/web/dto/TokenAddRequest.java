package me.golemcore.otp.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import me.golemcore.otp.domain.model.TokenCreateRequest;
import me.golemcore.otp.domain.model.TokenKeyInput;

import java.time.Instant;
import java.util.List;

/**
 * Body of a token creation. The key, when given, is base32 text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenAddRequest {

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

    @ToString.Exclude
    private String key;

    @ToString.Exclude
    private String keyConfirmation;

    private String algorithm;
    private Integer digits;
    private Integer clockOffset;
    private Integer timeStep;
    private Long counter;

    public TokenCreateRequest toDomain() {
        TokenKeyInput keyInput = null;
        if (key != null) {
            keyInput = keyConfirmation != null
                    ? TokenKeyInput.ofBase32(key, keyConfirmation)
                    : TokenKeyInput.ofBase32(key);
        }
        return TokenCreateRequest.builder()
                .id(id)
                .type(type)
                .description(description)
                .owner(owner)
                .managedBy(managedBy)
                .disabled(disabled)
                .notBefore(notBefore)
                .notAfter(notAfter)
                .vendor(vendor)
                .model(model)
                .serial(serial)
                .key(keyInput)
                .algorithm(algorithm)
                .digits(digits)
                .clockOffset(clockOffset)
                .timeStep(timeStep)
                .counter(counter)
                .build();
    }
}
