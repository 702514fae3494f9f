package me.golemcore.otp.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.otp.domain.model.TokenUpdateRequest;

import java.time.Instant;
import java.util.List;

/**
 * Body of a partial token update. Absent fields stay unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenModRequest {

    private String description;
    private String owner;
    private List<String> managedBy;
    private Boolean disabled;
    private Instant notBefore;
    private Instant notAfter;
    private String vendor;
    private String model;
    private String serial;

    public TokenUpdateRequest toDomain() {
        return TokenUpdateRequest.builder()
                .description(description)
                .owner(owner)
                .managedBy(managedBy)
                .disabled(disabled)
                .notBefore(notBefore)
                .notAfter(notAfter)
                .vendor(vendor)
                .model(model)
                .serial(serial)
                .build();
    }
}
