package me.golemcore.otp.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of a token. {@code null} fields are left unchanged. Type, key,
 * algorithm, digits and type-specific parameters are write-once and cannot be
 * updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUpdateRequest {

    private String description;
    private String owner;
    private List<String> managedBy;
    private Boolean disabled;
    private Instant notBefore;
    private Instant notAfter;
    private String vendor;
    private String model;
    private String serial;

    public boolean isEmpty() {
        return description == null && owner == null && managedBy == null && disabled == null
                && notBefore == null && notAfter == null && vendor == null && model == null
                && serial == null;
    }
}
