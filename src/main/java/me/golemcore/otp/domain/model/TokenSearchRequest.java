package me.golemcore.otp.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token search: a free-text criteria plus optional exact-match attribute
 * options.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenSearchRequest {

    private String criteria;
    private String type;
    private String id;
    private String owner;
    private String description;
    private Boolean disabled;
    private String vendor;
    private String model;
    private String serial;
}
