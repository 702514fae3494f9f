package me.golemcore.otp.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Display options applied when a stored token is turned into a view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenOutputOptions {

    public static final TokenOutputOptions DEFAULT = new TokenOutputOptions(false, false, false);

    /** Include every attribute, schema-class markers included. */
    private boolean all;

    /** Return owner and managers as stored references. */
    private boolean raw;

    /** Return identifiers only. */
    private boolean pkeyOnly;
}
