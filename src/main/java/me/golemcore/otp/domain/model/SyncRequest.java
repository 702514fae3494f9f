package me.golemcore.otp.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Credentials and two consecutive codes used to resynchronize a token with the
 * server.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    private String user;

    @ToString.Exclude
    private String password;

    @ToString.Exclude
    private String firstCode;

    @ToString.Exclude
    private String secondCode;

    /** Optional token id; the server picks the token when absent. */
    private String tokenId;
}
