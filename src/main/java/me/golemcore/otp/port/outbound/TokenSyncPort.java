package me.golemcore.otp.port.outbound;

import me.golemcore.otp.domain.model.SyncStatus;

import java.util.Map;

/**
 * Port for the remote token resynchronization endpoint.
 */
public interface TokenSyncPort {

    /**
     * Submit the synchronization form.
     *
     * @param form
     *            {@code user}, {@code password}, {@code first_code},
     *            {@code second_code} and optionally {@code token}
     * @return the status reported by the server
     * @throws me.golemcore.otp.domain.exception.TokenSyncException
     *             when the endpoint cannot be reached
     */
    SyncStatus submit(Map<String, String> form);
}
