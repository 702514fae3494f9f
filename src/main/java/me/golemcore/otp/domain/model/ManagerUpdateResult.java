package me.golemcore.otp.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of adding or removing token managers. Users that could not be
 * processed are listed in {@link #failed} with the reason, without failing the
 * whole call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManagerUpdateResult {

    private TokenView token;

    private int completed;

    @Builder.Default
    private Map<String, String> failed = new LinkedHashMap<>();
}
