package me.golemcore.otp.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenSyncRequest {
    private String user;

    @ToString.Exclude
    private String password;

    @ToString.Exclude
    private String firstCode;

    @ToString.Exclude
    private String secondCode;

    private String token;
}
