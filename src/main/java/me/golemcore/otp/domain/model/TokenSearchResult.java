package me.golemcore.otp.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenSearchResult {

    @Builder.Default
    private List<TokenView> tokens = new ArrayList<>();

    private int count;

    private boolean truncated;
}
