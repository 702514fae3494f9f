package me.golemcore.otp.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.otp.adapter.inbound.web.dto.TokenSyncRequest;
import me.golemcore.otp.adapter.inbound.web.dto.TokenSyncResponse;
import me.golemcore.otp.domain.model.SyncRequest;
import me.golemcore.otp.domain.model.SyncStatus;
import me.golemcore.otp.domain.service.TokenSyncService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Token resynchronization endpoint.
 */
@RestController
@RequestMapping("/api/otp/sync")
@RequiredArgsConstructor
public class TokenSyncController {

    private final TokenSyncService syncService;

    @PostMapping
    public Mono<ResponseEntity<TokenSyncResponse>> sync(@RequestBody TokenSyncRequest request) {
        SyncRequest syncRequest = SyncRequest.builder()
                .user(request.getUser())
                .password(request.getPassword())
                .firstCode(request.getFirstCode())
                .secondCode(request.getSecondCode())
                .tokenId(request.getToken())
                .build();
        return Mono.fromCallable(() -> syncService.sync(syncRequest))
                .subscribeOn(Schedulers.boundedElastic())
                .map(status -> ResponseEntity.ok(toResponse(status)));
    }

    private static TokenSyncResponse toResponse(SyncStatus status) {
        return TokenSyncResponse.builder()
                .status(status.getValue())
                .message(status.getMessage())
                .build();
    }
}
