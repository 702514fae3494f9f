package me.golemcore.otp.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.otp.adapter.inbound.web.dto.ManagersRequest;
import me.golemcore.otp.adapter.inbound.web.dto.TokenAddRequest;
import me.golemcore.otp.adapter.inbound.web.dto.TokenModRequest;
import me.golemcore.otp.domain.model.ManagerUpdateResult;
import me.golemcore.otp.domain.model.TokenOutputOptions;
import me.golemcore.otp.domain.model.TokenSearchRequest;
import me.golemcore.otp.domain.model.TokenSearchResult;
import me.golemcore.otp.domain.model.TokenView;
import me.golemcore.otp.domain.service.OtpTokenService;
import me.golemcore.otp.infrastructure.config.OtpProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * OTP token management endpoints.
 *
 * <p>
 * The calling user is taken from the principal header set by the fronting
 * authentication proxy ({@code otp.web.principal-header}). Output flags
 * {@code all}, {@code raw} and {@code pkeyOnly} are query parameters.
 */
@RestController
@RequestMapping("/api/otp/tokens")
@RequiredArgsConstructor
public class OtpTokenController {

    private final OtpTokenService tokenService;
    private final OtpProperties properties;

    @PostMapping
    public Mono<ResponseEntity<TokenView>> addToken(
            @RequestBody TokenAddRequest request,
            ServerHttpRequest httpRequest,
            @RequestParam(defaultValue = "false") boolean all,
            @RequestParam(defaultValue = "false") boolean raw) {
        TokenOutputOptions options = TokenOutputOptions.builder().all(all).raw(raw).build();
        String caller = httpRequest.getHeaders().getFirst(properties.getWeb().getPrincipalHeader());
        return blocking(() -> tokenService.add(request.toDomain(), caller, options))
                .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<TokenView>> showToken(
            @PathVariable String id,
            @RequestParam(defaultValue = "false") boolean all,
            @RequestParam(defaultValue = "false") boolean raw) {
        TokenOutputOptions options = TokenOutputOptions.builder().all(all).raw(raw).build();
        return blocking(() -> tokenService.show(id, options))
                .map(ResponseEntity::ok);
    }

    @PatchMapping("/{id}")
    public Mono<ResponseEntity<TokenView>> modifyToken(
            @PathVariable String id,
            @RequestBody TokenModRequest request,
            @RequestParam(defaultValue = "false") boolean all,
            @RequestParam(defaultValue = "false") boolean raw) {
        TokenOutputOptions options = TokenOutputOptions.builder().all(all).raw(raw).build();
        return blocking(() -> tokenService.update(id, request.toDomain(), options))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteToken(@PathVariable String id) {
        return Mono.fromRunnable(() -> tokenService.delete(id))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @GetMapping
    public Mono<ResponseEntity<TokenSearchResult>> findTokens(
            @RequestParam(required = false) String criteria,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String id,
            @RequestParam(required = false) String owner,
            @RequestParam(required = false) String description,
            @RequestParam(required = false) Boolean disabled,
            @RequestParam(required = false) String vendor,
            @RequestParam(required = false) String model,
            @RequestParam(required = false) String serial,
            @RequestParam(defaultValue = "false") boolean all,
            @RequestParam(defaultValue = "false") boolean raw,
            @RequestParam(defaultValue = "false") boolean pkeyOnly) {
        TokenSearchRequest request = TokenSearchRequest.builder()
                .criteria(criteria)
                .type(type)
                .id(id)
                .owner(owner)
                .description(description)
                .disabled(disabled)
                .vendor(vendor)
                .model(model)
                .serial(serial)
                .build();
        TokenOutputOptions options = TokenOutputOptions.builder().all(all).raw(raw).pkeyOnly(pkeyOnly).build();
        return blocking(() -> tokenService.find(request, options))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/managers")
    public Mono<ResponseEntity<ManagerUpdateResult>> addManagers(
            @PathVariable String id,
            @RequestBody ManagersRequest request,
            @RequestParam(defaultValue = "false") boolean raw) {
        TokenOutputOptions options = TokenOutputOptions.builder().raw(raw).build();
        return blocking(() -> tokenService.addManagers(id, users(request), options))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{id}/managers")
    public Mono<ResponseEntity<ManagerUpdateResult>> removeManagers(
            @PathVariable String id,
            @RequestBody ManagersRequest request,
            @RequestParam(defaultValue = "false") boolean raw) {
        TokenOutputOptions options = TokenOutputOptions.builder().raw(raw).build();
        return blocking(() -> tokenService.removeManagers(id, users(request), options))
                .map(ResponseEntity::ok);
    }

    private static List<String> users(ManagersRequest request) {
        return request.getUsers() != null ? request.getUsers() : List.of();
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
