package me.golemcore.otp.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.otp.domain.model.SyncRequest;
import me.golemcore.otp.domain.model.SyncStatus;
import me.golemcore.otp.port.outbound.TokenDirectoryPort;
import me.golemcore.otp.port.outbound.TokenSyncPort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resynchronizes a token with the server from two consecutive codes.
 *
 * <p>
 * The service only assembles the form; counting and clock-drift correction
 * happen on the server.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenSyncService {

    private final TokenSyncPort syncPort;
    private final TokenDirectoryPort directoryPort;

    public SyncStatus sync(SyncRequest request) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("user", request.getUser());
        form.put("password", request.getPassword());
        form.put("first_code", request.getFirstCode());
        form.put("second_code", request.getSecondCode());
        if (request.getTokenId() != null && !request.getTokenId().isBlank()) {
            form.put("token", directoryPort.referenceOf(request.getTokenId()));
        }

        SyncStatus status = syncPort.submit(form);
        log.info("[TokenSync] Sync for user {} finished: {}", request.getUser(), status.getValue());
        return status;
    }
}
