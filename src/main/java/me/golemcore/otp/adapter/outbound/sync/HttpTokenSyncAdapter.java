package me.golemcore.otp.adapter.outbound.sync;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.otp.domain.exception.TokenSyncException;
import me.golemcore.otp.domain.model.SyncStatus;
import me.golemcore.otp.infrastructure.config.OtpProperties;
import me.golemcore.otp.port.outbound.TokenSyncPort;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Token resynchronization over HTTPS.
 *
 * <p>
 * The endpoint is derived from the server's RPC URI by replacing {@code /xml}
 * with {@code /session/sync_token}. The form is posted as
 * {@code application/x-www-form-urlencoded}; the outcome is read from the
 * result header of a 200 response. Any other status is reported as
 * {@link SyncStatus#UNKNOWN}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code otp.sync.rpc-uri} - RPC URI of the server, must be https
 * <li>{@code otp.sync.result-header} - response header carrying the result
 * </ul>
 */
@Component
@Slf4j
public class HttpTokenSyncAdapter implements TokenSyncPort {

    private final OkHttpClient httpClient;
    private final HttpUrl syncUrl;
    private final String resultHeader;

    @Autowired
    public HttpTokenSyncAdapter(OtpProperties properties, OkHttpClient httpClient) {
        this(httpClient, resolveSyncUrl(properties.getSync().getRpcUri()),
                properties.getSync().getResultHeader());
    }

    HttpTokenSyncAdapter(OkHttpClient httpClient, HttpUrl syncUrl, String resultHeader) {
        this.httpClient = httpClient;
        this.syncUrl = syncUrl;
        this.resultHeader = resultHeader;
    }

    @Override
    public SyncStatus submit(Map<String, String> form) {
        FormBody.Builder body = new FormBody.Builder();
        form.forEach((name, value) -> {
            if (value != null) {
                body.add(name, value);
            }
        });
        Request request = new Request.Builder()
                .url(syncUrl)
                .post(body.build())
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() != 200) {
                log.warn("[TokenSync] Sync endpoint answered HTTP {}", response.code());
                return SyncStatus.UNKNOWN;
            }
            return SyncStatus.fromValue(response.header(resultHeader));
        } catch (IOException e) {
            throw new TokenSyncException("Failed to contact sync endpoint " + syncUrl.host(), e);
        }
    }

    /**
     * Derive the sync endpoint from the RPC URI.
     *
     * @throws IllegalStateException
     *             when the URI is not an https URI
     */
    static HttpUrl resolveSyncUrl(String rpcUri) {
        HttpUrl rpcUrl = rpcUri != null ? HttpUrl.parse(rpcUri) : null;
        if (rpcUrl == null || !rpcUrl.isHttps()) {
            throw new IllegalStateException("Sync endpoint requires an https RPC URI, got: " + rpcUri);
        }
        String path = rpcUrl.encodedPath().replace("/xml", "/session/sync_token");
        return rpcUrl.newBuilder().encodedPath(path).build();
    }
}
