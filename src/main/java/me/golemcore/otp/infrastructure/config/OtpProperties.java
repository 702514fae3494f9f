package me.golemcore.otp.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties of the token service, bound from
 * application.properties under the {@code otp.*} prefix.
 *
 * <ul>
 * <li>{@code otp.realm} - issuer fallback for provisioning URIs</li>
 * <li>{@code otp.base-dn} - suffix of every directory reference</li>
 * <li>{@link StorageProperties} - file-backed directory location</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link SyncProperties} - token resynchronization endpoint</li>
 * <li>{@link SearchProperties} - search limits</li>
 * <li>{@link WebProperties} - web API</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "otp")
@Data
public class OtpProperties {

    private String realm = "EXAMPLE.COM";
    private String baseDn = "dc=example,dc=com";
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private SyncProperties sync = new SyncProperties();
    private SearchProperties search = new SearchProperties();
    private WebProperties web = new WebProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/otp";
    }

    @Data
    public static class DirectoriesProperties {
        private String tokens = "tokens";
        private String users = "users";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class SyncProperties {
        /** RPC endpoint of the server; the sync path is derived from it. */
        private String rpcUri = "https://ipa.example.com/ipa/xml";
        private String resultHeader = "X-TokenSync-Result";
    }

    @Data
    public static class SearchProperties {
        private int sizeLimit = 100;
    }

    @Data
    public static class WebProperties {
        private String principalHeader = "X-Remote-User";
    }
}
