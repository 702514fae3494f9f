package me.golemcore.otp.domain.model;

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

/**
 * Directory attribute names and schema-class markers of a stored OTP token.
 *
 * <p>
 * All names are lower-case; the directory compares them case-insensitively.
 */
public final class TokenAttributes {

    public static final String OBJECT_CLASS = "objectclass";

    /** Generic marker carried by every token regardless of its type. */
    public static final String TOKEN_CLASS = "otptoken";

    public static final String TOKEN_ID = "tokenid";
    public static final String DESCRIPTION = "description";
    public static final String OWNER = "owner";
    public static final String MANAGED_BY = "managedby";
    public static final String DISABLED = "disabled";
    public static final String NOT_BEFORE = "notbefore";
    public static final String NOT_AFTER = "notafter";
    public static final String VENDOR = "vendor";
    public static final String MODEL = "model";
    public static final String SERIAL = "serial";

    public static final String KEY = "otpkey";
    public static final String ALGORITHM = "otpalgorithm";
    public static final String DIGITS = "otpdigits";

    public static final String TOTP_CLOCK_OFFSET = "totpclockoffset";
    public static final String TOTP_TIME_STEP = "totptimestep";
    public static final String HOTP_COUNTER = "hotpcounter";

    /** User attribute holding the Kerberos-style principal name. */
    public static final String PRINCIPAL_NAME = "principalname";

    private TokenAttributes() {
    }
}
