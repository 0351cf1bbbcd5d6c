// SPDX-License-Identifier: Apache-2.0
package org.hiero.canary.base.config;

import com.typesafe.config.Config;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.hiero.canary.common.utils.StringUtilities;

/**
 * Static credentials used to sign requests. Neither value is ever logged in clear text.
 *
 * @param accessKey the access key
 * @param secretKey the secret key
 */
@ConfigSection("canary.credentials")
public record CredentialsConfig(@NonNull String accessKey, @NonNull String secretKey) {
    /** The config path this record is read from. */
    public static final String PATH = "canary.credentials";

    /**
     * Constructor.
     */
    public CredentialsConfig {
        accessKey = Objects.requireNonNullElse(accessKey, StringUtilities.EMPTY);
        secretKey = Objects.requireNonNullElse(secretKey, StringUtilities.EMPTY);
    }

    /**
     * Read the credentials from the {@value #PATH} section of the given configuration.
     *
     * @param config the loaded configuration
     * @return the credentials configuration
     */
    @NonNull
    public static CredentialsConfig from(@NonNull final Config config) {
        final Config section = config.getConfig(PATH);
        return new CredentialsConfig(section.getString("accessKey"), section.getString("secretKey"));
    }

    /**
     * @return true if both keys have been provided
     */
    public boolean isComplete() {
        return !StringUtilities.isBlank(accessKey) && !StringUtilities.isBlank(secretKey);
    }

    @Override
    public String toString() {
        return "CredentialsConfig[accessKey=*****, secretKey=*****]";
    }
}
