package io.tokenkeeper.sdk;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds a {@link Config} from environment variables.
 *
 * <p>
 * Recognised variables:
 * </p>
 * <ul>
 *   <li>{@code TOKENKEEPER_TOKEN_INFO_URL}, or the variable named by {@code TOKENKEEPER_TOKEN_INFO_URL_ENV_VAR}</li>
 *   <li>{@code TOKENKEEPER_FALLBACK_TOKEN_INFO_URL} (comma separated list allowed)</li>
 *   <li>{@code TOKENKEEPER_TOKEN_INFO_URL_QUERY_PARAMETER}</li>
 *   <li>{@code TOKENKEEPER_TOKEN_PROVIDER_URL}, or the variable named by {@code TOKENKEEPER_TOKEN_PROVIDER_URL_ENV_VAR}</li>
 *   <li>{@code TOKENKEEPER_FALLBACK_TOKEN_PROVIDER_URL} (comma separated list allowed)</li>
 *   <li>{@code TOKENKEEPER_TOKEN_PROVIDER_REALM}</li>
 *   <li>{@code TOKENKEEPER_CREDENTIALS_DIR}, or the variable named by {@code TOKENKEEPER_CREDENTIALS_DIR_ENV_VAR};
 *       falls back to {@code CREDENTIALS_DIR}</li>
 *   <li>{@code TOKENKEEPER_CLIENT_CREDENTIALS_FILE_NAME}, {@code TOKENKEEPER_USER_CREDENTIALS_FILE_NAME}</li>
 *   <li>{@code TOKENKEEPER_REFRESH_FACTOR}, {@code TOKENKEEPER_WARNING_FACTOR}</li>
 * </ul>
 */
public final class EnvironmentConfig {

    private static final Logger LOGGER = Logger.getLogger(EnvironmentConfig.class.getName());

    static final String PREFIX = "TOKENKEEPER_";
    static final String TOKEN_INFO_URL = PREFIX + "TOKEN_INFO_URL";
    static final String FALLBACK_TOKEN_INFO_URL = PREFIX + "FALLBACK_TOKEN_INFO_URL";
    static final String TOKEN_INFO_QUERY_PARAMETER = PREFIX + "TOKEN_INFO_URL_QUERY_PARAMETER";
    static final String TOKEN_PROVIDER_URL = PREFIX + "TOKEN_PROVIDER_URL";
    static final String FALLBACK_TOKEN_PROVIDER_URL = PREFIX + "FALLBACK_TOKEN_PROVIDER_URL";
    static final String TOKEN_PROVIDER_REALM = PREFIX + "TOKEN_PROVIDER_REALM";
    static final String CREDENTIALS_DIR = PREFIX + "CREDENTIALS_DIR";
    static final String LEGACY_CREDENTIALS_DIR = "CREDENTIALS_DIR";
    static final String CLIENT_CREDENTIALS_FILE_NAME = PREFIX + "CLIENT_CREDENTIALS_FILE_NAME";
    static final String USER_CREDENTIALS_FILE_NAME = PREFIX + "USER_CREDENTIALS_FILE_NAME";
    static final String REFRESH_FACTOR = PREFIX + "REFRESH_FACTOR";
    static final String WARNING_FACTOR = PREFIX + "WARNING_FACTOR";
    static final String ENV_VAR_SUFFIX = "_ENV_VAR";

    private EnvironmentConfig() {
    }

    public static Config fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static Config fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Config.Builder builder = Config.builder()
            .tokenInfoUrl(indirect(env, TOKEN_INFO_URL))
            .fallbackTokenInfoUrls(list(env.get(FALLBACK_TOKEN_INFO_URL)))
            .tokenInfoQueryParameter(env.get(TOKEN_INFO_QUERY_PARAMETER))
            .tokenProviderUrl(indirect(env, TOKEN_PROVIDER_URL))
            .fallbackTokenProviderUrls(list(env.get(FALLBACK_TOKEN_PROVIDER_URL)))
            .tokenProviderRealm(env.get(TOKEN_PROVIDER_REALM))
            .clientCredentialsFileName(env.get(CLIENT_CREDENTIALS_FILE_NAME))
            .userCredentialsFileName(env.get(USER_CREDENTIALS_FILE_NAME));

        String credentialsDir = indirect(env, CREDENTIALS_DIR);
        if (credentialsDir == null) {
            credentialsDir = blankToNull(env.get(LEGACY_CREDENTIALS_DIR));
        }
        if (credentialsDir != null) {
            String dir = credentialsDir;
            LOGGER.info(() -> "[tokenkeeper] credentials directory is " + dir);
            builder.credentialsDir(Path.of(dir));
        }

        Double refresh = factor(env, REFRESH_FACTOR);
        if (refresh != null) {
            builder.refreshFactor(refresh);
        }
        Double warning = factor(env, WARNING_FACTOR);
        if (warning != null) {
            builder.warningFactor(warning);
        }

        if (blankToNull(env.get(FALLBACK_TOKEN_INFO_URL)) == null && env.containsKey(TOKEN_INFO_URL)) {
            LOGGER.warning(() -> "[tokenkeeper] " + FALLBACK_TOKEN_INFO_URL + " not set, there will be no fallback URL");
        }
        return builder.build();
    }

    /**
     * Reads {@code name}, unless {@code name + "_ENV_VAR"} is set, in which case that variable names the one to read.
     */
    static String indirect(Map<String, String> env, String name) {
        String override = blankToNull(env.get(name + ENV_VAR_SUFFIX));
        if (override != null) {
            LOGGER.info(() -> "[tokenkeeper] reading " + name + " from env var " + override);
            String value = blankToNull(env.get(override));
            if (value == null) {
                throw new IllegalArgumentException("env var " + override + " named by " + name + ENV_VAR_SUFFIX
                    + " is not set");
            }
            return value;
        }
        return blankToNull(env.get(name));
    }

    private static Double factor(Map<String, String> env, String name) {
        String raw = blankToNull(env.get(name));
        if (raw == null) {
            return null;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("env var " + name + " is not a number: " + raw, ex);
        }
    }

    private static List<String> list(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return null;
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
