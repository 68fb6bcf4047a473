package io.tokenkeeper.sdk.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * An ordered list of equivalent endpoints tried in sequence, each at most once per call.
 *
 * <p>
 * An attempt either returns a result, throws {@link EndpointFailure} to move on to the next endpoint, or throws the
 * caller's own exception type to stop immediately (authoritative answers such as a rejected client are not worth
 * asking a second endpoint about).
 * </p>
 */
public final class EndpointChain {

    private static final Logger LOGGER = Logger.getLogger(EndpointChain.class.getName());

    private final String purpose;
    private final List<String> urls;

    public EndpointChain(String purpose, List<String> urls) {
        this.purpose = Objects.requireNonNull(purpose, "purpose");
        Objects.requireNonNull(urls, "urls");
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("at least one " + purpose + " URL is required");
        }
        this.urls = List.copyOf(urls);
    }

    public List<String> urls() {
        return urls;
    }

    @FunctionalInterface
    public interface Attempt<T, E extends Exception> {
        T call(String url) throws EndpointFailure, E;
    }

    public <T, E extends Exception> T call(Attempt<T, E> attempt, Function<Exhausted, E> onExhausted) throws E {
        List<EndpointFailure> failures = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            try {
                return attempt.call(url);
            } catch (EndpointFailure failure) {
                failures.add(failure);
                boolean more = i + 1 < urls.size();
                LOGGER.warning(() -> String.format(Locale.ROOT, "[tokenkeeper] %s endpoint %s failed: %s%s",
                    purpose, stripQuery(url), failure.getMessage(), more ? ", falling back to next endpoint" : ""));
            }
        }
        throw onExhausted.apply(new Exhausted(failures));
    }

    /**
     * Removes the query string, which may carry a bearer token.
     */
    static String stripQuery(String url) {
        int idx = url.indexOf('?');
        return idx < 0 ? url : url.substring(0, idx);
    }

    /**
     * Failure of a single endpoint that justifies asking the next one.
     */
    public static final class EndpointFailure extends Exception {

        private static final long serialVersionUID = 1L;

        private final boolean malformedResponse;

        private EndpointFailure(String message, boolean malformedResponse, Throwable cause) {
            super(message, cause);
            this.malformedResponse = malformedResponse;
        }

        public static EndpointFailure unreachable(String message, Throwable cause) {
            return new EndpointFailure(message, false, cause);
        }

        public static EndpointFailure malformed(String message, Throwable cause) {
            return new EndpointFailure(message, true, cause);
        }

        public boolean isMalformedResponse() {
            return malformedResponse;
        }
    }

    /**
     * Summary of a call in which every endpoint failed.
     */
    public static final class Exhausted {

        private final List<EndpointFailure> failures;

        Exhausted(List<EndpointFailure> failures) {
            this.failures = Collections.unmodifiableList(failures);
        }

        public List<EndpointFailure> failures() {
            return failures;
        }

        public EndpointFailure last() {
            return failures.get(failures.size() - 1);
        }

        public boolean allMalformed() {
            return failures.stream().allMatch(EndpointFailure::isMalformedResponse);
        }

        public String describe() {
            StringBuilder sb = new StringBuilder();
            for (EndpointFailure failure : failures) {
                if (sb.length() > 0) {
                    sb.append("; ");
                }
                sb.append(failure.getMessage());
            }
            return sb.toString();
        }
    }
}
