package io.tokenkeeper.sdk.resource;

/**
 * Resolves a bearer token presented to a resource server into the identity and scopes it carries.
 */
@FunctionalInterface
public interface TokenIntrospector {

    IntrospectionResult introspect(String bearerToken) throws IntrospectionException;
}
