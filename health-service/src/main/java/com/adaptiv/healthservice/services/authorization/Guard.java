package com.adaptiv.healthservice.services.authorization;

/**
 * A single access rule. Guards are chained with {@link #and(Guard)}; the first denial wins.
 */
@FunctionalInterface
public interface Guard {

    AccessDecision evaluate(AccessRequest request);

    default Guard and(Guard next) {
        return request -> {
            AccessDecision decision = evaluate(request);
            return decision.isPermitted() ? next.evaluate(request) : decision;
        };
    }
}
