package com.stravatalk.activity.error;

/**
 * Webhook event addressed to a push subscription other than the configured one.
 * Redelivery cannot fix it, so the sender is refused outright.
 */
public class ForeignSubscriptionException extends AuthorizationException {

    public ForeignSubscriptionException(Long subscriptionId) {
        super("Webhook event belongs to subscription " + subscriptionId);
    }
}
