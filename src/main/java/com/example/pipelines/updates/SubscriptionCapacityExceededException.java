package com.example.pipelines.updates;

public class SubscriptionCapacityExceededException extends RuntimeException {

    private final int maxActiveSubscriptions;

    public SubscriptionCapacityExceededException(int maxActiveSubscriptions) {
        super("Maximum number of subscriptions (" + maxActiveSubscriptions + ") reached");
        this.maxActiveSubscriptions = maxActiveSubscriptions;
    }

    public int maxActiveSubscriptions() {
        return maxActiveSubscriptions;
    }
}
