package com.proposalbus.bus;

/**
 * What a handler reports back to the bus. {@code stopPropagation} skips every
 * lower-priority tier of the current dispatch.
 */
public record HandlerResult(boolean stopPropagation, Object value) {

    private static final HandlerResult PROCEED = new HandlerResult(false, null);

    public static HandlerResult proceed() {
        return PROCEED;
    }

    public static HandlerResult proceed(Object value) {
        return new HandlerResult(false, value);
    }

    public static HandlerResult stop() {
        return new HandlerResult(true, null);
    }
}
