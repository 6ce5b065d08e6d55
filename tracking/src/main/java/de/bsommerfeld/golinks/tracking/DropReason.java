package de.bsommerfeld.golinks.tracking;

/**
 * Why a click event never reached the store. Used as the {@code reason} tag of
 * {@code golinks.clicks.dropped}.
 */
public enum DropReason {

    QUEUE_FULL("queue_full"),
    SHUTDOWN("shutdown");

    private final String tag;

    DropReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
