package de.bsommerfeld.golinks.db;

import de.bsommerfeld.golinks.core.domain.ClickEvent;

/**
 * Sink for click events. The click pipeline's consumer thread is the only
 * caller.
 */
public interface ClickStore {

    /**
     * Persists one click.
     *
     * @throws StoreException if the row cannot be written
     */
    void recordClick(ClickEvent event);
}
