package io.vellum.node;

import io.vellum.crypto.Commitment;
import io.vellum.transaction.Transaction;

import java.util.Collection;
import java.util.Map;

/**
 * Chain access needed by the wallet. Implementations report failures as
 * {@link io.vellum.node.exception.NodeClientException}; the wallet never retries.
 */
public interface NodeClient {

    long getChainHeight();

    void postTransaction(Transaction transaction);

    // Block heights of the given commitments that are currently unspent on chain; missing ones are absent.
    Map<Commitment, Long> getOutputHeights(Collection<Commitment> commitments);
}
