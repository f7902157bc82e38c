package com.govsync.audit;

/**
 * @param brokenAtLine 1-based line of the first record whose hash or link does not verify,
 *                     or {@code 0} when the chain is intact
 */
public record ChainVerification(boolean valid, int records, int brokenAtLine) {
}
