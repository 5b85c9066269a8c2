package com.sommerph.skillbackend.model.escrow;

/**
 * How a challenge's escrow behaves when several proofs against it are verified.
 */
public enum PayoutPolicy {

    /**
     * Every payout is deducted from the held balance. Once the balance cannot cover the
     * reward, release fails and the verification is rolled back.
     */
    DECREMENT,

    /**
     * Only the first verified proof of a challenge is paid. Later releases pay nothing.
     */
    ONCE_PER_CHALLENGE,

    /**
     * Every verified proof is paid the full reward while the held balance covers it, and the
     * held balance is never reduced. A multi-solver challenge can pay out many times its funding.
     */
    UNBOUNDED

}
