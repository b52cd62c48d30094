package com.mimecast.footer.rewrite;

/**
 * Whether a message qualifies for rewriting, with the signature that decided it.
 */
public final class EligibilityDecision {

    private final boolean eligible;

    /**
     * Signature of the first text/plain part, empty if none.
     */
    private final String signature;

    /**
     * Constructs a new EligibilityDecision instance.
     *
     * @param eligible  Is eligible.
     * @param signature Signature text.
     */
    public EligibilityDecision(boolean eligible, String signature) {
        this.eligible = eligible;
        this.signature = signature;
    }

    /**
     * Decision for messages without a text/plain part.
     *
     * @return EligibilityDecision instance.
     */
    public static EligibilityDecision ineligible() {
        return new EligibilityDecision(false, "");
    }

    public boolean isEligible() {
        return eligible;
    }

    public String getSignature() {
        return signature;
    }
}
