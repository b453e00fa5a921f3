package com.survey.codeframe.exception;

import com.survey.codeframe.brand.EvidenceTier;

/**
 * One brand-validation tier could not be reached. Recoverable: the brand engine
 * records the tier as insufficient data and keeps going.
 */
public class EvidenceTierException extends CodeframeException {

    private final EvidenceTier tier;

    public EvidenceTierException(EvidenceTier tier, String message) {
        super(ErrorKind.EVIDENCE_TIER_ERROR, message);
        this.tier = tier;
    }

    public EvidenceTierException(EvidenceTier tier, String message, Throwable cause) {
        super(ErrorKind.EVIDENCE_TIER_ERROR, message, cause);
        this.tier = tier;
    }

    public EvidenceTier getTier() {
        return tier;
    }
}
