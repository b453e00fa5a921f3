package com.survey.codeframe.brand;

/**
 * Evidence produced by one tier. Each tier has its own record shape; fusion only sees the
 * positive and negative signal strengths, both in [0, 1].
 */
public interface TierEvidence {

    EvidenceTier tier();

    double positive();

    double negative();

    /** One-line human reading of the evidence, used in the reasoning text. */
    String summary();
}
