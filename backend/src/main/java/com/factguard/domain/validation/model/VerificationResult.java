package com.factguard.domain.validation.model;

/**
 * Outcome of verifying one claim.
 *
 * @param claim      the claim text
 * @param status     verified, unverified or false
 * @param confidence confidence in the status, within [0, 1]
 * @param source     the knowledge source that produced the outcome ("none" if no source answered)
 * @param details    human-readable reasoning
 * @param url        link to the supporting document (nullable)
 * @param method     lookup path used, e.g. "summary", "search", "cache", "timeout"
 */
public record VerificationResult(
        String claim,
        VerificationStatus status,
        double confidence,
        String source,
        String details,
        String url,
        String method
) {

    public static VerificationResult unverified(String claim, String details, String method) {
        return new VerificationResult(claim, VerificationStatus.UNVERIFIED, 0.3, "none", details, null, method);
    }

    public boolean isVerified() {
        return status == VerificationStatus.VERIFIED;
    }

    public boolean isFalse() {
        return status == VerificationStatus.FALSE;
    }

    public VerificationResult withClaim(String newClaim) {
        return new VerificationResult(newClaim, status, confidence, source, details, url, method);
    }

    public VerificationResult withMethod(String newMethod) {
        return new VerificationResult(claim, status, confidence, source, details, url, newMethod);
    }
}
