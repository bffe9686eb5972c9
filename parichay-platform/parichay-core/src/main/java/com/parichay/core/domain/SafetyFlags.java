package com.parichay.core.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of the deterministic content-safety detectors. One boolean per detector,
 * computed at send time and only replaced by a re-scan.
 */
@Embeddable
public class SafetyFlags {

    public static final SafetyFlags NONE = new SafetyFlags(false, false, false, false, false);

    @Column(name = "contains_phone", nullable = false)
    private boolean containsPhone;

    @Column(name = "contains_email", nullable = false)
    private boolean containsEmail;

    @Column(name = "contains_upi", nullable = false)
    private boolean containsUpi;

    @Column(name = "contains_external_link", nullable = false)
    private boolean containsExternalLink;

    @Column(name = "contains_suspicious_keyword", nullable = false)
    private boolean containsSuspiciousKeyword;

    protected SafetyFlags() {}

    public SafetyFlags(boolean containsPhone, boolean containsEmail, boolean containsUpi,
                       boolean containsExternalLink, boolean containsSuspiciousKeyword) {
        this.containsPhone = containsPhone;
        this.containsEmail = containsEmail;
        this.containsUpi = containsUpi;
        this.containsExternalLink = containsExternalLink;
        this.containsSuspiciousKeyword = containsSuspiciousKeyword;
    }

    public boolean any() {
        return containsPhone || containsEmail || containsUpi || containsExternalLink || containsSuspiciousKeyword;
    }

    /**
     * Names of the detectors that matched, in a fixed order.
     */
    public List<String> matchedDetectors() {
        List<String> matched = new ArrayList<>(5);
        if (containsPhone) matched.add("phone");
        if (containsEmail) matched.add("email");
        if (containsUpi) matched.add("upi");
        if (containsExternalLink) matched.add("external_link");
        if (containsSuspiciousKeyword) matched.add("suspicious_keyword");
        return matched;
    }

    public boolean isContainsPhone() { return containsPhone; }
    public boolean isContainsEmail() { return containsEmail; }
    public boolean isContainsUpi() { return containsUpi; }
    public boolean isContainsExternalLink() { return containsExternalLink; }
    public boolean isContainsSuspiciousKeyword() { return containsSuspiciousKeyword; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SafetyFlags that)) return false;
        return containsPhone == that.containsPhone
                && containsEmail == that.containsEmail
                && containsUpi == that.containsUpi
                && containsExternalLink == that.containsExternalLink
                && containsSuspiciousKeyword == that.containsSuspiciousKeyword;
    }

    @Override
    public int hashCode() {
        return Objects.hash(containsPhone, containsEmail, containsUpi, containsExternalLink, containsSuspiciousKeyword);
    }

    @Override
    public String toString() {
        return "SafetyFlags" + matchedDetectors();
    }
}
