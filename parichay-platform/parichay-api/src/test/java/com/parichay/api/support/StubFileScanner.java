package com.parichay.api.support;

import com.parichay.api.collaborator.FileScanner;
import com.parichay.core.domain.ChatAttachment.ScanStatus;

/**
 * File scanner returning a fixed verdict.
 */
public class StubFileScanner implements FileScanner {

    private volatile ScanStatus verdict = ScanStatus.CLEAN;
    private volatile boolean unavailable;

    public void setVerdict(ScanStatus verdict) {
        this.verdict = verdict;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void reset() {
        verdict = ScanStatus.CLEAN;
        unavailable = false;
    }

    @Override
    public ScanStatus scanFile(String path) {
        if (unavailable) {
            throw new IllegalStateException("scanner down");
        }
        return verdict;
    }
}
