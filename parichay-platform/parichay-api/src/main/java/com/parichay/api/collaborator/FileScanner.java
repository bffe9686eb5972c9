package com.parichay.api.collaborator;

import com.parichay.core.domain.ChatAttachment.ScanStatus;

/**
 * Antivirus collaborator of the file storage service.
 */
public interface FileScanner {

    ScanStatus scanFile(String path);
}
