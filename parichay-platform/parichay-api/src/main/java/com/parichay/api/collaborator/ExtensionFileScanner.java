package com.parichay.api.collaborator;

import com.parichay.core.domain.ChatAttachment.ScanStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Fallback scanner for deployments without an antivirus service. Only rejects
 * executable file types by extension; everything else is reported clean.
 */
@Component
public class ExtensionFileScanner implements FileScanner {

    private static final Logger log = LoggerFactory.getLogger(ExtensionFileScanner.class);

    private static final Set<String> BLOCKED_EXTENSIONS = Set.of("exe", "bat", "cmd", "scr", "msi", "apk", "jar", "js", "vbs");

    @Override
    public ScanStatus scanFile(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("File path is required");
        }
        int dot = path.lastIndexOf('.');
        String extension = dot < 0 ? "" : path.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (BLOCKED_EXTENSIONS.contains(extension)) {
            log.info("Rejecting executable attachment type .{}", extension);
            return ScanStatus.SUSPICIOUS;
        }
        return ScanStatus.CLEAN;
    }
}
