package com.libragraph.drive.core.directory;

import com.libragraph.drive.core.dao.FileRecord;
import com.libragraph.drive.core.dao.FolderRecord;

import java.util.List;
import java.util.UUID;

/** Immediate children of a folder (or of the owner's root when {@code folderId} is null). */
public record DirectoryListing(UUID folderId, List<FolderRecord> folders, List<FileRecord> files) {

    public boolean isEmpty() {
        return folders.isEmpty() && files.isEmpty();
    }
}
