package com.example.cloudbeatsbackup.domain.model;

import java.util.Locale;

public enum RemoteEntryKind {
    FILE, FOLDER;

    /**
     * Maps a Dropbox ".tag" value. Returns null for tags that are neither files nor folders.
     */
    public static RemoteEntryKind fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        switch (tag.toLowerCase(Locale.ROOT)) {
            case "file":
                return FILE;
            case "folder":
                return FOLDER;
            default:
                return null;
        }
    }
}
