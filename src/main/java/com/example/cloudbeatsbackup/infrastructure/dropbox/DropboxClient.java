package com.example.cloudbeatsbackup.infrastructure.dropbox;

import com.example.cloudbeatsbackup.domain.model.RemoteEntry;
import java.util.List;

public interface DropboxClient {

    /** Account id of the token owner. */
    String getAccountId();

    /**
     * Lists every file below the given folder, following continuation cursors until the last page.
     * The Dropbox root is "" rather than "/". Folder entries are dropped.
     */
    List<RemoteEntry> listFolder(String remotePath);
}
