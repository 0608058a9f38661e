package de.conciso.torrentbridge.watcher;

import de.conciso.torrentbridge.api.ActionResult;

/**
 * Receives descriptors discovered by the {@link FolderWatcher}. A non-OK result moves the
 * originating file to {@code error/}.
 */
public interface DescriptorDispatcher {

    ActionResult dispatch(TorrentDescriptor descriptor);
}
