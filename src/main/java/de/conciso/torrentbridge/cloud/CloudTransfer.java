package de.conciso.torrentbridge.cloud;

import de.conciso.torrentbridge.sync.TransferStatus;

/**
 * One entry of the cloud store's transfer list.
 *
 * @param status   {@code null} when the cloud store reported a status this client does not know
 * @param progress fraction in [0,1]
 * @param size     bytes, {@code null} while unknown
 */
public record CloudTransfer(String id, String title, TransferStatus status, double progress, Long size, String message) {}
