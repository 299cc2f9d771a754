package com.routemq.persistence;

import org.h2.engine.Session;
import org.h2.engine.SessionLocal;
import org.h2.jdbc.JdbcConnection;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Shrinks the file of an embedded H2 database while it is open. H2 only does
 * this by itself when the database closes.
 */
final class H2StoreCompactor {
    private static final Logger logger = LoggerFactory.getLogger(H2StoreCompactor.class);

    static final int MAX_COMPACT_MILLIS = 10_000;

    private H2StoreCompactor() {
    }

    /**
     * Compact the store behind the connection. In-memory and remote databases are left alone.
     *
     * @return true if a file was compacted
     */
    static boolean compactFile(Connection conn) throws SQLException {
        if (!conn.isWrapperFor(JdbcConnection.class)) {
            return false;
        }
        Session session = conn.unwrap(JdbcConnection.class).getSession();
        if (!(session instanceof SessionLocal)) {
            logger.debug("Skipping file compaction for a remote H2 session");
            return false;
        }

        MVStore store = ((SessionLocal) session).getDatabase().getStore().getMvStore();
        if (store.getFileStore() == null || store.isReadOnly()) {
            return false;
        }

        long sizeBefore = store.getFileStore().size();
        int retentionTime = store.getRetentionTime();
        // Chunks freed within the retention time would otherwise stay in place
        store.setRetentionTime(0);
        try {
            store.compactFile(MAX_COMPACT_MILLIS);
        } finally {
            store.setRetentionTime(retentionTime);
        }
        logger.debug("Compacted H2 store file from {} to {} bytes", sizeBefore, store.getFileStore().size());
        return true;
    }
}
