package io.hearthwarrio.pagelens.core.session;

import java.util.Optional;

/**
 * Named storage for page state blobs produced by {@code PageProvider#exportState}.
 */
public interface SessionStore {

    /**
     * @return location the blob was written to (for reporting)
     */
    String save(String name, byte[] state);

    Optional<byte[]> load(String name);
}
