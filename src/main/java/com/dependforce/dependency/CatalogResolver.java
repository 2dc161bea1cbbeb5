package com.dependforce.dependency;

import java.sql.SQLException;

/**
 * Resolves identities to catalog metadata and creation scripts.
 */
public interface CatalogResolver {

    /**
     * @return the object's metadata, or null if the object does not exist
     */
    CatalogObject resolve(ObjectIdentity identity) throws SQLException;

    /**
     * @return the creation script of the object
     */
    String script(ObjectIdentity identity) throws SQLException;
}
