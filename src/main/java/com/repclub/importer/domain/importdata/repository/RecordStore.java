package com.repclub.importer.domain.importdata.repository;

import java.util.Map;
import java.util.Optional;

/**
 * Tenant-scoped access to the tables import modules write to.
 */
public interface RecordStore {

    /**
     * Finds the single record of the tenant whose key columns equal the given values.
     *
     * @throws org.springframework.dao.DataAccessException when the lookup fails
     *         or more than one record matches
     */
    Optional<Map<String, Object>> findOne(String tableName,
                                          String tenantColumn,
                                          String tenantId,
                                          Map<String, Object> keys);

    void insert(String tableName, Map<String, Object> values);

    /**
     * @throws org.springframework.dao.DataAccessException when the id does not match exactly one record
     */
    void update(String tableName, Object id, Map<String, Object> values);
}
