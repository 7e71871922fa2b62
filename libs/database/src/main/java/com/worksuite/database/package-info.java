/**
 * Persistence for the access-control engine: Flyway migrations under {@code db/migration} and
 * JDBC adapters for the store interfaces of the security and work-graph libraries.
 */
package com.worksuite.database;
