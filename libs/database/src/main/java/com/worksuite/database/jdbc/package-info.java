/**
 * {@link org.springframework.jdbc.core.JdbcTemplate} implementations of the engine's stores.
 * <p>
 * None of these classes cache: every call reads the current database state.
 */
package com.worksuite.database.jdbc;
