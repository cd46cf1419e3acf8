/**
 * JDBC persistence: a bounded connection pool, a retrying store adapter and the append-only
 * checkpoint log. Works against SQLite and PostgreSQL.
 */
package io.stepgraph.storage;
