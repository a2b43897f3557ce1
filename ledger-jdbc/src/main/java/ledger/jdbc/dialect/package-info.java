/**
 * SQL dialects for H2, PostgreSQL and MySQL, discovered through {@link java.util.ServiceLoader}.
 */
package ledger.jdbc.dialect;
