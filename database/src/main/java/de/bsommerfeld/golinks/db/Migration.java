package de.bsommerfeld.golinks.db;

/**
 * One forward-only schema step.
 *
 * @param version monotonically increasing version, recorded in
 *                {@code schema_migrations} once applied
 * @param name    human readable description
 * @param file    script stem under {@code migrations/}
 */
record Migration(int version, String name, String file) {
}
