/**
 * Persistence layer for links, owners, shares, tags, users, keywords, API
 * tokens and clicks. Runs unchanged
 * on SQLite, PostgreSQL and MySQL.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [HTTP handlers / click pipeline]
 *        │
 *        ▼
 *   LinkStore · TagStore · OwnershipStore · UserStore · SqlClickStore
 *   KeywordStore · ApiTokenStore
 *        │
 *        ▼
 *   Database         ← one connection per operation, dialect session setup
 *        │
 *        ▼
 *   SqlLoader        ← sql/&lt;name&gt;.sql, overridden by sql/&lt;dialect&gt;/&lt;name&gt;.sql
 * </pre>
 *
 * The schema is created and evolved by {@link de.bsommerfeld.golinks.db.Migrator}
 * before any store is used.
 *
 * <h2>Database Schema</h2>
 * All ids are UUID strings assigned by the application. All timestamps are
 * epoch milliseconds in {@code BIGINT} columns.
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ links                                                             │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ UUID                                           │
 * │ slug (UQ)        │ lower-case short name, immutable               │
 * │ url              │ redirect target                                │
 * │ title            │ optional, '' if unset                          │
 * │ description      │ optional, '' if unset                          │
 * │ visibility       │ public, private or secure                      │
 * │ created_at       │ epoch millis                                   │
 * │ updated_at       │ epoch millis, refreshed by update              │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ link_owners                                                       │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ link_id (PK, FK) │ → links.id, cascade                            │
 * │ user_id (PK, FK) │ → users.id, cascade                            │
 * │ is_primary       │ 1 for exactly one row per link, else 0         │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ link_shares                                                       │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ link_id (PK, FK) │ → links.id, cascade                            │
 * │ user_id (PK, FK) │ → users.id, cascade                            │
 * │ shared_by (FK)   │ → users.id, no cascade                         │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ tags / link_tags                                                  │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ tags.slug (UQ)   │ derived from the name, the only upsert key     │
 * │ link_tags        │ (link_id, tag_id), cascades from both sides    │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ link_clicks (append-only)                                         │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ link_id (FK)     │ → links.id, cascade                            │
 * │ user_id (FK)     │ → users.id, SET NULL; NULL for anonymous       │
 * │ ip_hash          │ SHA-256 of ip and UTC day, never the raw IP    │
 * │ user_agent       │ at most 512 characters                         │
 * │ referrer         │ at most 2048 characters                        │
 * │ clicked_at       │ epoch millis, indexed with link_id             │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * {@code users} carries {@code (provider, subject)} as its natural key and a
 * unique {@code display_name_slug}; {@code sessions} exists for the web
 * session store and uses each engine's native blob and time types.
 * {@code keywords} holds unique lower-case keywords with URL templates;
 * {@code api_tokens} holds SHA-256 hashes of personal tokens and cascades from
 * its user.
 *
 * <h2>Dialect differences</h2>
 * <ul>
 * <li>{@code insert-tag-if-absent}: {@code ON CONFLICT (slug) DO NOTHING} on
 * SQLite and PostgreSQL, {@code INSERT IGNORE} on MySQL</li>
 * <li>{@code select-tag-after-upsert}: a locking read on MySQL, whose
 * REPEATABLE READ snapshot could otherwise miss a concurrently inserted tag</li>
 * <li>MySQL DDL uses {@code VARCHAR} for every keyed column</li>
 * <li>SQLite transactions begin IMMEDIATE so concurrent writers queue on the
 * busy timeout</li>
 * <li>The display-name slug backfill uses {@code TRIM(x, '-')},
 * {@code BTRIM} or {@code TRIM(BOTH '-' FROM x)}, and {@code UPDATE … FROM}
 * or {@code UPDATE … JOIN}</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * Stores throw {@link de.bsommerfeld.golinks.db.StoreException} only.
 * Constraint violations a caller can act on become a specific kind
 * ({@code SLUG_TAKEN}, {@code KEYWORD_TAKEN}, {@code DUPLICATE_OWNER},
 * {@code NOT_FOUND}); lock and
 * connectivity failures become {@code TRANSIENT}; everything else
 * {@code STORAGE}.
 */
package de.bsommerfeld.golinks.db;
