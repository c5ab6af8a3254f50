/**
 * Durable records the agent edits through mirror tables: task cards, skill
 * versions and agent settings. SQLite-backed in production, in-memory in
 * TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   MirrorSynchronizer (agent module)
 *        │  seed: plain queries
 *        │  apply: one inTransaction(...) per domain
 *        ▼
 *   RecordStore        ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴────────┐
 *    │            │
 *  SqlRecordStore InMemoryRecordStore
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * task_cards      id (PK), scope_id, assigned_agent_id, title, description,
 *                 status (todo|doing|done), priority, created_at,
 *                 updated_at, completed_at
 * agent_skills    id (PK), agent_id, name, description, version, tools
 *                 (JSON array), instructions, created_at, updated_at;
 *                 unique (agent_id, name, version)
 * agent_settings  agent_id (PK), charter, schedule
 * </pre>
 *
 * Cards are visible to every agent of the same {@code scope_id} but can only
 * be changed by the agent they are assigned to; the transaction methods
 * enforce that by matching on {@code assigned_agent_id}.
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code select-visible-cards.sql}, {@code select-assigned-cards.sql},
 * {@code select-owned-card.sql} - card reads in board order</li>
 * <li>{@code insert-card.sql}, {@code update-card.sql},
 * {@code delete-card.sql} - owner-scoped card writes</li>
 * <li>{@code select-skills.sql}, {@code select-latest-skill.sql} - skill
 * versions</li>
 * <li>{@code insert-skill.sql}, {@code delete-skills.sql} - new version,
 * drop every version of a name</li>
 * <li>{@code select-settings.sql}, {@code upsert-settings.sql} - charter and
 * schedule</li>
 * </ul>
 */
package de.bsommerfeld.scratchdb.db.store;
