package de.bsommerfeld.scratchdb.agent.cycle;

import de.bsommerfeld.scratchdb.agent.tools.AgentSqlTools;

import java.sql.SQLException;

/** The agent's turn inside a cycle, run after the mirrors are seeded. */
@FunctionalInterface
public interface CycleWork {

    void run(AgentSqlTools tools) throws SQLException;
}
