package com.nana.opsight.repository;

import com.nana.opsight.domain.Operator;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Data access contract for {@link Operator} rows.
 *
 * <p>Operator ids are supplied by the caller, so inserts never generate
 * keys. None of these methods manage transactions: they run in whatever
 * transaction is open on the shared connection.
 */
public interface OperatorRepository {

    /**
     * Inserts one operator.
     *
     * @throws IntegrityViolationException if the id already exists
     */
    void save(Operator operator);

    /**
     * Inserts all operators as a single JDBC batch.
     *
     * @param operators the operators to insert; may be empty
     * @return the number of rows inserted
     * @throws IntegrityViolationException if any id already exists
     */
    int saveAll(Collection<Operator> operators);

    Optional<Operator> findById(String operatorId);

    /**
     * Returns the subset of the given ids that already have a row.
     *
     * @param operatorIds ids to look up; may be empty
     * @return the ids that exist, never null
     */
    Set<String> findExistingIds(Collection<String> operatorIds);

    List<Operator> findByCrew(long crewId);

    long countAll();
}
